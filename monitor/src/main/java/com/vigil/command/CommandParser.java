package com.vigil.command;

import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stateless; the first matching pattern wins.
 */
public final class CommandParser {

    private static final List<CommandPattern> HEALTH_PATTERNS = List.of(
            pattern("check health of (.+?) every (\\d+) (seconds?|minutes?)",
                    m -> healthCheck(m.group(1), intervalSeconds(m.group(2), m.group(3)))),
            pattern("monitor (.+?) health every (\\d+)", m -> healthCheck(m.group(1), intervalSeconds(m.group(2), null))),
            pattern("health check (.+?) interval (\\d+)", m -> healthCheck(m.group(1), intervalSeconds(m.group(2), null))),
            pattern("ping (.+?) every (\\d+)", m -> healthCheck(m.group(1), intervalSeconds(m.group(2), null))),
            pattern("watch (.+?) health", m -> healthCheck(m.group(1), null)),
            pattern("monitor (.+)", m -> healthCheck(m.group(1), null))
    );

    private static final List<CommandPattern> ROUTING_PATTERNS = List.of(
            pattern("route (.+?) to (.+?) with (\\d+)% traffic", m -> route(m.group(1), m.group(2), m.group(3))),
            pattern("route (\\d+)% (?:of )?traffic from (.+?) to (.+)", m -> route(m.group(2), m.group(3), m.group(1))),
            pattern("send (\\d+)% of traffic from (.+?) to (.+)", m -> route(m.group(2), m.group(3), m.group(1))),
            pattern("redirect (.+?) to (.+?) at (\\d+)%", m -> route(m.group(1), m.group(2), m.group(3))),
            pattern("balance (\\d+)% traffic from (.+?) to (.+)", m -> route(m.group(2), m.group(3), m.group(1))),
            pattern("redirect (.+?) to (.+)", m -> route(m.group(1), m.group(2), null)),
            pattern("balance traffic between (.+?) and (.+)", m -> route(m.group(1), m.group(2), null)),
            pattern("failover (.+?) to (.+)", m -> route(m.group(1), m.group(2), null))
    );

    private static final List<CommandPattern> SCALING_PATTERNS = List.of(
            pattern("scale (up|down) when (.+?) (?:above|below) (\\d+)%?", m -> scale(m.group(2), m.group(3))),
            pattern("auto scale (.+?) when (.+?) (?:above|below) (\\d+)", m -> scale(m.group(2), m.group(3))),
            pattern("(?:increase|decrease) capacity when (.+?) (?:above|below) (\\d+)", m -> scale(m.group(1), m.group(2))),
            pattern("scale when (.+?) threshold (\\d+)", m -> scale(m.group(1), m.group(2)))
    );

    private static final List<CommandPattern> STATUS_PATTERNS = List.of(
            pattern("status of (.+)", m -> status(m.group(1))),
            pattern("show health of (.+)", m -> status(m.group(1))),
            pattern("check (.+?) status", m -> status(m.group(1))),
            pattern("how is (.+?) doing", m -> status(m.group(1))),
            pattern("health report for (.+)", m -> status(m.group(1))),
            pattern("show (.+?) metrics", m -> status(m.group(1)))
    );

    private static final Pattern GLOBAL_STATUS =
            Pattern.compile("show status|system status|overall health|dashboard|summary");

    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);
    private static final Pattern SCALE_UP_WORDS = Pattern.compile("\\b(?:up|increase)\\b");
    private static final Pattern SCALE_DOWN_WORDS = Pattern.compile("\\b(?:down|decrease)\\b");

    private CommandParser() {
    }

    public static Command parse(String input) {
        String text = input == null ? "" : input.toLowerCase(Locale.ROOT).trim();

        Optional<Command> command = firstMatch(HEALTH_PATTERNS, text)
                .or(() -> firstMatch(ROUTING_PATTERNS, text))
                .or(() -> firstMatch(SCALING_PATTERNS, text).map(c -> withScaleAction(c, text)))
                .or(() -> firstMatch(STATUS_PATTERNS, text));
        if (command.isPresent()) {
            return command.get();
        }

        if (GLOBAL_STATUS.matcher(text).find()) {
            return Command.builder().action(Command.Action.GET_STATUS).build();
        }
        if (text.contains("help")) {
            return Command.builder().action(Command.Action.HELP).build();
        }
        if (text.contains("clear") || text.contains("reset")) {
            return Command.builder().action(Command.Action.CLEAR).build();
        }
        return Command.builder().action(Command.Action.UNKNOWN).text(text).build();
    }

    private static Optional<Command> firstMatch(List<CommandPattern> patterns, String text) {
        for (CommandPattern candidate : patterns) {
            Matcher matcher = candidate.pattern().matcher(text);
            if (matcher.find()) {
                return Optional.of(candidate.extractor().apply(matcher));
            }
        }
        return Optional.empty();
    }

    private static Command healthCheck(String endpoint, Long intervalSeconds) {
        return Command.builder()
                .action(Command.Action.HEALTH_CHECK)
                .endpoint(endpoint.trim())
                .intervalSeconds(intervalSeconds != null ? intervalSeconds : Command.DEFAULT_INTERVAL_SECONDS)
                .build();
    }

    private static Long intervalSeconds(String amount, String unit) {
        long value = saturatedLong(amount);
        if (unit == null || !unit.startsWith("minute")) {
            return value;
        }
        return value > Long.MAX_VALUE / 60 ? Long.MAX_VALUE : value * 60;
    }

    // digit runs too long for a long saturate; range checks happen downstream
    private static long saturatedLong(String digits) {
        BigInteger value = new BigInteger(digits);
        return value.compareTo(LONG_MAX) > 0 ? Long.MAX_VALUE : value.longValue();
    }

    private static Command route(String source, String target, String weight) {
        return Command.builder()
                .action(Command.Action.ROUTE_TRAFFIC)
                .source(source.trim())
                .target(target.trim())
                .weight(weight != null ? (int) Math.min(saturatedLong(weight), Integer.MAX_VALUE) : Command.DEFAULT_WEIGHT)
                .build();
    }

    private static Command scale(String metricText, String threshold) {
        return Command.builder()
                .action(Command.Action.AUTO_SCALE)
                .metric(detectMetric(metricText))
                .threshold(Double.parseDouble(threshold))
                .build();
    }

    private static Command status(String target) {
        return Command.builder()
                .action(Command.Action.GET_STATUS)
                .target(target.trim())
                .build();
    }

    private static String detectMetric(String text) {
        if (text.contains("memory")) {
            return "memory";
        }
        if (text.contains("disk")) {
            return "disk";
        }
        if (text.contains("network")) {
            return "network";
        }
        return "cpu";
    }

    // explicit up/down wording wins, otherwise "below" means scale down
    private static Command withScaleAction(Command command, String text) {
        String action;
        if (SCALE_UP_WORDS.matcher(text).find()) {
            action = "scale_up";
        } else if (SCALE_DOWN_WORDS.matcher(text).find() || text.contains(" below ")) {
            action = "scale_down";
        } else {
            action = "scale_up";
        }
        return Command.builder()
                .action(command.getAction())
                .metric(command.getMetric())
                .threshold(command.getThreshold())
                .scaleAction(action)
                .build();
    }

    private static CommandPattern pattern(String regex, Function<Matcher, Command> extractor) {
        return new CommandPattern(Pattern.compile(regex), extractor);
    }

    private record CommandPattern(Pattern pattern, Function<Matcher, Command> extractor) {}
}

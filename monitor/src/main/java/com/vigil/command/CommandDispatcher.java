package com.vigil.command;

import com.vigil.model.ResultStatus;
import com.vigil.service.TrafficControlService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class CommandDispatcher {

    static final List<String> EXAMPLES = List.of(
            "check health of https://myapp.com every 30 seconds",
            "route 70% traffic from old-server to new-server",
            "scale up when cpu above 80%",
            "show status of myapp.com",
            "show status (for overall system)",
            "clear (to reset all configurations)");

    static final List<String> SUGGESTIONS = List.of(
            "check health of <url> every <seconds> seconds",
            "route <source> to <target> with <percentage>% traffic",
            "scale up when cpu above <percentage>%",
            "show status [of <target>]",
            "help - show available commands");

    private final TrafficControlService service;
    private final Clock clock;

    public CommandResponse execute(String commandText) {
        String text = commandText.trim();
        log.info("Processing command: {}", text);

        Command command = CommandParser.parse(text);
        Object result = dispatch(command, text);

        return new CommandResponse(text, command, result, service.getRecommendations(), clock.instant());
    }

    private Object dispatch(Command command, String text) {
        return switch (command.getAction()) {
            case HEALTH_CHECK -> service.registerEndpoint(
                    command.getEndpoint(), Duration.ofSeconds(command.getIntervalSeconds()));
            case ROUTE_TRAFFIC -> service.addTrafficRule(
                    command.getSource(), command.getTarget(), command.getWeight());
            case AUTO_SCALE -> service.addAutoScaleRule(
                    command.getMetric(), command.getThreshold(), command.getScaleAction());
            case GET_STATUS -> command.getTarget() != null
                    ? service.getStatus(command.getTarget())
                    : service.getStatus();
            case CLEAR -> service.clearAll();
            case HELP -> new HelpResult(ResultStatus.SUCCESS, "Available commands", EXAMPLES);
            case UNKNOWN -> new UnknownCommandResult(ResultStatus.ERROR,
                    "I don't understand: '" + text + "'", SUGGESTIONS);
        };
    }
}

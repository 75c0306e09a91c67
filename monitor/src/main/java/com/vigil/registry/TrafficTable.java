package com.vigil.registry;

import com.vigil.model.TrafficRule;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

@Slf4j
public class TrafficTable {

    private final List<TrafficRule> rules = new ArrayList<>();
    private final Clock clock;

    public TrafficTable(Clock clock) {
        this.clock = clock;
    }

    public synchronized TrafficRule addRule(String sourcePattern, String target, int weight, String condition) {
        int clamped = TrafficRule.clampWeight(weight);
        if (clamped != weight) {
            log.debug("Clamped traffic weight {} -> {}", weight, clamped);
        }

        TrafficRule rule = TrafficRule.builder()
                .id(rules.size() + 1)
                .sourcePattern(sourcePattern)
                .target(target)
                .weight(clamped)
                .condition(condition)
                .createdAt(clock.instant())
                .build();

        rules.add(rule);
        log.info("Added traffic rule #{}: {}% from {} to {}", rule.getId(), clamped, sourcePattern, target);
        return rule;
    }

    public synchronized List<TrafficRule> rules() {
        return List.copyOf(rules);
    }

    public synchronized int size() {
        return rules.size();
    }

    public synchronized void clear() {
        rules.clear();
    }
}

package com.vigil.registry;

import com.vigil.model.AutoScaleRule;
import com.vigil.model.ScalingAction;
import com.vigil.model.ScalingMetric;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

@Slf4j
public class AutoScaleRuleBook {

    private final List<AutoScaleRule> rules = new ArrayList<>();
    private final Clock clock;

    public AutoScaleRuleBook(Clock clock) {
        this.clock = clock;
    }

    public synchronized AutoScaleRule addRule(ScalingMetric metric, double threshold, ScalingAction action) {
        int id = rules.size() + 1;
        AutoScaleRule rule = AutoScaleRule.builder()
                .id(id)
                .metric(metric)
                .threshold(threshold)
                .action(action)
                .alarmName(AutoScaleRule.alarmName(metric, action, id))
                .createdAt(clock.instant())
                .build();

        rules.add(rule);
        log.info("Added auto-scale rule #{}: {} when {} reaches {}%", id, action, metric, threshold);
        return rule;
    }

    public synchronized List<AutoScaleRule> rules() {
        return List.copyOf(rules);
    }

    public synchronized int size() {
        return rules.size();
    }

    public synchronized void clear() {
        rules.clear();
    }
}

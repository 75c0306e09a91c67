package com.vigil.provider;

import com.vigil.model.AutoScaleRule;
import com.vigil.model.ScalingAction;
import com.vigil.model.ScalingMetric;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ScalingAlarmIntent {

    String alarmName;
    ScalingMetric metric;
    double threshold;
    ScalingAction action;
    long cooldownSeconds;

    public static ScalingAlarmIntent forRule(AutoScaleRule rule) {
        return ScalingAlarmIntent.builder()
                .alarmName(rule.getAlarmName())
                .metric(rule.getMetric())
                .threshold(rule.getThreshold())
                .action(rule.getAction())
                .cooldownSeconds(rule.getCooldown().toSeconds())
                .build();
    }
}

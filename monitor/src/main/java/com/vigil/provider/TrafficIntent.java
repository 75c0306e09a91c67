package com.vigil.provider;

import com.vigil.model.TrafficRule;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TrafficIntent {

    public static final String REASON_RULE = "traffic_rule";
    public static final String REASON_FAILOVER = "failover";

    String source;
    String target;
    int weight;
    String condition;
    String reason;

    public static TrafficIntent forRule(TrafficRule rule) {
        return TrafficIntent.builder()
                .source(rule.getSourcePattern())
                .target(rule.getTarget())
                .weight(rule.getWeight())
                .condition(rule.getCondition())
                .reason(REASON_RULE)
                .build();
    }

    public static TrafficIntent failover(String failedEndpoint, String healthyEndpoint) {
        return TrafficIntent.builder()
                .source(failedEndpoint)
                .target(healthyEndpoint)
                .weight(TrafficRule.MAX_WEIGHT)
                .reason(REASON_FAILOVER)
                .build();
    }
}

package com.vigil.command;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Command {

    public static final long DEFAULT_INTERVAL_SECONDS = 30;
    public static final int DEFAULT_WEIGHT = 100;

    Action action;
    String endpoint;
    Long intervalSeconds;
    String source;
    String target;
    Integer weight;
    String metric;
    Double threshold;
    String scaleAction;
    String text;

    public enum Action {
        HEALTH_CHECK("health_check"),
        ROUTE_TRAFFIC("route_traffic"),
        AUTO_SCALE("auto_scale"),
        GET_STATUS("get_status"),
        HELP("help"),
        CLEAR("clear"),
        UNKNOWN("unknown");

        private final String wireName;

        Action(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String getWireName() {
            return wireName;
        }
    }
}

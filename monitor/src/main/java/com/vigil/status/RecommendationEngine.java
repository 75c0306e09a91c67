package com.vigil.status;

import com.vigil.model.EndpointSnapshot;
import com.vigil.model.EndpointState;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class RecommendationEngine {

    static final double SLOW_RESPONSE_MS = 2000.0;
    static final String ALL_GOOD = "Your traffic management system is running optimally!";

    public List<String> recommend(List<EndpointSnapshot> endpoints, long recentAlerts, int trafficRules,
                                  int autoScaleRules, boolean monitoringActive) {
        List<String> recommendations = new ArrayList<>();

        List<String> unhealthy = endpoints.stream()
                .filter(e -> e.getState().needsAttention())
                .map(EndpointSnapshot::getEndpoint)
                .toList();
        if (!unhealthy.isEmpty()) {
            recommendations.add(unhealthy.size() + " endpoints are unhealthy. Check: "
                    + String.join(", ", unhealthy.subList(0, Math.min(2, unhealthy.size()))));
        }

        if (recentAlerts > 0) {
            recommendations.add(recentAlerts + " alerts in the last hour. Check system health.");
        }

        if (endpoints.size() < 2) {
            recommendations.add("Add more endpoints for redundancy and high availability.");
        }

        if (trafficRules == 0 && endpoints.size() > 1) {
            recommendations.add("Configure traffic routing rules for better load distribution.");
        }

        if (autoScaleRules == 0) {
            recommendations.add("Set up auto-scaling to handle traffic spikes automatically.");
        }

        long slow = endpoints.stream()
                .filter(e -> e.getState() == EndpointState.HEALTHY)
                .filter(e -> e.getLastResponseTimeMs() != null && e.getLastResponseTimeMs() > SLOW_RESPONSE_MS)
                .count();
        if (slow > 0) {
            recommendations.add(slow + " endpoints have slow response times (>2s).");
        }

        if (!monitoringActive && !endpoints.isEmpty()) {
            recommendations.add("Health monitoring is not active. Check system configuration.");
        }

        if (recommendations.isEmpty()) {
            recommendations.add(ALL_GOOD);
        }
        return List.copyOf(recommendations);
    }
}

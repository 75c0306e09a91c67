package com.vigil.api;

import com.vigil.model.AutoScaleRule;
import com.vigil.model.ResultStatus;
import com.vigil.model.TrafficRule;
import com.vigil.service.EndpointRegistration;
import com.vigil.service.OperationResult;
import com.vigil.service.RegistrationResult;
import com.vigil.service.RuleResult;
import com.vigil.service.TrafficControlService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class ConfigurationController {

    private final TrafficControlService service;

    @PostMapping("/endpoints")
    public ResponseEntity<?> registerEndpoint(@RequestBody RegisterEndpointRequest request) {
        if (request.url() == null || request.url().isBlank()) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "Endpoint URL is required"));
        }

        RegistrationResult result = service.registerEndpoint(new EndpointRegistration(
                request.url(),
                request.interval() != null ? Duration.ofSeconds(request.interval()) : null,
                request.expectedStatus(),
                request.timeout() != null ? Duration.ofSeconds(request.timeout()) : null,
                request.failureThreshold()));

        return respond(result.status(), HttpStatus.CREATED, result);
    }

    @DeleteMapping("/endpoints")
    public ResponseEntity<OperationResult> unregisterEndpoint(@RequestParam String url) {
        OperationResult result = service.unregisterEndpoint(url);
        if (result.status() == ResultStatus.ERROR) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(result);
        }
        return ResponseEntity.ok(result);
    }

    @GetMapping("/traffic-rules")
    public ResponseEntity<List<TrafficRule>> getTrafficRules() {
        return ResponseEntity.ok(service.getTrafficRules());
    }

    @PostMapping("/traffic-rules")
    public ResponseEntity<RuleResult<TrafficRule>> addTrafficRule(@RequestBody TrafficRuleRequest request) {
        int weight = request.weight() != null ? request.weight() : 100;
        RuleResult<TrafficRule> result =
                service.addTrafficRule(request.source(), request.target(), weight, request.condition());
        return respond(result.status(), HttpStatus.CREATED, result);
    }

    @GetMapping("/autoscale-rules")
    public ResponseEntity<List<AutoScaleRule>> getAutoScaleRules() {
        return ResponseEntity.ok(service.getAutoScaleRules());
    }

    @PostMapping("/autoscale-rules")
    public ResponseEntity<RuleResult<AutoScaleRule>> addAutoScaleRule(@RequestBody AutoScaleRuleRequest request) {
        if (request.threshold() == null) {
            return ResponseEntity.badRequest().body(RuleResult.error("Threshold is required"));
        }
        RuleResult<AutoScaleRule> result =
                service.addAutoScaleRule(request.metric(), request.threshold(), request.action());
        return respond(result.status(), HttpStatus.CREATED, result);
    }

    @PostMapping("/clear")
    public ResponseEntity<OperationResult> clearAll() {
        return ResponseEntity.ok(service.clearAll());
    }

    private static <T> ResponseEntity<T> respond(ResultStatus status, HttpStatus onSuccess, T body) {
        if (status == ResultStatus.ERROR) {
            return ResponseEntity.badRequest().body(body);
        }
        return ResponseEntity.status(onSuccess).body(body);
    }

    public record RegisterEndpointRequest(
            String url,
            Long interval,
            Integer expectedStatus,
            Long timeout,
            Integer failureThreshold
    ) {}

    public record TrafficRuleRequest(String source, String target, Integer weight, String condition) {}

    public record AutoScaleRuleRequest(String metric, Double threshold, String action) {}
}

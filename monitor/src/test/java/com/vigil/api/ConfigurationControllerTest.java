package com.vigil.api;

import com.vigil.model.ResultStatus;
import com.vigil.model.TrafficRule;
import com.vigil.service.EndpointRegistration;
import com.vigil.service.OperationResult;
import com.vigil.service.RegistrationResult;
import com.vigil.service.RuleResult;
import com.vigil.service.TrafficControlService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ConfigurationControllerTest {

    private final TrafficControlService service = mock(TrafficControlService.class);
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ConfigurationController(service))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void registersEndpoint() throws Exception {
        when(service.registerEndpoint(any(EndpointRegistration.class))).thenReturn(new RegistrationResult(
                ResultStatus.SUCCESS, "Health check configured for https://api.example.com",
                "https://api.example.com", 15L, true));

        mockMvc.perform(post("/api/endpoints")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"api.example.com\",\"interval\":15,\"failureThreshold\":2}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.endpoint").value("https://api.example.com"));

        ArgumentCaptor<EndpointRegistration> registration = ArgumentCaptor.forClass(EndpointRegistration.class);
        verify(service).registerEndpoint(registration.capture());
        assertThat(registration.getValue().interval()).isEqualTo(Duration.ofSeconds(15));
        assertThat(registration.getValue().failureThreshold()).isEqualTo(2);
        assertThat(registration.getValue().timeout()).isNull();
    }

    @Test
    void invalidRegistrationIsBadRequest() throws Exception {
        when(service.registerEndpoint(any(EndpointRegistration.class)))
                .thenReturn(RegistrationResult.error("Invalid endpoint: ftp://x"));

        mockMvc.perform(post("/api/endpoints")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"ftp://x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("error"));
    }

    @Test
    void missingUrlIsRejectedBeforeService() throws Exception {
        mockMvc.perform(post("/api/endpoints")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Endpoint URL is required"));
        verifyNoInteractions(service);
    }

    @Test
    void unregisterUnknownEndpointIsNotFound() throws Exception {
        when(service.unregisterEndpoint("nowhere.example.com"))
                .thenReturn(OperationResult.error("Endpoint not monitored: nowhere.example.com"));

        mockMvc.perform(delete("/api/endpoints").param("url", "nowhere.example.com"))
                .andExpect(status().isNotFound());
    }

    @Test
    void unregisterWithoutUrlIsBadRequest() throws Exception {
        mockMvc.perform(delete("/api/endpoints"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void degradedTrafficRuleIsStillCreated() throws Exception {
        TrafficRule rule = TrafficRule.builder()
                .id(1).sourcePattern("a").target("b").weight(100).createdAt(Instant.parse("2024-01-01T00:00:00Z"))
                .build();
        when(service.addTrafficRule(eq("a"), eq("b"), anyInt(), isNull())).thenReturn(
                new RuleResult<>(ResultStatus.DEGRADED, "Traffic rule stored but provider update failed", 1, rule));

        mockMvc.perform(post("/api/traffic-rules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source\":\"a\",\"target\":\"b\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("degraded"))
                .andExpect(jsonPath("$.ruleId").value(1))
                .andExpect(jsonPath("$.rule.weight").value(100));
        verify(service).addTrafficRule("a", "b", 100, null);
    }

    @Test
    void autoScaleRuleWithoutThresholdIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/autoscale-rules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"metric\":\"cpu\",\"action\":\"scale_up\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Threshold is required"));
    }

    @Test
    void malformedJsonIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/traffic-rules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid JSON data"));
    }

    @Test
    void clearsConfiguration() throws Exception {
        when(service.clearAll()).thenReturn(OperationResult.success("All configurations cleared and system reset"));

        mockMvc.perform(post("/api/clear"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"));
    }
}

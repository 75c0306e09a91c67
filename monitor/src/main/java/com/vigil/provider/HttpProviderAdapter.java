package com.vigil.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vigil.config.VigilProperties;
import com.vigil.model.OperatingMode;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

@Slf4j
public class HttpProviderAdapter implements ProviderAdapter {

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI baseUri;
    private final Duration timeout;

    public HttpProviderAdapter(ObjectMapper objectMapper, VigilProperties properties) {
        VigilProperties.Provider provider = properties.getProvider();
        this.objectMapper = objectMapper;
        this.baseUri = parseBaseUri(provider.getUrl());
        this.timeout = provider.getTimeout();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        log.info("HttpProviderAdapter initialized for {} with {}ms timeout", baseUri, timeout.toMillis());
    }

    @Override
    public boolean applyTrafficWeight(TrafficIntent intent) {
        return dispatch("traffic", intent);
    }

    @Override
    public boolean createScalingAlarm(ScalingAlarmIntent intent) {
        return dispatch("alarms", intent);
    }

    @Override
    public OperatingMode mode() {
        return OperatingMode.LIVE;
    }

    private boolean dispatch(String path, Object intent) {
        try {
            String body = objectMapper.writeValueAsString(intent);
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(baseUri.resolve(path))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();

            httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                    .whenComplete((response, error) -> {
                        if (error != null) {
                            log.error("Provider request to /{} failed: {}", path, error.getMessage());
                        } else if (response.statusCode() < 200 || response.statusCode() >= 300) {
                            log.warn("Provider rejected /{} with HTTP {}", path, response.statusCode());
                        } else {
                            log.debug("Provider accepted /{}: HTTP {}", path, response.statusCode());
                        }
                    });
            return true;

        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Could not dispatch intent to provider /{}: {}", path, e.getMessage());
            return false;
        }
    }

    private static URI parseBaseUri(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalStateException("vigil.provider.url is required when vigil.provider.mode=http");
        }
        URI uri = URI.create(url.endsWith("/") ? url : url + "/");
        if (uri.getHost() == null) {
            throw new IllegalStateException("vigil.provider.url has no host: " + url);
        }
        return uri;
    }
}

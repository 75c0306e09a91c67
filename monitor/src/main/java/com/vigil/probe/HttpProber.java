package com.vigil.probe;

import com.vigil.model.HealthCheckConfig;
import com.vigil.model.ProbeOutcome;
import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Slf4j
public class HttpProber implements Prober {

    static final String USER_AGENT = "Vigil-Health-Monitor/1.0";
    static final String ACCEPT = "text/html,application/json,*/*";

    private final HttpClient httpClient;

    public HttpProber(Duration connectTimeout) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        log.info("HttpProber initialized with {}ms connect timeout", connectTimeout.toMillis());
    }

    @Override
    public ProbeOutcome probe(HealthCheckConfig config) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(config.getEndpoint()))
                    .timeout(config.getTimeout())
                    .header("User-Agent", USER_AGENT)
                    .header("Accept", ACCEPT)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            return ProbeOutcome.otherError("Invalid endpoint: " + e.getMessage());
        }

        long start = System.nanoTime();
        CompletableFuture<HttpResponse<Void>> pending =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding());

        try {
            // the request timeout only covers the response headers; this bounds the whole exchange
            HttpResponse<Void> response = pending.get(config.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            double responseTimeMs = (System.nanoTime() - start) / 1_000_000.0;

            log.debug("Probe {} -> HTTP {} in {}ms", config.getEndpoint(), response.statusCode(),
                    String.format("%.2f", responseTimeMs));

            if (response.statusCode() == config.getExpectedStatus()) {
                return ProbeOutcome.success(response.statusCode(), responseTimeMs);
            }
            return ProbeOutcome.unexpectedStatus(response.statusCode(), responseTimeMs);

        } catch (TimeoutException e) {
            pending.cancel(true);
            log.debug("Probe {} timed out after {}ms", config.getEndpoint(), config.getTimeout().toMillis());
            return ProbeOutcome.timeout();

        } catch (ExecutionException e) {
            return classify(config.getEndpoint(), e.getCause());

        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            return ProbeOutcome.otherError("Probe interrupted");
        }
    }

    static ProbeOutcome classify(String endpoint, Throwable failure) {
        Throwable cause = failure;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }

        if (cause instanceof HttpTimeoutException) {
            return ProbeOutcome.timeout();
        }
        if (cause instanceof ConnectException || cause instanceof UnknownHostException
                || cause instanceof SSLException) {
            log.debug("Probe {} could not connect: {}", endpoint, cause.toString());
            return ProbeOutcome.connectionFailed();
        }
        if (cause instanceof IOException) {
            log.debug("Probe {} failed with I/O error: {}", endpoint, cause.toString());
            return ProbeOutcome.connectionFailed();
        }

        log.warn("Probe {} failed unexpectedly: {}", endpoint, cause != null ? cause.toString() : "unknown");
        String message = cause == null ? null
                : cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return ProbeOutcome.otherError(message);
    }
}

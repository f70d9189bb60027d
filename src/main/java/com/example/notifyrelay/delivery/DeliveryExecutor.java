package com.example.notifyrelay.delivery;

import com.example.notifyrelay.exception.DeliveryAbortedException;
import com.example.notifyrelay.exception.DeliveryException;
import com.example.notifyrelay.exception.RetryableDeliveryException;
import com.example.notifyrelay.exception.TerminalDeliveryException;
import com.example.notifyrelay.model.DeliveryResult;
import com.example.notifyrelay.model.Event;
import com.example.notifyrelay.model.RoutingRule;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * Sends the rendered notification to the rule's endpoint, retrying locally with
 * exponential backoff.
 * <p>
 * At most {@value #MAX_ATTEMPTS} attempts. Transport errors and any status other than 2xx
 * or {@link #TERMINAL_STATUSES} are retried; a terminal status stops the ladder at once.
 * When every attempt fails the last error is reported.
 */
@Service
@Slf4j
public class DeliveryExecutor {

    public static final int MAX_ATTEMPTS = 3;

    static final Set<Integer> TERMINAL_STATUSES = Set.of(400, 401, 403, 404);

    // Rejected by java.net.http; the client computes them itself.
    private static final Set<String> RESTRICTED_HEADERS = Set.of(
            "connection", "content-length", "expect", "host", "upgrade");

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final RetryTemplate retryTemplate;

    @Autowired
    public DeliveryExecutor(ObjectMapper objectMapper,
            @Value("${relay.delivery.connect-timeout-ms:5000}") long connectTimeoutMs,
            @Value("${relay.delivery.request-timeout-ms:10000}") long requestTimeoutMs) {
        this(objectMapper,
                HttpClient.newBuilder()
                        // no h2c upgrade headers on plain http endpoints
                        .version(HttpClient.Version.HTTP_1_1)
                        .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                        .build(),
                Duration.ofMillis(requestTimeoutMs),
                new ThreadWaitSleeper());
    }

    DeliveryExecutor(ObjectMapper objectMapper, HttpClient httpClient, Duration requestTimeout, Sleeper sleeper) {
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;

        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new SimpleRetryPolicy(MAX_ATTEMPTS,
                Map.<Class<? extends Throwable>, Boolean>of(RetryableDeliveryException.class, true)));
        template.setBackOffPolicy(new DoublingBackOffPolicy(sleeper));
        this.retryTemplate = template;
    }

    public DeliveryResult deliver(RoutingRule rule, JsonNode renderedBody, Event event) {
        HttpRequest request;
        try {
            request = buildRequest(rule, renderedBody);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Cannot build request for event {} to {}: {}", event.getId(), rule.getUrl(), e.getMessage());
            return DeliveryResult.builder()
                    .outcome(DeliveryResult.Outcome.RETRYABLE_FAILURE)
                    .message("Failed to build request: " + e.getMessage())
                    .attempts(0)
                    .build();
        }

        try {
            return retryTemplate.execute(
                    (RetryCallback<DeliveryResult, DeliveryException>) context -> {
                        int attempt = context.getRetryCount() + 1;
                        if (attempt > 1) {
                            log.info("Local retry {}/{} for event {}", attempt, MAX_ATTEMPTS, event.getId());
                        }
                        return attempt(request, event, attempt);
                    },
                    context -> exhausted(context.getLastThrowable(), context.getRetryCount(), event));
        } catch (BackOffInterruptedException e) {
            log.warn("Delivery of event {} interrupted during backoff", event.getId());
            return DeliveryResult.builder()
                    .outcome(DeliveryResult.Outcome.RETRYABLE_FAILURE)
                    .message("Delivery interrupted")
                    .build();
        }
    }

    private HttpRequest buildRequest(RoutingRule rule, JsonNode renderedBody) throws JsonProcessingException {
        String payload = objectMapper.writeValueAsString(renderedBody);
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(rule.getUrl()))
                .timeout(requestTimeout)
                .method(rule.getMethod(), HttpRequest.BodyPublishers.ofString(payload));

        if (rule.getHeaders() != null) {
            rule.getHeaders().forEach((name, value) -> {
                if (RESTRICTED_HEADERS.contains(name.toLowerCase())) {
                    log.warn("Skipping restricted header {} for {}", name, rule.getUrl());
                } else {
                    builder.setHeader(name, value);
                }
            });
        }
        return builder.build();
    }

    private DeliveryResult attempt(HttpRequest request, Event event, int attempt) {
        if (Thread.currentThread().isInterrupted()) {
            throw new DeliveryAbortedException("Delivery interrupted", null);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new RetryableDeliveryException("Request network error: " + e, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryAbortedException("Delivery interrupted", e);
        }

        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            log.info("Notification sent for event {} to {} (HTTP {})", event.getId(), request.uri(), status);
            return DeliveryResult.builder()
                    .outcome(DeliveryResult.Outcome.SUCCESS)
                    .statusCode(status)
                    .message("HTTP " + status)
                    .attempts(attempt)
                    .build();
        }
        if (TERMINAL_STATUSES.contains(status)) {
            throw new TerminalDeliveryException(
                    "Request failed with client error status " + status + ": " + response.body(), status);
        }
        throw new RetryableDeliveryException("Request failed with status " + status + ": " + response.body(), status);
    }

    private DeliveryResult exhausted(Throwable last, int attempts, Event event) {
        DeliveryResult.Outcome outcome = last instanceof TerminalDeliveryException
                ? DeliveryResult.Outcome.TERMINAL_FAILURE
                : DeliveryResult.Outcome.RETRYABLE_FAILURE;
        int status = last instanceof DeliveryException ? ((DeliveryException) last).getStatusCode() : -1;

        log.warn("Delivery of event {} failed after {} attempt(s): {}", event.getId(), attempts, last.getMessage());
        return DeliveryResult.builder()
                .outcome(outcome)
                .statusCode(status)
                .message(last.getMessage())
                .attempts(attempts)
                .build();
    }
}

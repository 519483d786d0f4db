package com.cronflow.cronflow_backend.engine.runner;

import com.cronflow.cronflow_backend.model.domain.Event;
import com.cronflow.cronflow_backend.model.run.EventExecutionResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * Executes HTTP_REQUEST events. A 2xx response is success; the body is the raw output and,
 * when it is JSON, also the scriptOutput handed to downstream nodes.
 * Without a configured body, methods that carry one send the resolved input as JSON.
 */
@Slf4j
@Component
public class HttpEventClient {

    private static final Set<String> METHODS_WITHOUT_BODY = Set.of("GET", "DELETE", "HEAD", "OPTIONS");

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpEventClient(ObjectMapper objectMapper) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), objectMapper);
    }

    HttpEventClient(HttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    public EventExecutionResult send(Event event, Map<String, Object> inputData, int timeoutSeconds) {
        if (event.getHttpUrl() == null || event.getHttpUrl().isBlank()) {
            return EventExecutionResult.error("HTTP request event " + event.getId() + " has no URL.");
        }
        String method = event.getHttpMethod() != null && !event.getHttpMethod().isBlank()
                ? event.getHttpMethod().trim().toUpperCase()
                : "GET";

        try {
            HttpRequest request = buildRequest(event, method, inputData, timeoutSeconds);
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            String body = response.body() != null ? response.body() : "";
            boolean success = response.statusCode() >= 200 && response.statusCode() < 300;
            if (!success) {
                log.warn("Event {}: {} {} returned HTTP {}", event.getId(), method, event.getHttpUrl(), response.statusCode());
                return EventExecutionResult.error("HTTP " + response.statusCode() + ": " + body);
            }
            return new EventExecutionResult(true, body, null, parseJson(body), null);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return EventExecutionResult.error("HTTP request was interrupted.");
        } catch (IOException | IllegalArgumentException e) {
            log.error("Event {}: HTTP request to {} failed: {}", event.getId(), event.getHttpUrl(), e.getMessage(), e);
            return EventExecutionResult.error("HTTP request failed: " + e.getMessage());
        }
    }

    private HttpRequest buildRequest(Event event, String method, Map<String, Object> inputData, int timeoutSeconds)
            throws JsonProcessingException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(event.getHttpUrl().trim()))
                .timeout(Duration.ofSeconds(timeoutSeconds));

        boolean hasContentType = false;
        if (event.getHttpHeaders() != null) {
            for (Map.Entry<String, String> header : event.getHttpHeaders().entrySet()) {
                builder.header(header.getKey(), header.getValue());
                hasContentType |= "content-type".equalsIgnoreCase(header.getKey());
            }
        }

        if (METHODS_WITHOUT_BODY.contains(method)) {
            return builder.method(method, HttpRequest.BodyPublishers.noBody()).build();
        }

        String body = event.getHttpBody();
        if (body == null || body.isBlank()) {
            body = objectMapper.writeValueAsString(inputData != null ? inputData : Map.of());
            if (!hasContentType) builder.header("Content-Type", "application/json");
        }
        return builder.method(method, HttpRequest.BodyPublishers.ofString(body)).build();
    }

    private Object parseJson(String body) {
        String trimmed = body.trim();
        if (!trimmed.startsWith("{") && !trimmed.startsWith("[")) return null;
        try {
            return objectMapper.readValue(trimmed, Object.class);
        } catch (JsonProcessingException e) {
            log.debug("Response body looked like JSON but did not parse: {}", e.getMessage());
            return null;
        }
    }
}

package com.imaginarium.orchestrator.node.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.imaginarium.orchestrator.node.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Calls an external HTTP endpoint, which is how pipelines reach AI providers
 * and other services.
 *
 * Config:
 * <pre>
 *   url             required
 *   method          GET | POST | PUT | DELETE (default POST)
 *   headers         map of extra request headers
 *   timeoutSeconds  per-request timeout (default 30)
 * </pre>
 *
 * The node's inputs are sent as the JSON request body (except for GET and
 * DELETE). A JSON object response is exposed on the {@code body} handle as a
 * map; anything else as a string. Provider usage is read from the
 * {@code X-Usage-Cost} and {@code X-Usage-Tokens} response headers when present.
 *
 * Status mapping: 429, 5xx, I/O errors and timeouts are TRANSIENT; any other
 * non-2xx status is PERMANENT.
 */
@Component
public class HttpRequestNode implements NodeExecutor {

    private static final Logger log = LoggerFactory.getLogger(HttpRequestNode.class);

    static final String COST_HEADER   = "X-Usage-Cost";
    static final String TOKENS_HEADER = "X-Usage-Tokens";

    private static final long CANCEL_POLL_MS = 250;

    private static final NodeTypeManifest MANIFEST = new NodeTypeManifest(
            "http-request", "1.0",
            "Sends the node inputs to an HTTP endpoint and returns the response.",
            List.of(NodeTypeManifest.ANY_HANDLE),
            List.of("body", "status"),
            false, true, null);

    private final HttpClient   http;
    private final ObjectMapper json;

    public HttpRequestNode(ObjectMapper objectMapper) {
        this.json = objectMapper;
        this.http = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public NodeTypeManifest manifest() { return MANIFEST; }

    @Override
    public NodeResult execute(Map<String, Object> config, Map<String, Object> inputs,
                              NodeExecutionContext ctx) {
        HttpRequest request = buildRequest(config, inputs);
        log.debug("HTTP {} {} (attempt {})", request.method(), request.uri(), ctx.attempt());

        HttpResponse<String> resp = send(request, ctx.cancellation());

        ErrorClassification failure = classifyStatus(resp.statusCode());
        if (failure != null) {
            throw new NodeExecutionException(failure, "HTTP_" + resp.statusCode(),
                    request.method() + " " + request.uri() + " returned HTTP "
                            + resp.statusCode() + ": " + truncate(resp.body()));
        }

        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put("body", parseBody(resp.body()));
        outputs.put("status", resp.statusCode());
        return new NodeResult(outputs, usageCost(resp), usageTokens(resp));
    }

    /**
     * Maps a response status to a failure classification.
     *
     * @return null for 2xx, otherwise how the failure should be treated
     */
    static ErrorClassification classifyStatus(int status) {
        if (status >= 200 && status < 300) return null;
        if (status == 429 || status >= 500) return ErrorClassification.TRANSIENT;
        return ErrorClassification.PERMANENT;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private HttpRequest buildRequest(Map<String, Object> config, Map<String, Object> inputs) {
        Object url = config.get("url");
        if (url == null || url.toString().isBlank()) {
            throw NodeExecutionException.permanentError("INVALID_CONFIG", "url is required");
        }
        String method = String.valueOf(config.getOrDefault("method", "POST")).toUpperCase();
        long timeoutSeconds = toLong(config.getOrDefault("timeoutSeconds", 30), 30);

        HttpRequest.Builder builder;
        try {
            builder = HttpRequest.newBuilder()
                    .uri(URI.create(url.toString()))
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .header("Accept", "application/json");
        } catch (IllegalArgumentException e) {
            throw new NodeExecutionException(ErrorClassification.PERMANENT, "INVALID_CONFIG",
                    "Invalid url '" + url + "'", e);
        }

        if (config.get("headers") instanceof Map<?, ?> headers) {
            headers.forEach((k, v) -> builder.header(String.valueOf(k), String.valueOf(v)));
        }

        switch (method) {
            case "GET"    -> builder.GET();
            case "DELETE" -> builder.DELETE();
            case "POST", "PUT" -> builder
                    .header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofString(toJson(inputs)));
            default -> throw NodeExecutionException.permanentError("INVALID_CONFIG",
                    "Unsupported method '" + method + "'");
        }
        return builder.build();
    }

    // Sends asynchronously so a cancelled run can abandon the request.
    private HttpResponse<String> send(HttpRequest request, CancellationToken cancellation) {
        CompletableFuture<HttpResponse<String>> future =
                http.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        try {
            while (true) {
                if (cancellation != null && cancellation.isCancelled()) {
                    future.cancel(true);
                    cancellation.throwIfCancelled();
                }
                try {
                    return future.get(CANCEL_POLL_MS, TimeUnit.MILLISECONDS);
                } catch (TimeoutException e) {
                    // still in flight
                }
            }
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new NodeExecutionException(ErrorClassification.TRANSIENT, "INTERRUPTED",
                    "Interrupted while calling " + request.uri(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof HttpTimeoutException) {
                throw new NodeExecutionException(ErrorClassification.TRANSIENT, "TIMEOUT",
                        "Request to " + request.uri() + " timed out", cause);
            }
            if (cause instanceof IOException) {
                throw new NodeExecutionException(ErrorClassification.TRANSIENT, "IO_ERROR",
                        "Request to " + request.uri() + " failed: " + cause.getMessage(), cause);
            }
            throw new NodeExecutionException(ErrorClassification.PERMANENT, "HTTP_ERROR",
                    "Request to " + request.uri() + " failed: " + cause, cause);
        }
    }

    private Object parseBody(String body) {
        if (body == null || body.isBlank()) return "";
        String trimmed = body.trim();
        if (trimmed.startsWith("{")) {
            try {
                return json.readValue(trimmed, new TypeReference<Map<String, Object>>() {});
            } catch (JsonProcessingException e) {
                log.debug("Response looked like JSON but did not parse: {}", e.getOriginalMessage());
            }
        }
        return body;
    }

    private String toJson(Object value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new NodeExecutionException(ErrorClassification.PERMANENT, "SERIALIZATION_ERROR",
                    "Cannot serialize request body", e);
        }
    }

    private static BigDecimal usageCost(HttpResponse<?> resp) {
        return resp.headers().firstValue(COST_HEADER)
                .map(v -> {
                    try {
                        return new BigDecimal(v.trim());
                    } catch (NumberFormatException e) {
                        log.warn("Ignoring malformed {} header '{}'", COST_HEADER, v);
                        return BigDecimal.ZERO;
                    }
                })
                .orElse(BigDecimal.ZERO);
    }

    private static long usageTokens(HttpResponse<?> resp) {
        return resp.headers().firstValue(TOKENS_HEADER).map(v -> toLong(v, 0)).orElse(0L);
    }

    private static long toLong(Object value, long fallback) {
        if (value instanceof Number n) return n.longValue();
        try {
            return Long.parseLong(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static String truncate(String s) {
        if (s == null) return "";
        return s.length() <= 500 ? s : s.substring(0, 500) + "...";
    }
}

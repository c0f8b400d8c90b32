package com.sitemonitor.service.notify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sitemonitor.core.util.JsonUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Sends through a OneBot v11 HTTP endpoint ({@code send_group_msg} / {@code send_private_msg}).
 * Non-numeric ids and {@code "status": "failed"} replies are invalid targets; HTTP errors and I/O
 * failures are plain delivery failures.
 */
public class OneBotHttpTransport implements MessageTransport {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final HttpClient httpClient;
    private final URI baseUrl;
    private final String accessToken;
    private final Duration requestTimeout;

    public OneBotHttpTransport(HttpClient httpClient, URI baseUrl, String accessToken, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl.toString().endsWith("/") ? baseUrl : URI.create(baseUrl + "/");
        this.accessToken = accessToken;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public CompletableFuture<Void> sendGroupMessage(String groupId, String text) {
        return call("send_group_msg", "group_id", groupId, text);
    }

    @Override
    public CompletableFuture<Void> sendIndividualMessage(String userId, String text) {
        return call("send_private_msg", "user_id", userId, text);
    }

    private CompletableFuture<Void> call(String action, String idField, String id, String text) {
        long numericId;
        try {
            numericId = Long.parseLong(id);
        } catch (NumberFormatException e) {
            return CompletableFuture.failedFuture(DeliveryException.invalidTarget(idField + " must be numeric: " + id));
        }

        ObjectNode body = MAPPER.createObjectNode();
        body.put(idField, numericId);
        body.put("message", text);

        HttpRequest.Builder request = HttpRequest.newBuilder(baseUrl.resolve(action))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()));
        if (accessToken != null && !accessToken.isBlank()) {
            request.header("Authorization", "Bearer " + accessToken);
        }

        return httpClient.sendAsync(request.build(), HttpResponse.BodyHandlers.ofString())
                .handle((response, error) -> {
                    if (error != null) {
                        throw DeliveryException.failed(action + " to " + id + " failed: " + error.getMessage(), error);
                    }
                    if (response.statusCode() >= 400) {
                        throw DeliveryException.failed(action + " to " + id + " returned HTTP " + response.statusCode());
                    }
                    JsonNode reply = parse(action, response.body());
                    if ("failed".equals(reply.path("status").asText())) {
                        throw DeliveryException.invalidTarget(action + " rejected " + id
                                + " (retcode " + reply.path("retcode").asInt() + ")");
                    }
                    return null;
                });
    }

    private static JsonNode parse(String action, String body) {
        try {
            return MAPPER.readTree(body == null || body.isBlank() ? "{}" : body);
        } catch (IOException e) {
            throw DeliveryException.failed(action + " returned unreadable reply", e);
        }
    }
}

package com.sitemonitor.sites.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sitemonitor.core.util.HashingUtils;
import com.sitemonitor.core.util.HtmlUtils;
import com.sitemonitor.core.util.JsonUtils;
import com.sitemonitor.sites.api.FetchException;
import com.sitemonitor.sites.api.SiteAdapter;
import com.sitemonitor.sites.api.SiteContext;

import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Watches a single HTML page. The payload records a SHA-256 of the part of the page selected by
 * the configured {@link ParseMode}; any difference in that hash counts as an update.
 */
public class WebPageSite implements SiteAdapter {
    private final WebPageSiteConfig config;

    public WebPageSite(WebPageSiteConfig config) {
        this.config = Objects.requireNonNull(config, "config is required");
    }

    @Override
    public String id() {
        return config.id();
    }

    @Override
    public String displayName() {
        return config.displayName() == null ? config.id() : config.displayName();
    }

    @Override
    public String description() {
        return config.description() == null ? config.url() : config.description();
    }

    @Override
    public String schedule() {
        return config.schedule();
    }

    @Override
    public CompletableFuture<JsonNode> fetch(SiteContext ctx) {
        HttpRequest request = HttpRequest.newBuilder(URI.create(config.url()))
                .GET()
                .timeout(ctx.requestTimeout())
                .build();

        return ctx.httpClient().sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .orTimeout(ctx.requestTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, error) -> {
                    if (error != null) {
                        throw new FetchException(id(), classifyFailureMessage(error), rootCause(error));
                    }
                    if (response.statusCode() >= 400) {
                        throw new FetchException(id(), "HTTP status " + response.statusCode() + " from " + config.url());
                    }
                    return toPayload(response.statusCode(), response.body());
                });
    }

    @Override
    public boolean compare(JsonNode previous, JsonNode latest) {
        if (previous == null) {
            return true;
        }
        return !previous.path("hash").asText("").equals(latest.path("hash").asText(""));
    }

    @Override
    public String format(JsonNode latest) {
        String title = latest.path("title").asText("");
        StringBuilder message = new StringBuilder(displayName()).append(" changed");
        if (!title.isEmpty()) {
            message.append(": ").append(title);
        }
        return message.append('\n').append(latest.path("url").asText(config.url())).toString();
    }

    JsonNode toPayload(int status, String body) {
        List<String> links = HtmlUtils.extractLinks(body);
        String title = HtmlUtils.extractTitle(body).orElse("");
        String basis = switch (config.parseModeOrDefault()) {
            case RAW_HASH -> body;
            case TEXT -> HtmlUtils.visibleText(body);
            case TITLE -> title;
            case LINKS -> String.join("\n", links.stream().sorted().toList());
        };

        ObjectNode payload = JsonUtils.objectMapper().createObjectNode();
        payload.put("url", config.url());
        payload.put("status", status);
        payload.put("hash", HashingUtils.sha256(basis));
        payload.put("title", title);
        payload.put("linkCount", links.size());
        return payload;
    }

    private String classifyFailureMessage(Throwable error) {
        Throwable root = rootCause(error);
        String rootText = root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
        String lowered = rootText.toLowerCase(Locale.ROOT);
        if (root instanceof UnknownHostException
                || lowered.contains("unknown host")
                || lowered.contains("name or service")
                || lowered.contains("nodename")) {
            return "DNS/unknown host while fetching " + config.url() + ": " + rootText;
        }
        if (root instanceof TimeoutException || lowered.contains("timed out")) {
            return "Request timed out while fetching " + config.url();
        }
        return "Fetch failure for " + config.url() + ": " + rootText;
    }

    private static Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}

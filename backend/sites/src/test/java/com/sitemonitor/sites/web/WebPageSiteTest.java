package com.sitemonitor.sites.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.sitemonitor.sites.api.FetchException;
import com.sitemonitor.sites.support.SiteContexts;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebPageSiteTest {
    private HttpServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void detectsContentChangesAcrossFetches() throws Exception {
        AtomicReference<String> body = new AtomicReference<>("<html><head><title>V1</title></head><body><a href='a'>a</a></body></html>");
        startServer(exchange -> writeResponse(exchange, 200, body.get()));
        WebPageSite site = new WebPageSite(config("page", ParseMode.TEXT));

        JsonNode first = site.fetch(SiteContexts.withSnapshots(Map.of())).join();
        JsonNode same = site.fetch(SiteContexts.withSnapshots(Map.of())).join();
        body.set("<html><head><title>V2</title></head><body><a href='a'>b</a></body></html>");
        JsonNode second = site.fetch(SiteContexts.withSnapshots(Map.of())).join();

        assertTrue(site.compare(null, first));
        assertFalse(site.compare(first, same));
        assertTrue(site.compare(first, second));
        assertEquals("V2", second.path("title").asText());
        assertEquals(1, second.path("linkCount").asInt());
        assertEquals(200, second.path("status").asInt());
    }

    @Test
    void titleModeIgnoresBodyChanges() throws Exception {
        AtomicReference<String> body = new AtomicReference<>("<html><head><title>Same</title></head><body>one</body></html>");
        startServer(exchange -> writeResponse(exchange, 200, body.get()));
        WebPageSite site = new WebPageSite(config("titles", ParseMode.TITLE));

        JsonNode first = site.fetch(SiteContexts.withSnapshots(Map.of())).join();
        body.set("<html><head><title>Same</title></head><body>two</body></html>");
        JsonNode second = site.fetch(SiteContexts.withSnapshots(Map.of())).join();

        assertFalse(site.compare(first, second));
    }

    @Test
    void rawHashModeSeesMarkupOnlyChanges() throws Exception {
        AtomicReference<String> body = new AtomicReference<>("<p class='a'>text</p>");
        startServer(exchange -> writeResponse(exchange, 200, body.get()));
        WebPageSite raw = new WebPageSite(config("raw", ParseMode.RAW_HASH));
        WebPageSite text = new WebPageSite(config("text", ParseMode.TEXT));

        JsonNode rawFirst = raw.fetch(SiteContexts.withSnapshots(Map.of())).join();
        JsonNode textFirst = text.fetch(SiteContexts.withSnapshots(Map.of())).join();
        body.set("<p class='b'>text</p>");
        JsonNode rawSecond = raw.fetch(SiteContexts.withSnapshots(Map.of())).join();
        JsonNode textSecond = text.fetch(SiteContexts.withSnapshots(Map.of())).join();

        assertNotEquals(rawFirst.path("hash").asText(), rawSecond.path("hash").asText());
        assertEquals(textFirst.path("hash").asText(), textSecond.path("hash").asText());
    }

    @Test
    void httpErrorStatusFailsTheFetch() throws Exception {
        startServer(exchange -> writeResponse(exchange, 503, "down"));
        WebPageSite site = new WebPageSite(config("down", ParseMode.TEXT));

        CompletionException ex = assertThrows(CompletionException.class,
                () -> site.fetch(SiteContexts.withSnapshots(Map.of())).join());

        FetchException fetch = assertInstanceOf(FetchException.class, ex.getCause());
        assertEquals("down", fetch.siteId());
        assertTrue(fetch.getMessage().contains("HTTP status 503"));
    }

    @Test
    void slowEndpointTimesOut() throws Exception {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.setExecutor(Executors.newCachedThreadPool());
        server.createContext("/page", exchange -> {
            try {
                Thread.sleep(500);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            writeResponse(exchange, 200, "late");
        });
        server.start();
        WebPageSite site = new WebPageSite(config("slow", ParseMode.TEXT));

        CompletionException ex = assertThrows(CompletionException.class,
                () -> site.fetch(SiteContexts.withTimeout(Duration.ofMillis(100))).join());

        assertInstanceOf(FetchException.class, ex.getCause());
        assertTrue(ex.getCause().getMessage().toLowerCase(Locale.ROOT).contains("timed out"));
    }

    @Test
    void invalidHostReportsDnsContext() {
        WebPageSite site = new WebPageSite(new WebPageSiteConfig(
                "bad-host", "Bad", null, "http://does-not-exist.invalid/path", "interval:60", null));

        CompletionException ex = assertThrows(CompletionException.class,
                () -> site.fetch(SiteContexts.withTimeout(Duration.ofMillis(500))).join());

        assertInstanceOf(FetchException.class, ex.getCause());
        assertTrue(ex.getCause().getMessage().startsWith("DNS/unknown host")
                || ex.getCause().getMessage().startsWith("Fetch failure")
                || ex.getCause().getMessage().startsWith("Request timed out"));
    }

    @Test
    void formatNamesThePageAndLink() throws Exception {
        startServer(exchange -> writeResponse(exchange, 200, "<title>Release notes</title>"));
        WebPageSiteConfig cfg = config("notes", ParseMode.TITLE);
        WebPageSite site = new WebPageSite(cfg);

        JsonNode payload = site.fetch(SiteContexts.withSnapshots(Map.of())).join();

        assertEquals("Notes changed: Release notes\n" + cfg.url(), site.format(payload));
        assertEquals("Notes page", site.description());
    }

    private WebPageSiteConfig config(String id, ParseMode mode) {
        String name = Character.toUpperCase(id.charAt(0)) + id.substring(1);
        return new WebPageSiteConfig(
                id,
                name,
                name + " page",
                "http://localhost:" + server.getAddress().getPort() + "/page",
                "*/5 * * * *",
                mode
        );
    }

    private void startServer(Handler handler) throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/page", exchange -> handler.handle(exchange));
        server.start();
    }

    private static void writeResponse(HttpExchange exchange, int code, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(code, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    @FunctionalInterface
    private interface Handler {
        void handle(HttpExchange exchange) throws IOException;
    }
}

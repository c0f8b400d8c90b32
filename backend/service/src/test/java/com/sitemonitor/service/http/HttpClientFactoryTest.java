package com.sitemonitor.service.http;

import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpClientFactoryTest {
    @Test
    void defaultClientFollowsRedirectsWithConfiguredTimeout() {
        HttpClient client = HttpClientFactory.create(Duration.ofSeconds(2), Map.of());

        assertEquals(Duration.ofSeconds(2), client.connectTimeout().orElseThrow());
        assertEquals(HttpClient.Redirect.NORMAL, client.followRedirects());
    }

    @Test
    void truststoreWithoutPasswordFailsFast() {
        IllegalStateException ex = assertThrows(IllegalStateException.class, () ->
                HttpClientFactory.create(Duration.ofSeconds(1), Map.of("TRUSTSTORE_PATH", "/tmp/none.jks")));
        assertTrue(ex.getMessage().contains("TRUSTSTORE_PASSWORD"));
    }

    @Test
    void missingTruststoreFileFailsFast() throws Exception {
        Path missing = Files.createTempDirectory("truststore-").resolve("missing.p12");
        IllegalStateException ex = assertThrows(IllegalStateException.class, () ->
                HttpClientFactory.create(Duration.ofSeconds(1), Map.of(
                        "TRUSTSTORE_PATH", missing.toString(),
                        "TRUSTSTORE_PASSWORD", "changeit"
                )));
        assertTrue(ex.getMessage().contains("does not exist"));
    }

    @Test
    void storeTypeFollowsExtension() {
        assertEquals("PKCS12", HttpClientFactory.storeType(Path.of("certs/store.p12")));
        assertEquals("PKCS12", HttpClientFactory.storeType(Path.of("STORE.PFX")));
        assertEquals("JKS", HttpClientFactory.storeType(Path.of("cacerts")));
    }
}

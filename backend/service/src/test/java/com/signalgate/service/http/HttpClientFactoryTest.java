package com.signalgate.service.http;

import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpClientFactoryTest {
    @Test
    void defaultClientFollowsRedirectsWithoutCustomTrust() {
        HttpClient client = HttpClientFactory.create(Duration.ofMillis(200), Map.of());

        assertEquals(HttpClient.Redirect.NORMAL, client.followRedirects());
        assertEquals(Duration.ofMillis(200), client.connectTimeout().orElseThrow());
        assertTrue(HttpClientFactory.customTrust(Map.of("TRUSTSTORE_PATH", " ")).isEmpty());
    }

    @Test
    void truststoreNeedsPasswordAndExistingFile() {
        IllegalStateException noPassword = assertThrows(IllegalStateException.class,
                () -> HttpClientFactory.create(Duration.ofMillis(200), Map.of("TRUSTSTORE_PATH", "/tmp/store.jks")));
        IllegalStateException missing = assertThrows(IllegalStateException.class,
                () -> HttpClientFactory.create(Duration.ofMillis(200), Map.of(
                        "TRUSTSTORE_PATH", "/tmp/does-not-exist-signalgate.jks",
                        "TRUSTSTORE_PASSWORD", "changeit")));

        assertTrue(noPassword.getMessage().contains("TRUSTSTORE_PASSWORD must be set"));
        assertTrue(missing.getMessage().contains("Truststore file does not exist"));
    }

    @Test
    void loadsJksAndPkcs12Truststores() throws Exception {
        Path jks = Files.createTempFile("truststore-", ".jks");
        Path p12 = Files.createTempFile("truststore-", ".p12");
        writeEmptyTruststore(jks, "JKS", "changeit".toCharArray());
        writeEmptyTruststore(p12, "PKCS12", "changeit".toCharArray());

        assertTrue(HttpClientFactory.customTrust(Map.of(
                "TRUSTSTORE_PATH", jks.toString(), "TRUSTSTORE_PASSWORD", "changeit")).isPresent());
        assertTrue(HttpClientFactory.customTrust(Map.of(
                "TRUSTSTORE_PATH", p12.toString(), "TRUSTSTORE_PASSWORD", "changeit")).isPresent());
        assertEquals("PKCS12", HttpClientFactory.storeType(p12));
        assertEquals("JKS", HttpClientFactory.storeType(jks));
    }

    @Test
    void wrongPasswordFailsWithTruststoreInMessage() throws Exception {
        Path truststore = Files.createTempFile("truststore-", ".jks");
        writeEmptyTruststore(truststore, "JKS", "correct-password".toCharArray());

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> HttpClientFactory.create(Duration.ofMillis(200), Map.of(
                        "TRUSTSTORE_PATH", truststore.toString(),
                        "TRUSTSTORE_PASSWORD", "wrong-password")));

        assertTrue(error.getMessage().contains("Failed to build SSL context from truststore"));
    }

    private static void writeEmptyTruststore(Path file, String type, char[] password) throws Exception {
        KeyStore keyStore = KeyStore.getInstance(type);
        keyStore.load(null, password);
        try (OutputStream out = Files.newOutputStream(file)) {
            keyStore.store(out, password);
        }
    }
}

package com.signalgate.service.http;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Shared client for feed polling and webhook delivery. Follows normal redirects, since feed hosts commonly move
 * to https. A custom truststore can be supplied through {@code TRUSTSTORE_PATH} and {@code TRUSTSTORE_PASSWORD}.
 */
public final class HttpClientFactory {
    static final String TRUSTSTORE_PATH = "TRUSTSTORE_PATH";
    static final String TRUSTSTORE_PASSWORD = "TRUSTSTORE_PASSWORD";

    private HttpClientFactory() {
    }

    public static HttpClient create(Duration connectTimeout) {
        return create(connectTimeout, System.getenv());
    }

    static HttpClient create(Duration connectTimeout, Map<String, String> environment) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL);
        customTrust(environment).ifPresent(builder::sslContext);
        return builder.build();
    }

    static Optional<SSLContext> customTrust(Map<String, String> environment) {
        String location = environment.get(TRUSTSTORE_PATH);
        if (location == null || location.isBlank()) {
            return Optional.empty();
        }
        String password = environment.get(TRUSTSTORE_PASSWORD);
        if (password == null) {
            throw new IllegalStateException(TRUSTSTORE_PASSWORD + " must be set when " + TRUSTSTORE_PATH + " is configured");
        }
        Path path = Path.of(location);
        if (!Files.isRegularFile(path)) {
            throw new IllegalStateException("Truststore file does not exist: " + path);
        }

        try (InputStream in = Files.newInputStream(path)) {
            KeyStore keyStore = KeyStore.getInstance(storeType(path));
            keyStore.load(in, password.toCharArray());
            TrustManagerFactory trustManagers = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            trustManagers.init(keyStore);
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, trustManagers.getTrustManagers(), new SecureRandom());
            return Optional.of(context);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to build SSL context from truststore " + path, e);
        }
    }

    static String storeType(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return fileName.endsWith(".p12") || fileName.endsWith(".pfx") || fileName.endsWith(".pkcs12") ? "PKCS12" : "JKS";
    }
}

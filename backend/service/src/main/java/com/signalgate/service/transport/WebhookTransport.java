package com.signalgate.service.transport;

import com.signalgate.core.util.JsonUtils;
import com.signalgate.lifecycle.dispatch.Transport;
import com.signalgate.lifecycle.dispatch.TransportResult;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Posts {@code {"text": message}} to the destination URL. Any 2xx response counts as delivered.
 */
public class WebhookTransport implements Transport {
    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public WebhookTransport(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public TransportResult send(String destination, String message) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(destination))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(JsonUtils.toJson(Map.of("text", message))))
                    .build();
        } catch (IllegalArgumentException e) {
            return TransportResult.failure("Invalid destination URL: " + destination);
        }

        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            if (status >= 200 && status < 300) {
                return TransportResult.success("HTTP " + status);
            }
            return TransportResult.failure("HTTP " + status + " from destination");
        } catch (IOException e) {
            return TransportResult.failure(e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TransportResult.failure("Interrupted while sending");
        }
    }
}

package com.signalgate.service.support;

import com.signalgate.lifecycle.dispatch.Transport;
import com.signalgate.lifecycle.dispatch.TransportResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Records messages per destination; can be switched into an outage.
 */
public class RecordingTransport implements Transport {
    private final List<Sent> sent = new ArrayList<>();
    private volatile boolean down;

    @Override
    public synchronized TransportResult send(String destination, String message) {
        if (down) {
            return TransportResult.failure("503 from " + destination);
        }
        sent.add(new Sent(destination, message));
        return TransportResult.success("200");
    }

    public void setDown(boolean down) {
        this.down = down;
    }

    public synchronized List<Sent> sent() {
        return List.copyOf(sent);
    }

    public synchronized List<Sent> sentTo(String destination) {
        return sent.stream().filter(message -> message.destination().equals(destination)).toList();
    }

    public record Sent(String destination, String message) {
    }
}

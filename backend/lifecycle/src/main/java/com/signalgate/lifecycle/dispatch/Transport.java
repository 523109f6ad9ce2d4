package com.signalgate.lifecycle.dispatch;

/**
 * Outbound message channel. Implementations must bound every call with a timeout and must not retry on
 * their own; a failure is reported, not thrown.
 */
public interface Transport {
    TransportResult send(String destination, String message);
}

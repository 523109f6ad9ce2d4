package com.signalgate.lifecycle.dispatch;

public record TransportResult(boolean success, String detail) {
    public static TransportResult success(String detail) {
        return new TransportResult(true, detail);
    }

    public static TransportResult failure(String detail) {
        return new TransportResult(false, detail);
    }
}

package com.signalgate.lifecycle.store;

import com.signalgate.core.model.Signal;

public record UpdateResult(Status status, Signal signal) {
    public enum Status {
        UPDATED,
        NOT_FOUND,
        PRECONDITION_FAILED
    }

    public static UpdateResult updated(Signal signal) {
        return new UpdateResult(Status.UPDATED, signal);
    }

    public static UpdateResult notFound() {
        return new UpdateResult(Status.NOT_FOUND, null);
    }

    public static UpdateResult preconditionFailed(Signal current) {
        return new UpdateResult(Status.PRECONDITION_FAILED, current);
    }

    public boolean applied() {
        return status == Status.UPDATED;
    }
}

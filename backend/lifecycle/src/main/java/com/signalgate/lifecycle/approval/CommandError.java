package com.signalgate.lifecycle.approval;

public enum CommandError {
    NOT_FOUND,
    ALREADY_PROCESSED,
    INVALID_ARGUMENT
}

package com.signalgate.service.admin;

/**
 * One operator message. {@code cursor} is its position in the source; the poller resumes after the highest
 * cursor it has handled.
 */
public record AdminCommand(long cursor, String from, String text) {
}

package com.signalgate.service.admin;

public record AdminReply(boolean success, String text) {
    public static AdminReply ok(String text) {
        return new AdminReply(true, text);
    }

    public static AdminReply error(String text) {
        return new AdminReply(false, text);
    }
}

package com.signalgate.service.admin;

public interface AdminReplySink {
    void send(AdminCommand command, AdminReply reply);
}

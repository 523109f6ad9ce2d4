package com.signalgate.service.admin;

import java.util.List;

public interface AdminCommandSource {
    /**
     * Commands positioned strictly after {@code cursor}, oldest first, at most {@code limit} of them.
     */
    List<AdminCommand> fetchAfter(long cursor, int limit);
}

package com.signalgate.lifecycle.dispatch;

import com.signalgate.core.model.Signal;

import java.util.List;

public interface MessageRenderer {
    String renderPremium(Signal signal);

    String renderFree(Signal signal);

    String renderDigest(String heading, List<Signal> signals, String narrative);
}

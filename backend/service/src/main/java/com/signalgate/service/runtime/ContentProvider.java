package com.signalgate.service.runtime;

import com.signalgate.core.model.Signal;

import java.time.Instant;
import java.util.List;

/**
 * Supplies the narrative part of a digest: trends, insights, the weekly question.
 */
public interface ContentProvider {
    String narrative(DigestKind kind, List<Signal> signals, Instant now);
}

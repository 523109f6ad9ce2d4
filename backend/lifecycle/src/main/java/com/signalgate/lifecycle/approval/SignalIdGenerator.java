package com.signalgate.lifecycle.approval;

import com.signalgate.core.model.Signal;
import com.signalgate.core.util.HashingUtils;

/**
 * Derives short, operator-friendly signal ids from source, content and detection time. The prefix is not
 * collision-free; {@link #candidate(Signal, int)} takes a salt so the caller can re-derive after a failed
 * insert-if-absent.
 */
public final class SignalIdGenerator {
    public static final int ID_LENGTH = 12;
    public static final int MAX_ATTEMPTS = 8;

    private SignalIdGenerator() {
    }

    public static String candidate(Signal signal, int attempt) {
        String seed = signal.source() + "|" + signal.content() + "|" + signal.detectedAt();
        if (attempt > 0) {
            seed = seed + "|" + attempt;
        }
        return HashingUtils.shortHash(seed, ID_LENGTH);
    }
}

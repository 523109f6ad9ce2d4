package com.signalgate.service.runtime;

import com.signalgate.core.model.Signal;
import com.signalgate.core.model.SignalType;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Deterministic narrative: a category tally of the digest's signals plus one closing line per kind, rotated
 * by week number so consecutive digests do not repeat.
 */
public class RotatingContentProvider implements ContentProvider {
    private static final Map<DigestKind, List<String>> LINES = Map.of(
            DigestKind.WEEKLY_DIGEST, List.of(
                    "Watch for follow-on rounds from this week's funded teams.",
                    "Acquirers are still shopping; expect more consolidation news.",
                    "Launch cadence stays high; adoption numbers will tell the story."
            ),
            DigestKind.MIDWEEK_DIGEST, List.of(
                    "Halfway through the week, the strongest signals are above.",
                    "More to come before Friday; premium members see every signal first."
            ),
            DigestKind.WEEKLY_QA, List.of(
                    "Question of the week: which of these moves will matter most in six months?",
                    "Question of the week: is this a funding cycle or a consolidation cycle?",
                    "Question of the week: which launch would you bet on, and why?"
            ),
            DigestKind.MONTHLY_DIGEST, List.of(
                    "That wraps up the month. Thanks for reading.",
                    "See you next month with a fresh round of signals."
            )
    );

    @Override
    public String narrative(DigestKind kind, List<Signal> signals, Instant now) {
        StringBuilder text = new StringBuilder();
        if (!signals.isEmpty()) {
            Map<SignalType, Integer> tally = new EnumMap<>(SignalType.class);
            for (Signal signal : signals) {
                tally.merge(signal.signalType(), 1, Integer::sum);
            }
            Map.Entry<SignalType, Integer> top = tally.entrySet().stream()
                    .max(Map.Entry.comparingByValue())
                    .orElseThrow();
            text.append(String.format(Locale.ROOT, "Most active category: %s (%d of %d signals).",
                    top.getKey().label(), top.getValue(), signals.size()));
            text.append('\n');
        }
        List<String> lines = LINES.get(kind);
        long week = Duration.between(Instant.EPOCH, now).toDays() / 7;
        text.append(lines.get((int) Math.floorMod(week, (long) lines.size())));
        return text.toString();
    }
}

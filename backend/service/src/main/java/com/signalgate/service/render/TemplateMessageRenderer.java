package com.signalgate.service.render;

import com.signalgate.core.model.Signal;
import com.signalgate.core.util.HtmlUtils;
import com.signalgate.lifecycle.dispatch.MessageRenderer;

import java.util.List;

/**
 * Plain-text templates. Premium messages carry the full prediction and evidence; free messages are a short
 * teaser; digests list signals in the order given.
 */
public class TemplateMessageRenderer implements MessageRenderer {
    static final int FREE_SUMMARY_LENGTH = 280;

    @Override
    public String renderPremium(Signal signal) {
        StringBuilder text = new StringBuilder();
        text.append("[PREMIUM] ").append(signal.signalType().label()).append(" signal (")
                .append(percent(signal.confidence())).append(" confidence)\n");
        text.append(headline(signal)).append('\n');
        if (signal.prediction() != null && !signal.prediction().isBlank()) {
            text.append('\n').append(signal.prediction()).append('\n');
        }
        if (!signal.evidence().isEmpty()) {
            text.append("\nEvidence:\n");
            for (String line : signal.evidence()) {
                text.append("- ").append(line).append('\n');
            }
        }
        appendLink(text, signal);
        text.append("Signal ID: ").append(signal.id());
        return text.toString();
    }

    @Override
    public String renderFree(Signal signal) {
        StringBuilder text = new StringBuilder();
        text.append("[").append(signal.signalType().label()).append("] ").append(headline(signal)).append('\n');
        String summary = HtmlUtils.truncate(signal.content(), FREE_SUMMARY_LENGTH);
        if (summary != null && !summary.isBlank() && !summary.equals(signal.title())) {
            text.append(summary).append('\n');
        }
        appendLink(text, signal);
        return text.toString().trim();
    }

    @Override
    public String renderDigest(String heading, List<Signal> signals, String narrative) {
        StringBuilder text = new StringBuilder();
        text.append(heading).append('\n');
        text.append("=".repeat(heading.length())).append('\n');
        if (signals.isEmpty()) {
            text.append("No approved signals this period.\n");
        }
        for (int i = 0; i < signals.size(); i++) {
            Signal signal = signals.get(i);
            text.append(i + 1).append(". [").append(signal.signalType().label()).append("] ")
                    .append(headline(signal)).append(" (").append(percent(signal.confidence())).append(")\n");
        }
        if (narrative != null && !narrative.isBlank()) {
            text.append('\n').append(narrative.trim()).append('\n');
        }
        return text.toString().trim();
    }

    private static String headline(Signal signal) {
        if (signal.title() != null && !signal.title().isBlank()) {
            return signal.title();
        }
        return HtmlUtils.truncate(signal.content(), 80);
    }

    private static void appendLink(StringBuilder text, Signal signal) {
        if (signal.link() != null && !signal.link().isBlank()) {
            text.append("Source: ").append(signal.source()).append(" - ").append(signal.link()).append('\n');
        } else {
            text.append("Source: ").append(signal.source()).append('\n');
        }
    }

    private static String percent(double confidence) {
        return Math.round(confidence * 100) + "%";
    }
}

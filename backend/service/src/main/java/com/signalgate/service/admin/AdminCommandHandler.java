package com.signalgate.service.admin;

import com.signalgate.core.model.ApprovalStatus;
import com.signalgate.core.model.Signal;
import com.signalgate.core.model.SignalType;
import com.signalgate.core.model.TierAssignment;
import com.signalgate.lifecycle.approval.ApprovalStateMachine;
import com.signalgate.lifecycle.approval.CommandResult;
import com.signalgate.lifecycle.approval.SignalStats;
import com.signalgate.lifecycle.dispatch.DispatchSummary;
import com.signalgate.lifecycle.dispatch.SignalPreview;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Text command front end for operators. Parses one command line, calls the approval state machine and turns
 * the structured result into a reply. Never throws for bad input.
 */
public class AdminCommandHandler {
    static final String HELP = String.join("\n",
            "Commands:",
            "/pending - list signals awaiting review",
            "/preview <id> - show the premium and free messages",
            "/approve <id> - approve with the assigned tier",
            "/override <id> <premium|free|both> - approve with a different tier",
            "/reject <id> [reason] - reject",
            "/stats - lifecycle counters",
            "/help - this text"
    );
    private static final int PENDING_LIST_LIMIT = 20;

    private final ApprovalStateMachine stateMachine;

    public AdminCommandHandler(ApprovalStateMachine stateMachine) {
        this.stateMachine = stateMachine;
    }

    public AdminReply handle(String text) {
        if (text == null || text.isBlank()) {
            return AdminReply.error("Empty command. Send /help for usage.");
        }
        String[] tokens = text.trim().split("\\s+");
        String command = commandName(tokens[0]);
        List<String> args = Arrays.asList(tokens).subList(1, tokens.length);
        switch (command) {
            case "/approve":
                return firstArg(args).map(this::approve)
                        .orElseGet(() -> usage("/approve <id>"));
            case "/override":
                return override(args);
            case "/reject":
                return firstArg(args)
                        .map(id -> reject(id, String.join(" ", args.subList(1, args.size()))))
                        .orElseGet(() -> usage("/reject <id> [reason]"));
            case "/preview":
                return firstArg(args).map(this::preview)
                        .orElseGet(() -> usage("/preview <id>"));
            case "/pending":
                return pending();
            case "/stats":
                return stats();
            case "/help":
            case "/start":
                return AdminReply.ok(HELP);
            default:
                return AdminReply.error("Unknown command " + tokens[0] + ". Send /help for usage.");
        }
    }

    private AdminReply approve(String id) {
        return fromResult(stateMachine.approve(id));
    }

    private AdminReply override(List<String> args) {
        if (args.size() < 2) {
            return usage("/override <id> <premium|free|both>");
        }
        Optional<TierAssignment> tier = TierAssignment.parseOverride(args.get(1));
        if (tier.isEmpty()) {
            return AdminReply.error("Unknown tier '" + args.get(1) + "'. Use premium, free or both.");
        }
        return fromResult(stateMachine.approveOverride(args.get(0), tier.get()));
    }

    private AdminReply reject(String id, String reason) {
        return fromResult(stateMachine.reject(id, reason));
    }

    private AdminReply preview(String id) {
        Optional<SignalPreview> preview = stateMachine.preview(id);
        if (preview.isEmpty()) {
            return AdminReply.error("No signal with id " + id);
        }
        SignalPreview value = preview.get();
        Signal signal = value.signal();
        StringBuilder text = new StringBuilder();
        text.append("Signal ").append(signal.id()).append(" is ").append(signal.approvalStatus())
                .append(", tier ").append(signal.tierAssignment()).append('\n');
        text.append("\n--- premium ---\n").append(value.premiumMessage()).append('\n');
        text.append("\n--- free ---\n").append(value.freeMessage()).append('\n');
        if (value.freeRelease() != null) {
            text.append("\nFree release: ").append(value.freeRelease().describe());
        } else {
            text.append("\nFree release: already sent");
        }
        return AdminReply.ok(text.toString());
    }

    private AdminReply pending() {
        List<Signal> pending = stateMachine.listPending();
        if (pending.isEmpty()) {
            return AdminReply.ok("No pending signals.");
        }
        StringBuilder text = new StringBuilder();
        text.append(pending.size()).append(" pending signal").append(pending.size() == 1 ? "" : "s").append(':');
        for (Signal signal : pending.subList(0, Math.min(PENDING_LIST_LIMIT, pending.size()))) {
            text.append('\n').append(signal.id())
                    .append(" [").append(signal.signalType().label()).append("] ")
                    .append(Math.round(signal.confidence() * 100)).append("% ")
                    .append(signal.tierAssignment()).append(" - ").append(signal.title());
        }
        if (pending.size() > PENDING_LIST_LIMIT) {
            text.append("\n... and ").append(pending.size() - PENDING_LIST_LIMIT).append(" more");
        }
        return AdminReply.ok(text.toString());
    }

    private AdminReply stats() {
        SignalStats stats = stateMachine.stats();
        StringBuilder text = new StringBuilder();
        text.append("Signals: ").append(stats.total());
        for (ApprovalStatus status : ApprovalStatus.values()) {
            text.append('\n').append(status.name().toLowerCase(Locale.ROOT)).append(": ").append(stats.count(status));
        }
        text.append("\nSent premium: ").append(stats.sentPremium());
        text.append("\nSent free: ").append(stats.sentFree());
        text.append("\nFree sends last 7 days: ").append(stats.freeSendsLast7Days())
                .append('/').append(stats.weeklyFreeCap());
        text.append("\nAverage confidence: ").append(String.format(Locale.ROOT, "%.2f", stats.averageConfidence()));
        for (Map.Entry<SignalType, Long> entry : stats.byType().entrySet()) {
            text.append("\n  ").append(entry.getKey().label()).append(": ").append(entry.getValue());
        }
        return AdminReply.ok(text.toString());
    }

    private static AdminReply fromResult(CommandResult result) {
        if (!result.success()) {
            return AdminReply.error(result.message());
        }
        StringBuilder text = new StringBuilder(result.message());
        DispatchSummary dispatch = result.dispatch();
        if (dispatch != null) {
            text.append("\nPremium: ").append(dispatch.premium());
            text.append("\nFree: ").append(dispatch.free());
            if (dispatch.freeDecision() != null && !dispatch.freeDecision().release()) {
                text.append(" (").append(dispatch.freeDecision().describe()).append(')');
            }
        }
        return AdminReply.ok(text.toString());
    }

    private static Optional<String> firstArg(List<String> args) {
        return args.isEmpty() ? Optional.empty() : Optional.of(args.get(0));
    }

    private static AdminReply usage(String usage) {
        return AdminReply.error("Usage: " + usage);
    }

    private static String commandName(String token) {
        String lowered = token.toLowerCase(Locale.ROOT);
        int mention = lowered.indexOf('@');
        return mention > 0 ? lowered.substring(0, mention) : lowered;
    }
}

package com.signalgate.lifecycle.approval;

import com.signalgate.core.model.ApprovalStatus;
import com.signalgate.core.model.SignalType;
import com.signalgate.core.model.TierAssignment;

import java.util.Map;

public record SignalStats(
        int total,
        Map<ApprovalStatus, Long> byStatus,
        Map<SignalType, Long> byType,
        Map<TierAssignment, Long> byTier,
        long sentPremium,
        long sentFree,
        int freeSendsLast7Days,
        int weeklyFreeCap,
        double averageConfidence
) {
    public long count(ApprovalStatus status) {
        return byStatus.getOrDefault(status, 0L);
    }
}

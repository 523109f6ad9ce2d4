package com.signalgate.lifecycle.ingest;

import com.signalgate.core.model.ApprovalStatus;
import com.signalgate.core.model.RawArticle;
import com.signalgate.core.model.Signal;
import com.signalgate.lifecycle.approval.ApprovalStateMachine;
import com.signalgate.lifecycle.approval.CommandResult;
import com.signalgate.lifecycle.classify.Classifier;
import com.signalgate.lifecycle.config.SignalPolicyConfig;
import com.signalgate.lifecycle.dedup.Deduplicator;
import com.signalgate.lifecycle.store.StoreUnavailableException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Feed items to pending signals: recency filter, classification, dedup ledger, then creation.
 *
 * <p>Every item is handled on its own; a failure on one item is logged and counted while the rest of the
 * batch continues. A {@link StoreUnavailableException} is the exception: it propagates so the caller can
 * abandon the whole tick. When creating the signal fails, the ledger entry is released again so a later
 * poll can retry the article.
 */
public class ArticleIngestor {
    private static final Logger LOGGER = Logger.getLogger(ArticleIngestor.class.getName());

    private final Classifier classifier;
    private final Deduplicator deduplicator;
    private final ApprovalStateMachine stateMachine;
    private final SignalPolicyConfig config;

    public ArticleIngestor(
            Classifier classifier,
            Deduplicator deduplicator,
            ApprovalStateMachine stateMachine,
            SignalPolicyConfig config
    ) {
        this.classifier = classifier;
        this.deduplicator = deduplicator;
        this.stateMachine = stateMachine;
        this.config = config;
    }

    public IngestReport ingest(List<RawArticle> items, Instant now) {
        int stale = 0;
        int belowThreshold = 0;
        int duplicates = 0;
        int created = 0;
        int autoApproved = 0;
        int failed = 0;
        for (RawArticle item : items) {
            try {
                if (!recent(item, now)) {
                    stale++;
                    continue;
                }
                Optional<Signal> draft = classifier.classify(item, now);
                if (!deduplicator.admit(item, draft.isPresent())) {
                    duplicates++;
                    continue;
                }
                if (draft.isEmpty()) {
                    belowThreshold++;
                    continue;
                }
                CommandResult result = createOrRelease(item, draft.get());
                created++;
                if (result.signal().approvalStatus() == ApprovalStatus.AUTO_APPROVED) {
                    autoApproved++;
                }
            } catch (StoreUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                failed++;
                LOGGER.log(Level.WARNING, "Failed ingesting article '" + item.title() + "' from " + item.source(), e);
            }
        }
        return new IngestReport(items.size(), stale, belowThreshold, duplicates, created, autoApproved, failed);
    }

    private CommandResult createOrRelease(RawArticle item, Signal draft) {
        try {
            return stateMachine.create(draft);
        } catch (RuntimeException e) {
            try {
                deduplicator.release(item);
            } catch (RuntimeException releaseFailure) {
                e.addSuppressed(releaseFailure);
            }
            throw e;
        }
    }

    private boolean recent(RawArticle item, Instant now) {
        Instant publishedAt = item.publishedAt();
        if (publishedAt == null || Instant.EPOCH.equals(publishedAt)) {
            return false;
        }
        return !publishedAt.isBefore(now.minus(config.recencyWindow()));
    }
}

package com.signalgate.lifecycle.classify;

import com.signalgate.core.model.RawArticle;
import com.signalgate.core.model.Signal;
import com.signalgate.core.model.SignalType;
import com.signalgate.core.util.HtmlUtils;
import com.signalgate.lifecycle.config.SignalPolicyConfig;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Lexical scorer turning a feed article into at most one draft {@link Signal}.
 *
 * <p>Confidence is {@code matchedKeywords * perKeywordWeight} plus the bonus of the first matching category,
 * capped at 1.0 and rounded to two decimals. Anything under {@code minPublishConfidence} is dropped here and
 * never reaches the approval queue. The output is a pure function of the article and {@code detectedAt}.
 */
public class Classifier {
    private final SignalPolicyConfig config;

    public Classifier(SignalPolicyConfig config) {
        this.config = config;
    }

    public Optional<Signal> classify(RawArticle article, Instant detectedAt) {
        Scoring scoring = score(article);
        if (scoring.confidence() < config.minPublishConfidence()) {
            return Optional.empty();
        }
        String source = article.source() == null ? "unknown" : article.source();
        return Optional.of(Signal.draft(
                scoring.category(),
                source,
                article.title(),
                article.link(),
                scoring.content(),
                scoring.confidence(),
                detectedAt,
                prediction(scoring, source),
                evidence(scoring, source)
        ));
    }

    public Scoring score(RawArticle article) {
        String title = article.title() == null ? "" : HtmlUtils.toPlainText(article.title());
        String description = HtmlUtils.toPlainText(article.description());
        String content = description.isEmpty() ? title : title + " " + description;
        String lowered = content.toLowerCase(Locale.ROOT);

        Set<String> matched = KeywordVocabulary.matchScoringTerms(lowered);
        SignalType category = KeywordVocabulary.detectCategory(lowered);
        double base = matched.size() * config.perKeywordWeight();
        double bonus = config.bonusFor(category);
        double confidence = round2(Math.min(1.0, base + bonus));
        return new Scoring(content, List.copyOf(matched), category, base, bonus, confidence);
    }

    private String prediction(Scoring scoring, String source) {
        String outlook = switch (scoring.category()) {
            case ACQUISITION -> "consolidation move; expect competitor responses and integration news";
            case IPO -> "public listing ahead; expect valuation and filing coverage";
            case FUNDING -> "fresh capital; expect hiring, expansion or follow-on rounds";
            case INNOVATION -> "technical advance; expect product or licensing follow-up";
            case PRODUCT_LAUNCH -> "new product in market; expect adoption and review coverage";
            case GENERAL -> "notable activity worth tracking";
        };
        return scoring.category().label() + " signal from " + source + ": " + outlook
                + " (" + Math.round(scoring.confidence() * 100) + "% confidence)";
    }

    private List<String> evidence(Scoring scoring, String source) {
        List<String> evidence = new ArrayList<>();
        evidence.add("Source: " + source);
        evidence.add("Category: " + scoring.category().label());
        evidence.add("Matched keywords: " + (scoring.keywords().isEmpty() ? "none" : String.join(", ", scoring.keywords())));
        evidence.add(String.format(Locale.ROOT, "Score: %d x %.2f + %.2f bonus = %.2f",
                scoring.keywords().size(), config.perKeywordWeight(), scoring.bonus(), scoring.confidence()));
        return evidence;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    public record Scoring(
            String content,
            List<String> keywords,
            SignalType category,
            double base,
            double bonus,
            double confidence
    ) {
    }
}

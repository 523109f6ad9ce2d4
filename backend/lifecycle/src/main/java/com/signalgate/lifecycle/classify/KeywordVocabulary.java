package com.signalgate.lifecycle.classify;

import com.signalgate.core.model.SignalType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Fixed lexical vocabulary used for scoring. Terms are matched as whole words against lower-cased text.
 */
public final class KeywordVocabulary {
    static final List<String> SCORING_TERMS = List.of(
            "startup", "funding", "raises", "raised", "million", "billion", "series a", "series b", "series c",
            "seed round", "venture", "investors", "valuation", "unicorn", "backed",
            "acquires", "acquired", "acquisition", "merger",
            "ipo", "public offering", "goes public",
            "launches", "launch", "unveils", "announces", "introduces", "release",
            "breakthrough", "patent", "innovation", "research",
            "ai", "artificial intelligence", "partnership", "expands", "revenue"
    );

    /**
     * Category rules in priority order. The first rule that matches decides the category.
     */
    static final Map<SignalType, CategoryRule> CATEGORY_RULES = buildRules();

    static final List<String> PREMIUM_ONLY_TERMS = List.of(
            "acquisition", "acquires", "acquired", "merger", "buyout",
            "funding", "raises", "raised", "series a", "series b", "series c", "seed round",
            "investment", "valuation", "partnership"
    );

    private static final Map<String, Pattern> PATTERNS = new ConcurrentHashMap<>();

    private KeywordVocabulary() {
    }

    public static Set<String> matchScoringTerms(String loweredText) {
        return matchAll(SCORING_TERMS, loweredText);
    }

    public static Set<String> matchPremiumOnlyTerms(String loweredText) {
        return matchAll(PREMIUM_ONLY_TERMS, loweredText);
    }

    public static SignalType detectCategory(String loweredText) {
        for (Map.Entry<SignalType, CategoryRule> entry : CATEGORY_RULES.entrySet()) {
            if (entry.getValue().matches(loweredText)) {
                return entry.getKey();
            }
        }
        return SignalType.GENERAL;
    }

    static boolean containsTerm(String loweredText, String term) {
        Pattern pattern = PATTERNS.computeIfAbsent(term, t -> Pattern.compile("\\b" + Pattern.quote(t) + "\\b"));
        return pattern.matcher(loweredText).find();
    }

    private static Set<String> matchAll(List<String> terms, String loweredText) {
        Set<String> matched = new TreeSet<>();
        for (String term : terms) {
            if (containsTerm(loweredText, term)) {
                matched.add(term);
            }
        }
        return matched;
    }

    private static Map<SignalType, CategoryRule> buildRules() {
        Map<SignalType, CategoryRule> rules = new LinkedHashMap<>();
        rules.put(SignalType.ACQUISITION, CategoryRule.anyOf(
                "acquires", "acquired", "acquisition", "to acquire", "merger", "buyout"));
        rules.put(SignalType.IPO, CategoryRule.anyOf(
                "ipo", "public offering", "goes public", "going public", "stock debut"));
        rules.put(SignalType.FUNDING, CategoryRule.anyOf(
                "funding", "raises", "raised", "series a", "series b", "series c", "seed round")
                .and("million", "billion"));
        rules.put(SignalType.INNOVATION, CategoryRule.anyOf(
                "breakthrough", "patent", "innovation", "prototype"));
        rules.put(SignalType.PRODUCT_LAUNCH, CategoryRule.anyOf(
                "launches", "launch", "unveils", "introduces", "rolls out"));
        return Collections.unmodifiableMap(rules);
    }

    record CategoryRule(List<String> anyOf, List<String> alsoOneOf) {
        static CategoryRule anyOf(String... terms) {
            return new CategoryRule(List.of(terms), List.of());
        }

        CategoryRule and(String... terms) {
            return new CategoryRule(anyOf, List.of(terms));
        }

        boolean matches(String loweredText) {
            boolean primary = anyOf.stream().anyMatch(term -> containsTerm(loweredText, term));
            if (!primary) {
                return false;
            }
            return alsoOneOf.isEmpty() || alsoOneOf.stream().anyMatch(term -> containsTerm(loweredText, term));
        }
    }
}

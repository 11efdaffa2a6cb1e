package com.macroallocator.common.classifier;

import com.macroallocator.common.exception.InputException;
import com.macroallocator.common.model.HeadlineBatch;
import com.macroallocator.common.model.Regime;
import com.macroallocator.common.model.RegimeAssessment;
import com.macroallocator.common.sentiment.SentimentScorer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Maps a free-form macro narrative to a {@link Regime} and its sector tilt.
 *
 * <p>Rules (evaluated in priority order, first match wins):
 * <ol>
 *   <li>sentiment &le; 0.35                          → {@link Regime#DEFENSIVE}</li>
 *   <li>sentiment &ge; 0.65                          → {@link Regime#AGGRESSIVE}</li>
 *   <li>risk-off keywords only                       → {@link Regime#DEFENSIVE}</li>
 *   <li>risk-on keywords only                        → {@link Regime#AGGRESSIVE}</li>
 *   <li>both families, sentiment &lt; 0.5            → {@link Regime#DEFENSIVE}</li>
 *   <li>both families, sentiment &gt; 0.5            → {@link Regime#AGGRESSIVE}</li>
 *   <li>both families, sentiment exactly 0.5         → {@link Regime#NEUTRAL}</li>
 *   <li>otherwise                                    → {@link Regime#NEUTRAL}</li>
 * </ol>
 *
 * <p>Keywords are matched on the narrative only; headlines feed the sentiment score.
 * No reactive types. No logging. Deterministic for a given input.
 */
public class RegimeClassifier {

    private static final String COMPONENT = "RegimeClassifier";

    public static final double BEARISH_THRESHOLD = 0.35;
    public static final double BULLISH_THRESHOLD = 0.65;

    static final List<String> RISK_OFF_KEYWORDS = List.of(
        "war", "inflation", "recession", "crisis", "conflict", "sanctions", "stagflation",
        "crash", "gold", "safe haven", "flight to safety", "default", "pandemic", "invasion",
        "fear", "fears", "risk off", "defensive", "bond", "bonds", "treasuries"
    );

    static final List<String> RISK_ON_KEYWORDS = List.of(
        "growth", "tech", "technology", "boom", "ai", "artificial intelligence", "rally",
        "innovation", "crypto", "bitcoin", "semiconductor", "semiconductors", "chips",
        "bull", "bullish", "stimulus", "rate cut", "rate cuts", "risk on", "expansion"
    );

    private static final List<RegimeRule> RULES = List.of(
        new RegimeRule("sentiment-bearish",
            s -> s.sentiment() <= BEARISH_THRESHOLD, Regime.DEFENSIVE),
        new RegimeRule("sentiment-bullish",
            s -> s.sentiment() >= BULLISH_THRESHOLD, Regime.AGGRESSIVE),
        new RegimeRule("risk-off-keywords",
            s -> s.hasRiskOff() && !s.hasRiskOn(), Regime.DEFENSIVE),
        new RegimeRule("risk-on-keywords",
            s -> s.hasRiskOn() && !s.hasRiskOff(), Regime.AGGRESSIVE),
        new RegimeRule("mixed-keywords-bearish",
            s -> s.hasRiskOff() && s.hasRiskOn() && s.sentiment() < SentimentScorer.NEUTRAL, Regime.DEFENSIVE),
        new RegimeRule("mixed-keywords-bullish",
            s -> s.hasRiskOff() && s.hasRiskOn() && s.sentiment() > SentimentScorer.NEUTRAL, Regime.AGGRESSIVE),
        new RegimeRule("mixed-keywords-balanced",
            s -> s.hasRiskOff() && s.hasRiskOn(), Regime.NEUTRAL),
        new RegimeRule("default",
            s -> true, Regime.NEUTRAL)
    );

    private final SentimentScorer scorer;

    public RegimeClassifier() {
        this(new SentimentScorer());
    }

    public RegimeClassifier(SentimentScorer scorer) {
        this.scorer = scorer;
    }

    public RegimeAssessment classify(String text) {
        return classify(text, HeadlineBatch.notRequested());
    }

    /**
     * Classify the narrative, blending in the given headlines when they are available.
     *
     * @throws InputException when {@code text} is null or blank
     */
    public RegimeAssessment classify(String text, HeadlineBatch headlines) {
        if (text == null || text.isBlank()) {
            throw new InputException(COMPONENT, "Narrative text must not be empty");
        }
        HeadlineBatch batch = headlines == null ? HeadlineBatch.notRequested() : headlines;

        NarrativeSignals signals = extractSignals(text, batch.headlines());
        RegimeRule rule = firstMatch(signals);
        List<String> sectors = SectorTilt.sectorsFor(rule.regime());

        return new RegimeAssessment(
            rule.regime(),
            sectors,
            reasoning(rule, signals, sectors, batch),
            signals.sentiment(),
            batch.headlines(),
            batch.fellBack()
        );
    }

    /** The ordered rule table, exposed for inspection. */
    public static List<RegimeRule> rules() {
        return RULES;
    }

    NarrativeSignals extractSignals(String text, List<String> headlines) {
        String normalized = SentimentScorer.normalize(text);
        double sentiment = scorer.score(text, headlines);
        return new NarrativeSignals(sentiment,
            hits(normalized, RISK_OFF_KEYWORDS),
            hits(normalized, RISK_ON_KEYWORDS));
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static RegimeRule firstMatch(NarrativeSignals signals) {
        for (RegimeRule rule : RULES) {
            if (rule.matches(signals)) {
                return rule;
            }
        }
        // unreachable: the last rule always matches
        return RULES.get(RULES.size() - 1);
    }

    private static List<String> hits(String normalized, List<String> keywords) {
        List<String> found = new ArrayList<>();
        for (String keyword : keywords) {
            if (SentimentScorer.containsTerm(normalized, keyword)) {
                found.add(keyword);
            }
        }
        return found;
    }

    private static String reasoning(RegimeRule rule, NarrativeSignals signals,
                                    List<String> sectors, HeadlineBatch batch) {
        StringBuilder sb = new StringBuilder();
        sb.append("Rule '").append(rule.name()).append("' matched: sentiment=")
          .append(String.format(Locale.ROOT, "%.2f", signals.sentiment()));
        if (signals.hasRiskOff()) {
            sb.append(", risk-off signals ").append(signals.riskOffHits());
        }
        if (signals.hasRiskOn()) {
            sb.append(", risk-on signals ").append(signals.riskOnHits());
        }
        if (!batch.headlines().isEmpty()) {
            sb.append(", ").append(batch.headlines().size()).append(" headlines considered");
        } else if (batch.fellBack()) {
            sb.append(", news unavailable so the narrative alone was scored");
        }
        sb.append(". ").append(capitalize(rule.regime().wireName()))
          .append(" posture favors ").append(String.join(", ", sectors)).append('.');
        return sb.toString();
    }

    private static String capitalize(String s) {
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}

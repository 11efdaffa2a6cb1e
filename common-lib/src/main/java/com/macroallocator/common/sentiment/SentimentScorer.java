package com.macroallocator.common.sentiment;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Lexicon-based market sentiment in [0.0, 1.0] (0 = maximally bearish, 1 = bullish).
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Normalize: lower-case, every run of non-alphanumerics becomes one space.</li>
 *   <li>Sum weights of bullish and bearish lexicon hits (whole-word / whole-phrase).</li>
 *   <li>Score = (bull + 1) / (bull + bear + 2); text without hits scores {@value #NEUTRAL}.</li>
 *   <li>Headlines are scored the same way; only headlines with at least one hit are
 *       averaged, and the average is blended in with {@code headlineWeight}.</li>
 * </ol>
 *
 * <p>Total and deterministic: never throws, same input always yields the same score.
 */
public class SentimentScorer {

    public static final double NEUTRAL = 0.5;
    public static final double DEFAULT_HEADLINE_WEIGHT = 0.3;

    private final double headlineWeight;

    public SentimentScorer() {
        this(DEFAULT_HEADLINE_WEIGHT);
    }

    public SentimentScorer(double headlineWeight) {
        if (headlineWeight < 0.0 || headlineWeight > 1.0 || Double.isNaN(headlineWeight)) {
            throw new IllegalArgumentException("headlineWeight must be in [0,1]: " + headlineWeight);
        }
        this.headlineWeight = headlineWeight;
    }

    public double score(String text) {
        return score(text, List.of());
    }

    public double score(String text, List<String> headlines) {
        Tally primary = tally(text);
        double textScore = primary.score();

        if (headlines == null || headlines.isEmpty() || headlineWeight == 0.0) {
            return textScore;
        }

        double sum = 0.0;
        int scored = 0;
        for (String headline : headlines) {
            Tally t = tally(headline);
            if (t.hasHits()) {
                sum += t.score();
                scored++;
            }
        }
        if (scored == 0) {
            return textScore;
        }
        double headlineScore = sum / scored;
        return clamp((1.0 - headlineWeight) * textScore + headlineWeight * headlineScore);
    }

    /** True when {@code term} appears as a whole word or phrase in already-normalized text. */
    public static boolean containsTerm(String normalized, String term) {
        return normalized.contains(" " + term + " ");
    }

    /**
     * Lower-cases and collapses punctuation so that lexicon phrases can be matched with
     * {@link #containsTerm(String, String)}. The result is padded with single spaces.
     */
    public static String normalize(String text) {
        if (text == null) {
            return " ";
        }
        String collapsed = text.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", " ").trim();
        return " " + collapsed + " ";
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private Tally tally(String text) {
        String normalized = normalize(text);
        return new Tally(weightOf(normalized, SentimentLexicon.BULLISH),
                         weightOf(normalized, SentimentLexicon.BEARISH));
    }

    private static double weightOf(String normalized, Map<String, Double> lexicon) {
        double total = 0.0;
        for (Map.Entry<String, Double> e : lexicon.entrySet()) {
            total += occurrences(normalized, e.getKey()) * e.getValue();
        }
        return total;
    }

    private static int occurrences(String normalized, String term) {
        String needle = " " + term + " ";
        int count = 0;
        int from = 0;
        while (true) {
            int idx = normalized.indexOf(needle, from);
            if (idx < 0) return count;
            count++;
            // step past the term but keep its trailing space available for the next match
            from = idx + needle.length() - 1;
        }
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }

    private record Tally(double bullish, double bearish) {
        boolean hasHits() {
            return bullish > 0.0 || bearish > 0.0;
        }

        double score() {
            if (!hasHits()) return NEUTRAL;
            return (bullish + 1.0) / (bullish + bearish + 2.0);
        }
    }
}

package com.macroallocator.common.sentiment;

import java.util.Map;

/**
 * Bullish and bearish market vocabulary with per-term weights. Multi-word entries are
 * matched as whole phrases on the normalized text.
 */
final class SentimentLexicon {

    private SentimentLexicon() {}

    static final Map<String, Double> BULLISH = Map.ofEntries(
        Map.entry("growth",        1.0),
        Map.entry("boom",          1.5),
        Map.entry("rally",         1.5),
        Map.entry("rallies",       1.5),
        Map.entry("bullish",       1.5),
        Map.entry("optimism",      1.0),
        Map.entry("optimistic",    1.0),
        Map.entry("recovery",      1.0),
        Map.entry("expansion",     1.0),
        Map.entry("innovation",    1.0),
        Map.entry("breakthrough",  1.0),
        Map.entry("surge",         1.0),
        Map.entry("soaring",       1.0),
        Map.entry("gains",         1.0),
        Map.entry("profits",       1.0),
        Map.entry("strong",        0.5),
        Map.entry("upbeat",        1.0),
        Map.entry("stimulus",      1.0),
        Map.entry("easing",        1.0),
        Map.entry("dovish",        1.0),
        Map.entry("rate cut",      1.0),
        Map.entry("rate cuts",     1.0),
        Map.entry("soft landing",  1.5),
        Map.entry("record high",   1.0),
        Map.entry("risk on",       1.5),
        Map.entry("adoption",      0.5),
        Map.entry("productivity",  0.5)
    );

    static final Map<String, Double> BEARISH = Map.ofEntries(
        Map.entry("war",               1.5),
        Map.entry("wars",              1.5),
        Map.entry("escalation",        1.0),
        Map.entry("inflation",         1.0),
        Map.entry("fear",              1.0),
        Map.entry("fears",             1.0),
        Map.entry("recession",         1.5),
        Map.entry("crisis",            1.5),
        Map.entry("crash",             2.0),
        Map.entry("default",           1.0),
        Map.entry("sanctions",         1.0),
        Map.entry("conflict",          1.0),
        Map.entry("panic",             1.5),
        Map.entry("sell off",          1.0),
        Map.entry("selloff",           1.0),
        Map.entry("downturn",          1.0),
        Map.entry("unemployment",      0.5),
        Map.entry("layoffs",           1.0),
        Map.entry("bankruptcy",        1.5),
        Map.entry("slowdown",          1.0),
        Map.entry("uncertainty",       0.5),
        Map.entry("volatility",        0.5),
        Map.entry("tension",           0.5),
        Map.entry("tensions",          0.5),
        Map.entry("collapse",          1.5),
        Map.entry("plunge",            1.5),
        Map.entry("bearish",           1.5),
        Map.entry("tariffs",           0.5),
        Map.entry("stagflation",       1.5),
        Map.entry("contraction",       1.0),
        Map.entry("invasion",          1.5),
        Map.entry("pandemic",          1.0),
        Map.entry("shortage",          0.5),
        Map.entry("losses",            1.0),
        Map.entry("decline",           0.5),
        Map.entry("worries",           1.0),
        Map.entry("hawkish",           1.0),
        Map.entry("turmoil",           1.0),
        Map.entry("slump",             1.0),
        Map.entry("rate hike",         1.0),
        Map.entry("rate hikes",        1.0),
        Map.entry("safe haven",        1.0),
        Map.entry("flight to safety",  1.5),
        Map.entry("risk off",          1.5)
    );
}

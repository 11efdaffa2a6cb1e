package com.macroallocator.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.macroallocator.common.model.AnalysisResult;
import com.macroallocator.common.model.EconomicSnapshot;
import com.macroallocator.common.model.PortfolioSelection;
import com.macroallocator.common.model.Regime;
import com.macroallocator.common.model.RegimeAssessment;
import com.macroallocator.common.model.RiskMetrics;
import com.macroallocator.common.model.Ticker;

import java.util.List;

/**
 * Success payload of {@code POST /api/analyze}. Field names and nesting are consumed by
 * existing front ends and must not change.
 */
public record AnalyzeResponse(
    @JsonProperty("status") String status,
    @JsonProperty("analysis") Analysis analysis,
    @JsonProperty("result") Result result,
    @JsonProperty("risk") Risk risk,
    @JsonProperty("candidates") Candidates candidates,
    @JsonProperty("economic") Economic economic
) {

    public record Analysis(
        @JsonProperty("regime") Regime regime,
        @JsonProperty("reasoning") String reasoning,
        @JsonProperty("sectors") List<String> sectors,
        @JsonProperty("sentiment") Sentiment sentiment,
        @JsonProperty("news_headlines") List<String> newsHeadlines,
        @JsonProperty("synthetic") boolean synthetic
    ) {}

    public record Sentiment(@JsonProperty("overall") double overall) {}

    public record Result(
        @JsonProperty("selected_tickers") List<String> selectedTickers,
        @JsonProperty("selected_names") List<String> selectedNames,
        @JsonProperty("weights") List<Double> weights,
        @JsonProperty("expected_return") double expectedReturn,
        @JsonProperty("risk_probability") double riskProbability
    ) {}

    public record Risk(
        @JsonProperty("var_classical") double varClassical,
        @JsonProperty("cvar") double cvar,
        @JsonProperty("volatility") double volatility,
        @JsonProperty("max_drawdown") double maxDrawdown
    ) {}

    public record Candidates(
        @JsonProperty("tickers") List<String> tickers,
        @JsonProperty("names") List<String> names,
        @JsonProperty("returns_1y") List<Double> returns1y
    ) {}

    public record Economic(
        @JsonProperty("cpi") Cpi cpi,
        @JsonProperty("fed_rate") FedRate fedRate,
        @JsonProperty("gdp") Gdp gdp,
        @JsonProperty("regime") EconomicRegime regime
    ) {}

    public record Cpi(@JsonProperty("yoy_change") double yoyChange) {}

    public record FedRate(@JsonProperty("value") double value) {}

    public record Gdp(@JsonProperty("growth") double growth) {}

    public record EconomicRegime(
        @JsonProperty("label") String label,
        @JsonProperty("description") String description
    ) {}

    public static AnalyzeResponse from(AnalysisResult r) {
        RegimeAssessment a = r.assessment();
        PortfolioSelection s = r.selection();
        RiskMetrics m = r.risk();
        EconomicSnapshot e = r.economic();

        return new AnalyzeResponse(
            "success",
            new Analysis(a.regime(), a.reasoning(), a.sectors(),
                new Sentiment(a.sentiment()), a.headlines(), r.synthetic()),
            new Result(s.tickers(), s.names(), s.weights(), s.expectedReturn(), m.riskProbability()),
            new Risk(m.var(), m.cvar(), m.volatility(), m.maxDrawdown()),
            new Candidates(
                r.candidates().stream().map(Ticker::symbol).toList(),
                r.candidates().stream().map(Ticker::name).toList(),
                r.candidates().stream().map(Ticker::oneYearReturn).toList()),
            new Economic(new Cpi(e.cpiYoyChange()), new FedRate(e.fedRate()), new Gdp(e.gdpGrowth()),
                new EconomicRegime(e.label(), e.description()))
        );
    }
}

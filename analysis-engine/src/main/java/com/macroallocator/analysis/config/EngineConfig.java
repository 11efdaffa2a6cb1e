package com.macroallocator.analysis.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.macroallocator.common.classifier.RegimeClassifier;
import com.macroallocator.common.optimizer.ExactPortfolioSolver;
import com.macroallocator.common.optimizer.LocalSearchPortfolioSolver;
import com.macroallocator.common.optimizer.PortfolioOptimizer;
import com.macroallocator.common.risk.RiskAnalyzer;
import com.macroallocator.common.sentiment.SentimentScorer;
import com.macroallocator.common.universe.SyntheticSeriesGenerator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the pure common-lib engines with their configured parameters.
 */
@Configuration
public class EngineConfig {

    @Value("${sentiment.headline-weight:0.3}")
    private double headlineWeight;

    @Value("${optimizer.max-assets:4}")
    private int maxAssets;

    @Value("${optimizer.enumeration-threshold:16}")
    private int enumerationThreshold;

    @Value("${optimizer.local-search.seed:42}")
    private long localSearchSeed;

    @Value("${optimizer.local-search.restarts:8}")
    private int localSearchRestarts;

    @Value("${risk.seed:42}")
    private long riskSeed;

    @Value("${risk.paths:2000}")
    private int riskPaths;

    @Value("${risk.horizon-days:252}")
    private int riskHorizonDays;

    @Value("${risk.confidence:0.95}")
    private double riskConfidence;

    @Value("${universe.synthetic.seed:42}")
    private long syntheticSeed;

    @Bean
    public SentimentScorer sentimentScorer() {
        return new SentimentScorer(headlineWeight);
    }

    @Bean
    public RegimeClassifier regimeClassifier(SentimentScorer sentimentScorer) {
        return new RegimeClassifier(sentimentScorer);
    }

    @Bean
    public PortfolioOptimizer portfolioOptimizer() {
        return new PortfolioOptimizer(
            new ExactPortfolioSolver(),
            new LocalSearchPortfolioSolver(localSearchSeed, localSearchRestarts),
            maxAssets, enumerationThreshold);
    }

    @Bean
    public RiskAnalyzer riskAnalyzer() {
        return new RiskAnalyzer(riskSeed, riskPaths, riskHorizonDays, riskConfidence);
    }

    @Bean
    public SyntheticSeriesGenerator syntheticSeriesGenerator() {
        return new SyntheticSeriesGenerator(syntheticSeed, SyntheticSeriesGenerator.TRADING_DAYS);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}

package com.macroallocator.analysis.service;

import com.macroallocator.analysis.universe.CandidateUniverse;
import com.macroallocator.common.exception.DataUnavailableException;
import com.macroallocator.common.exception.InputException;
import com.macroallocator.common.exception.InternalException;
import com.macroallocator.common.model.AnalysisResult;
import com.macroallocator.common.model.PortfolioSelection;
import com.macroallocator.common.model.Regime;
import com.macroallocator.common.model.RiskMetrics;
import com.macroallocator.common.model.Ticker;
import com.macroallocator.common.risk.RiskAnalyzer;
import com.macroallocator.common.universe.SyntheticSeriesGenerator;
import com.macroallocator.common.universe.TickerCatalog;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisServiceTest {

    @Nested
    @DisplayName("live market data")
    class Live {

        @Test
        @DisplayName("defensive narrative → portfolio drawn from defensive sectors")
        void defensive() {
            AnalysisService service = AnalysisPipelineFixture.service(AnalysisPipelineFixture.seededProvider());

            StepVerifier.create(service.analyze("War escalation and recession fears drive a flight to safety"))
                .assertNext(result -> {
                    assertEquals(Regime.DEFENSIVE, result.assessment().regime());
                    assertFalse(result.synthetic());

                    Set<String> defensiveSymbols = Set.of("GLD", "IAU", "XLU", "TLT");
                    assertEquals(defensiveSymbols,
                        Set.copyOf(result.candidates().stream().map(Ticker::symbol).toList()));

                    PortfolioSelection selection = result.selection();
                    assertFalse(selection.isEmpty());
                    assertTrue(selection.size() <= 4);
                    assertTrue(defensiveSymbols.containsAll(selection.tickers()));
                    assertEquals(1.0, selection.weights().stream().mapToDouble(Double::doubleValue).sum(), 1e-6);

                    assertTrue(result.risk().cvar() >= result.risk().var());
                    assertTrue(result.risk().riskProbability() >= 0 && result.risk().riskProbability() <= 1);
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("same narrative twice → identical result")
        void deterministic() {
            AnalysisService service = AnalysisPipelineFixture.service(AnalysisPipelineFixture.seededProvider());
            String text = "AI boom and a tech rally lift growth stocks";

            AnalysisResult first = service.analyze(text).block();
            AnalysisResult second = service.analyze(text).block();

            assertNotNull(first);
            assertEquals(Regime.AGGRESSIVE, first.assessment().regime());
            assertEquals(first.selection(), second.selection());
            assertEquals(first.risk(), second.risk());
        }

        @Test
        @DisplayName("missing API keys → fallback economic context, no headlines")
        void withoutKeys() {
            AnalysisService service = AnalysisPipelineFixture.service(AnalysisPipelineFixture.seededProvider());

            StepVerifier.create(service.analyze("markets drift sideways"))
                .assertNext(result -> {
                    assertTrue(result.economic().fallback());
                    assertEquals("Stagflation Risk", result.economic().label());
                    assertEquals(List.of(), result.assessment().headlines());
                })
                .verifyComplete();
        }
    }

    @Test
    @DisplayName("market data down → synthetic universe, still a full result")
    void syntheticUniverse() {
        AnalysisService service = AnalysisPipelineFixture.service(
            symbol -> Mono.error(new DataUnavailableException("test", "offline")));

        StepVerifier.create(service.analyze("inflation fears and uncertainty"))
            .assertNext(result -> {
                assertTrue(result.synthetic());
                assertTrue(result.candidates().stream().allMatch(Ticker::synthetic));
                assertFalse(result.selection().isEmpty());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("market data hanging on first request → synthetic result inside the request timeout")
    void hangingMarketDataOnColdStart() {
        CandidateUniverse universe = new CandidateUniverse(symbol -> Mono.never(), new SyntheticSeriesGenerator(),
            TickerCatalog.DEFAULT, 8, Duration.ofSeconds(1), 2, Duration.ofMillis(50), Duration.ofMillis(800));
        // a full hanging load needs about five waves of three attempts each, well past the request timeout
        AnalysisService service = AnalysisPipelineFixture.service(universe,
            new RiskAnalyzer(42L, 500, 252, 0.95), Duration.ofSeconds(8));
        ReflectionTestUtils.setField(service, "exactTimeBudget", Duration.ofSeconds(2));

        StepVerifier.create(service.analyze("war escalation, inflation fears, flight to safety"))
            .assertNext(result -> {
                assertEquals(Regime.DEFENSIVE, result.assessment().regime());
                assertTrue(result.synthetic());
                assertFalse(result.selection().isEmpty());
            })
            .expectComplete()
            .verify(Duration.ofSeconds(15));
    }

    @Test
    @DisplayName("pipeline slower than the request timeout → internal error")
    void requestTimeout() {
        RiskAnalyzer stalled = new RiskAnalyzer(42L, 500, 252, 0.95) {
            @Override
            public RiskMetrics analyze(PortfolioSelection selection, List<Ticker> series) {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("interrupted", e);
                }
                return super.analyze(selection, series);
            }
        };
        AnalysisService service = AnalysisPipelineFixture.service(
            new CandidateUniverse(AnalysisPipelineFixture.seededProvider(), new SyntheticSeriesGenerator(),
                AnalysisPipelineFixture.CATALOG, 4, Duration.ofSeconds(2), 0, Duration.ofMillis(1)),
            stalled, Duration.ofMillis(1_500));

        StepVerifier.create(service.analyze("inflation fears and uncertainty"))
            .expectErrorSatisfies(e -> {
                InternalException ie = assertInstanceOf(InternalException.class, e);
                assertTrue(ie.getMessage().contains("exceeded 1500ms"), ie.getMessage());
            })
            .verify(Duration.ofSeconds(10));
    }

    @Test
    @DisplayName("blank narrative → input error before any work")
    void blank() {
        AnalysisService service = AnalysisPipelineFixture.service(AnalysisPipelineFixture.seededProvider());

        StepVerifier.create(service.analyze(" "))
            .expectError(InputException.class)
            .verify();
    }
}

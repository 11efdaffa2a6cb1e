package com.macroallocator.analysis.client;

import com.macroallocator.common.model.EconomicSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class EconomicDataWebClientTest {

    private static String series(double... newestFirst) {
        StringBuilder sb = new StringBuilder("{\"name\":\"series\",\"data\":[");
        for (int i = 0; i < newestFirst.length; i++) {
            if (i > 0) sb.append(',');
            sb.append("{\"date\":\"d").append(i).append("\",\"value\":\"").append(newestFirst[i]).append("\"}");
        }
        return sb.append("]}").toString();
    }

    private static ClientResponse answer(ClientRequest request) {
        String query = request.url().getQuery();
        if (query.contains("function=CPI")) {
            return StubExchange.json(series(310, 309, 308, 307, 306, 305, 304, 303, 302, 301, 300.5, 300.2, 300));
        }
        if (query.contains("function=FEDERAL_FUNDS_RATE")) {
            return StubExchange.json(series(5.33, 5.33, 5.12));
        }
        if (query.contains("function=REAL_GDP")) {
            return StubExchange.json(series(22000, 21800));
        }
        throw new AssertionError("unexpected query " + query);
    }

    private static EconomicDataWebClient client(Function<ClientRequest, ClientResponse> responder,
                                                AtomicInteger calls, String key) {
        return new EconomicDataWebClient(StubExchange.webClient(responder, calls), key,
            Duration.ofHours(1), Duration.ofSeconds(2));
    }

    @Nested
    @DisplayName("live indicators")
    class Live {

        @Test
        @DisplayName("CPI year-over-year, latest fed rate, GDP quarter-over-quarter")
        void derivations() {
            EconomicDataWebClient client = client(EconomicDataWebClientTest::answer, new AtomicInteger(), "key");

            StepVerifier.create(client.fetchSnapshot())
                .assertNext(s -> {
                    assertEquals((310.0 / 300.0 - 1) * 100, s.cpiYoyChange(), 1e-9);
                    assertEquals(5.33, s.fedRate(), 1e-12);
                    assertEquals((22000.0 / 21800.0 - 1) * 100, s.gdpGrowth(), 1e-9);
                    assertEquals("Stagflation Risk", s.label());
                    assertFalse(s.fallback());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("resolved snapshot is cached")
        void cached() {
            AtomicInteger calls = new AtomicInteger();
            EconomicDataWebClient client = client(EconomicDataWebClientTest::answer, calls, "key");

            EconomicSnapshot first = client.fetchSnapshot().block();
            EconomicSnapshot second = client.fetchSnapshot().block();
            assertEquals(first, second);
            assertEquals(3, calls.get());
        }

        @Test
        @DisplayName("one failing indicator falls back alone")
        void partialFallback() {
            EconomicDataWebClient client = client(req -> req.url().getQuery().contains("REAL_GDP")
                ? StubExchange.status(HttpStatus.SERVICE_UNAVAILABLE)
                : answer(req), new AtomicInteger(), "key");

            StepVerifier.create(client.fetchSnapshot())
                .assertNext(s -> {
                    assertEquals(EconomicDataWebClient.FALLBACK_GDP, s.gdpGrowth());
                    assertEquals(5.33, s.fedRate(), 1e-12);
                    assertTrue(s.fallback());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("rate-limit notice without data → fallback")
        void rateLimited() {
            EconomicDataWebClient client = client(
                req -> StubExchange.json("{\"Information\":\"rate limit\"}"), new AtomicInteger(), "key");

            StepVerifier.create(client.fetchSnapshot())
                .assertNext(s -> {
                    assertEquals(EconomicDataWebClient.FALLBACK_CPI, s.cpiYoyChange());
                    assertEquals(EconomicDataWebClient.FALLBACK_FED_RATE, s.fedRate());
                    assertTrue(s.fallback());
                })
                .verifyComplete();
        }
    }

    @Test
    @DisplayName("no API key → fallback values, nothing fetched")
    void unconfigured() {
        AtomicInteger calls = new AtomicInteger();
        EconomicDataWebClient client = client(EconomicDataWebClientTest::answer, calls, null);

        StepVerifier.create(client.fetchSnapshot())
            .assertNext(s -> {
                assertEquals(3.2, s.cpiYoyChange());
                assertEquals(5.25, s.fedRate());
                assertEquals(2.8, s.gdpGrowth());
                assertEquals("Stagflation Risk", s.label());
                assertTrue(s.fallback());
            })
            .verifyComplete();
        assertEquals(0, calls.get());
    }

    @Nested
    @DisplayName("derivations")
    class Derivations {

        @Test
        @DisplayName("CPI with fewer than 13 observations uses the previous one")
        void shortCpi() {
            assertEquals(1.0, EconomicDataWebClient.yearOverYear(List.of(101.0, 100.0)), 1e-9);
        }

        @Test
        @DisplayName("missing observations are skipped")
        void missingValues() {
            AlphaVantageSeriesResponse r = new AlphaVantageSeriesResponse("x", "monthly", "pct", List.of(
                new AlphaVantageSeriesResponse.Observation("d0", "."),
                new AlphaVantageSeriesResponse.Observation("d1", "4.5")));
            assertEquals(List.of(4.5), r.values());
        }
    }
}

package com.macroallocator.analysis.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.macroallocator.common.exception.DataUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class YahooMarketDataClientTest {

    private static final String CHART = """
        {"chart":{"result":[{"meta":{"symbol":"GLD"},
          "timestamp":[1,2,3,4],
          "indicators":{"quote":[{"close":[180.5,null,182.0,181.0]}]}}],
         "error":null}}
        """;

    @Test
    @DisplayName("requests one year of daily bars and skips null closes")
    void parsesCloses() {
        AtomicReference<String> requested = new AtomicReference<>();
        YahooMarketDataClient client = new YahooMarketDataClient(
            StubExchange.webClient(req -> {
                requested.set(req.url().toString());
                return StubExchange.json(CHART);
            }),
            new ObjectMapper());

        StepVerifier.create(client.dailyCloses("GLD"))
            .expectNext(List.of(180.5, 182.0, 181.0))
            .verifyComplete();

        assertTrue(requested.get().contains("/v8/finance/chart/GLD"));
        assertTrue(requested.get().contains("range=1y"));
        assertTrue(requested.get().contains("interval=1d"));
    }

    @Test
    @DisplayName("chart error → DataUnavailableException")
    void chartError() {
        String body = "{\"chart\":{\"result\":null,\"error\":{\"code\":\"Not Found\",\"description\":\"No data found\"}}}";
        YahooMarketDataClient client = new YahooMarketDataClient(
            StubExchange.webClient(req -> StubExchange.json(body)), new ObjectMapper());

        StepVerifier.create(client.dailyCloses("NOPE"))
            .expectError(DataUnavailableException.class)
            .verify();
    }

    @Test
    @DisplayName("upstream 404 propagates as an error")
    void notFound() {
        YahooMarketDataClient client = new YahooMarketDataClient(
            StubExchange.webClient(req -> StubExchange.status(HttpStatus.NOT_FOUND)), new ObjectMapper());

        StepVerifier.create(client.dailyCloses("GLD"))
            .expectError()
            .verify();
    }

    @Test
    @DisplayName("fewer than two usable closes → DataUnavailableException")
    void tooFewCloses() {
        YahooMarketDataClient client = new YahooMarketDataClient(null, new ObjectMapper());
        String body = "{\"chart\":{\"result\":[{\"indicators\":{\"quote\":[{\"close\":[null,101.0]}]}}],\"error\":null}}";
        assertThrows(DataUnavailableException.class, () -> client.parseCloses("GLD", body));
    }
}

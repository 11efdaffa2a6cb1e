package com.macroallocator.analysis.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.macroallocator.common.exception.DataUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Daily closes from the Yahoo Finance chart endpoint:
 * {@code /v8/finance/chart/{symbol}?range=1y&interval=1d}.
 *
 * <p>Null or non-positive closes (halts, partial sessions) are skipped.
 */
public class YahooMarketDataClient implements MarketDataProvider {

    private static final Logger log = LoggerFactory.getLogger(YahooMarketDataClient.class);

    private static final String COMPONENT = "YahooMarketDataClient";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public YahooMarketDataClient(WebClient marketDataWebClient, ObjectMapper objectMapper) {
        this.webClient    = marketDataWebClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<List<Double>> dailyCloses(String symbol) {
        log.debug("Fetching market data. provider=Yahoo symbol={}", symbol);
        return webClient.get()
            .uri(uri -> uri.path("/v8/finance/chart/{symbol}")
                .queryParam("range", "1y")
                .queryParam("interval", "1d")
                .build(symbol))
            .retrieve()
            .bodyToMono(String.class)
            .map(json -> parseCloses(symbol, json))
            .doOnSuccess(closes -> log.debug("Market data fetched. provider=Yahoo symbol={} closes={}",
                                             symbol, closes == null ? 0 : closes.size()));
    }

    List<Double> parseCloses(String symbol, String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new DataUnavailableException(COMPONENT, "unparseable chart response for " + symbol, e);
        }

        JsonNode chart = root.path("chart");
        JsonNode error = chart.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new DataUnavailableException(COMPONENT,
                "chart error for " + symbol + ": " + error.path("description").asText("unknown"));
        }

        JsonNode closes = chart.path("result").path(0)
            .path("indicators").path("quote").path(0).path("close");
        if (!closes.isArray() || closes.isEmpty()) {
            throw new DataUnavailableException(COMPONENT, "no close prices for " + symbol);
        }

        List<Double> out = new ArrayList<>(closes.size());
        for (JsonNode c : closes) {
            if (c.isNull() || !c.isNumber()) continue;
            double close = c.asDouble();
            if (Double.isFinite(close) && close > 0.0) {
                out.add(close);
            }
        }
        if (out.size() < 2) {
            throw new DataUnavailableException(COMPONENT, "fewer than two usable closes for " + symbol);
        }
        return out;
    }
}

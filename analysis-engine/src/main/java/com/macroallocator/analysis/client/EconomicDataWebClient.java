package com.macroallocator.analysis.client;

import com.macroallocator.common.economic.EconomicContextResolver;
import com.macroallocator.common.exception.DataUnavailableException;
import com.macroallocator.common.model.EconomicSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Macro indicators from Alpha Vantage, resolved into an {@link EconomicSnapshot}.
 *
 * <ul>
 *   <li>CPI (monthly): year-over-year % against the observation 12 months back, or the
 *       previous observation when fewer exist</li>
 *   <li>FEDERAL_FUNDS_RATE (monthly): latest value</li>
 *   <li>REAL_GDP (quarterly): quarter-over-quarter %</li>
 * </ul>
 *
 * <p>Each indicator falls back independently ({@value #FALLBACK_CPI}, {@value #FALLBACK_FED_RATE},
 * {@value #FALLBACK_GDP}); without an API key nothing is fetched. The resolved snapshot is
 * cached for {@code cacheTtl}. Never errors.
 */
public class EconomicDataWebClient {

    private static final Logger log = LoggerFactory.getLogger(EconomicDataWebClient.class);

    private static final String COMPONENT = "EconomicDataWebClient";

    public static final double FALLBACK_CPI      = 3.2;
    public static final double FALLBACK_FED_RATE = 5.25;
    public static final double FALLBACK_GDP      = 2.8;

    private record Indicator(double value, boolean fallback) {}

    private record CachedSnapshot(EconomicSnapshot snapshot, Instant fetchedAt) {}

    private final WebClient webClient;
    private final String apiKey;
    private final Duration cacheTtl;
    private final Duration timeout;
    private final AtomicReference<CachedSnapshot> cache = new AtomicReference<>();

    public EconomicDataWebClient(WebClient economicWebClient, String apiKey, Duration cacheTtl, Duration timeout) {
        this.webClient = economicWebClient;
        this.apiKey    = apiKey;
        this.cacheTtl  = cacheTtl;
        this.timeout   = timeout;
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    public Mono<EconomicSnapshot> fetchSnapshot() {
        CachedSnapshot cached = cache.get();
        if (cached != null && Instant.now().isBefore(cached.fetchedAt().plus(cacheTtl))) {
            return Mono.just(cached.snapshot());
        }
        if (!isConfigured()) {
            return Mono.just(fallbackSnapshot());
        }

        return Mono.zip(
                indicator("CPI", "monthly", EconomicDataWebClient::yearOverYear, FALLBACK_CPI),
                indicator("FEDERAL_FUNDS_RATE", "monthly", EconomicDataWebClient::latest, FALLBACK_FED_RATE),
                indicator("REAL_GDP", "quarterly", EconomicDataWebClient::quarterOverQuarter, FALLBACK_GDP))
            .map(t -> {
                EconomicSnapshot snapshot = EconomicContextResolver
                    .resolve(t.getT1().value(), t.getT2().value(), t.getT3().value())
                    .withFallback(t.getT1().fallback() || t.getT2().fallback() || t.getT3().fallback());
                log.info("Economic context resolved. cpi={} fedRate={} gdp={} label={} fallback={}",
                         snapshot.cpiYoyChange(), snapshot.fedRate(), snapshot.gdpGrowth(),
                         snapshot.label(), snapshot.fallback());
                if (!snapshot.fallback()) {
                    cache.set(new CachedSnapshot(snapshot, Instant.now()));
                }
                return snapshot;
            });
    }

    // ── per-indicator fetch ───────────────────────────────────────────────

    private Mono<Indicator> indicator(String function, String interval,
                                      Function<List<Double>, Double> derive,
                                      double fallback) {
        return webClient.get()
            .uri(uri -> uri.path("/query")
                .queryParam("function", function)
                .queryParam("interval", interval)
                .queryParam("apikey", apiKey)
                .build())
            .retrieve()
            .bodyToMono(AlphaVantageSeriesResponse.class)
            .timeout(timeout)
            .map(response -> new Indicator(derive.apply(response.values()), false))
            .onErrorResume(e -> {
                log.warn("Economic indicator unavailable, using fallback. function={} fallback={} reason={}",
                         function, fallback, e.getMessage());
                return Mono.just(new Indicator(fallback, true));
            });
    }

    static Double latest(List<Double> newestFirst) {
        require(newestFirst, 1, "FEDERAL_FUNDS_RATE");
        return newestFirst.get(0);
    }

    static Double yearOverYear(List<Double> newestFirst) {
        require(newestFirst, 2, "CPI");
        int back = newestFirst.size() > 12 ? 12 : 1;
        return percentChange(newestFirst.get(0), newestFirst.get(back));
    }

    static Double quarterOverQuarter(List<Double> newestFirst) {
        require(newestFirst, 2, "REAL_GDP");
        return percentChange(newestFirst.get(0), newestFirst.get(1));
    }

    private static double percentChange(double current, double previous) {
        if (previous == 0.0) {
            throw new DataUnavailableException(COMPONENT, "zero base observation");
        }
        return (current / previous - 1.0) * 100.0;
    }

    private static void require(List<Double> values, int minimum, String function) {
        if (values.size() < minimum) {
            throw new DataUnavailableException(COMPONENT,
                function + " returned " + values.size() + " observations, need " + minimum);
        }
    }

    private static EconomicSnapshot fallbackSnapshot() {
        return EconomicContextResolver.resolve(FALLBACK_CPI, FALLBACK_FED_RATE, FALLBACK_GDP).withFallback(true);
    }
}

package com.macroallocator.analysis.universe;

import com.macroallocator.analysis.client.MarketDataProvider;
import com.macroallocator.common.exception.DataUnavailableException;
import com.macroallocator.common.model.Ticker;
import com.macroallocator.common.universe.CatalogSnapshot;
import com.macroallocator.common.universe.SyntheticSeriesGenerator;
import com.macroallocator.common.universe.TickerCatalog;
import com.macroallocator.common.universe.TickerDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current {@link CatalogSnapshot} and knows how to rebuild it.
 *
 * <p><strong>Load:</strong> every catalog ticker is fetched concurrently (bounded by
 * {@code concurrency}), each with its own timeout and backoff retries. A ticker whose
 * fetch is exhausted is replaced by a seeded synthetic series and flagged; one failure
 * never affects another ticker. The finished list is published by swapping the
 * snapshot reference, so in-flight requests keep reading the snapshot they started with.
 *
 * <p><strong>Bootstrap:</strong> requests arriving before the first load has finished
 * wait at most {@code bootstrapBudget} for it. Past that budget a provisional snapshot is
 * published: tickers already fetched are kept, the rest are synthesized. The bootstrap
 * load keeps running and replaces the provisional snapshot when it completes.
 *
 * <p><strong>Single writer:</strong> only {@link UniverseRefreshScheduler} and the
 * first-request bootstrap call {@link #load()}.
 */
@Component
public class CandidateUniverse {

    private static final Logger log = LoggerFactory.getLogger(CandidateUniverse.class);

    private static final String COMPONENT = "CandidateUniverse";
    private static final int MIN_CLOSES = 3;

    public static final Duration DEFAULT_BOOTSTRAP_BUDGET = Duration.ofSeconds(8);

    private final MarketDataProvider provider;
    private final SyntheticSeriesGenerator syntheticGenerator;
    private final List<TickerDefinition> catalog;
    private final int concurrency;
    private final Duration fetchTimeout;
    private final int maxRetries;
    private final Duration backoff;
    private final Duration bootstrapBudget;

    private final AtomicReference<CatalogSnapshot> current = new AtomicReference<>();
    private final AtomicReference<Map<String, Ticker>> arrived = new AtomicReference<>(Map.of());
    private final AtomicBoolean bootstrapStarted = new AtomicBoolean();
    private final Mono<CatalogSnapshot> bootstrap;

    @Autowired
    public CandidateUniverse(MarketDataProvider provider,
                             SyntheticSeriesGenerator syntheticGenerator,
                             @Value("${universe.fetch.concurrency:8}") int concurrency,
                             @Value("${universe.fetch.timeout:10s}") Duration fetchTimeout,
                             @Value("${universe.fetch.max-retries:2}") int maxRetries,
                             @Value("${universe.fetch.backoff:500ms}") Duration backoff,
                             @Value("${universe.bootstrap-budget:8s}") Duration bootstrapBudget) {
        this(provider, syntheticGenerator, TickerCatalog.DEFAULT, concurrency, fetchTimeout, maxRetries, backoff,
             bootstrapBudget);
    }

    public CandidateUniverse(MarketDataProvider provider,
                             SyntheticSeriesGenerator syntheticGenerator,
                             List<TickerDefinition> catalog,
                             int concurrency,
                             Duration fetchTimeout,
                             int maxRetries,
                             Duration backoff) {
        this(provider, syntheticGenerator, catalog, concurrency, fetchTimeout, maxRetries, backoff,
             DEFAULT_BOOTSTRAP_BUDGET);
    }

    public CandidateUniverse(MarketDataProvider provider,
                             SyntheticSeriesGenerator syntheticGenerator,
                             List<TickerDefinition> catalog,
                             int concurrency,
                             Duration fetchTimeout,
                             int maxRetries,
                             Duration backoff,
                             Duration bootstrapBudget) {
        this.provider           = provider;
        this.syntheticGenerator = syntheticGenerator;
        this.catalog            = List.copyOf(catalog);
        this.concurrency        = concurrency;
        this.fetchTimeout       = fetchTimeout;
        this.maxRetries         = maxRetries;
        this.backoff            = backoff;
        this.bootstrapBudget    = bootstrapBudget;
        this.bootstrap          = Mono.defer(this::load).cache();
    }

    /**
     * Fetches the whole catalog and publishes the result as the current snapshot.
     * Never errors: failed tickers are synthesized.
     */
    public Mono<CatalogSnapshot> load() {
        return Mono.defer(() -> {
            Instant started = Instant.now();
            Map<String, Ticker> fetched = new ConcurrentHashMap<>();
            arrived.set(fetched);
            return Flux.fromIterable(catalog)
                .flatMapSequential(definition -> fetchTicker(definition)
                    .doOnNext(ticker -> fetched.put(ticker.symbol(), ticker)), concurrency)
                .collectList()
                .map(tickers -> new CatalogSnapshot(tickers, Instant.now()))
                .doOnNext(snapshot -> {
                    current.set(snapshot);
                    log.info("UNIVERSE_LOADED tickers={} synthetic={} elapsedMs={}",
                             snapshot.size(), snapshot.syntheticCount(),
                             Duration.between(started, snapshot.loadedAt()).toMillis());
                });
        });
    }

    /**
     * Snapshot for one request. Before the first load has completed, the request joins
     * (or starts) the one-off bootstrap load, waiting no longer than the bootstrap budget.
     */
    public Mono<CatalogSnapshot> snapshot() {
        CatalogSnapshot snapshot = current.get();
        if (snapshot != null) {
            return Mono.just(snapshot);
        }
        if (bootstrapStarted.compareAndSet(false, true)) {
            // held independently so a timed-out request never cancels the load
            bootstrap.subscribe(
                loaded -> log.debug("Bootstrap load finished. tickers={}", loaded.size()),
                err -> log.error("Bootstrap load failed", err));
        }
        return bootstrap.timeout(bootstrapBudget, Mono.fromSupplier(this::publishProvisional));
    }

    public Optional<CatalogSnapshot> currentSnapshot() {
        return Optional.ofNullable(current.get());
    }

    private CatalogSnapshot publishProvisional() {
        Map<String, Ticker> fetched = arrived.get();
        List<Ticker> tickers = new ArrayList<>(catalog.size());
        for (TickerDefinition definition : catalog) {
            Ticker ticker = fetched.get(definition.symbol());
            tickers.add(ticker != null ? ticker : syntheticGenerator.synthesize(definition));
        }
        CatalogSnapshot provisional = new CatalogSnapshot(tickers, Instant.now());
        if (current.compareAndSet(null, provisional)) {
            log.warn("UNIVERSE_PROVISIONAL bootstrap exceeded budget, serving partial catalog. budgetMs={} "
                     + "completed={} synthetic={}",
                     bootstrapBudget.toMillis(), fetched.size(), provisional.syntheticCount());
            return provisional;
        }
        return current.get();
    }

    // ── per-ticker fetch ──────────────────────────────────────────────────

    private Mono<Ticker> fetchTicker(TickerDefinition definition) {
        return Mono.defer(() -> provider.dailyCloses(definition.symbol()))
            .timeout(fetchTimeout)
            .retryWhen(Retry.backoff(maxRetries, backoff))
            .flatMap(closes -> closes.size() < MIN_CLOSES
                ? Mono.error(new DataUnavailableException(COMPONENT,
                      "only " + closes.size() + " closes for " + definition.symbol()))
                : Mono.just(new Ticker(definition.symbol(), definition.name(), definition.sector(),
                                       toReturns(closes), false)))
            .onErrorResume(e -> {
                log.warn("Market data unavailable, using synthetic series. symbol={} reason={}",
                         definition.symbol(), rootMessage(e));
                return Mono.just(syntheticGenerator.synthesize(definition));
            });
    }

    /** Simple returns between consecutive closes, oldest first. */
    static List<Double> toReturns(List<Double> closes) {
        List<Double> returns = new ArrayList<>(Math.max(0, closes.size() - 1));
        for (int i = 1; i < closes.size(); i++) {
            returns.add(closes.get(i) / closes.get(i - 1) - 1.0);
        }
        return returns;
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}

package com.macroallocator.analysis.universe;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Keeps the candidate universe fresh:
 * <pre>
 *   delay(interval) → load catalog → publish snapshot → repeat
 * </pre>
 *
 * <p>Each cycle is a fresh {@link Mono} whose subscriber schedules the next one, so the
 * wait never blocks a thread. A failed cycle is logged and the loop carries on with the
 * normal interval; it only stops when the application context closes.
 */
@Component
public class UniverseRefreshScheduler {

    private static final Logger log = LoggerFactory.getLogger(UniverseRefreshScheduler.class);

    private final CandidateUniverse universe;

    @Value("${universe.refresh.enabled:true}")
    private boolean enabled;

    @Value("${universe.refresh.interval:30m}")
    private Duration interval;

    private volatile boolean running;
    private volatile Disposable inFlight;

    public UniverseRefreshScheduler(CandidateUniverse universe) {
        this.universe = universe;
    }

    @PostConstruct
    public void start() {
        if (!enabled) {
            log.info("Universe refresh disabled. The first request loads the catalog.");
            return;
        }
        running = true;
        log.info("Universe refresh started. intervalSeconds={}", interval.toSeconds());
        inFlight = universe.snapshot().subscribe(
            snapshot -> scheduleNextCycle(interval),
            err -> {
                log.error("Initial universe load failed, retrying after interval", err);
                scheduleNextCycle(interval);
            });
    }

    @PreDestroy
    public void stop() {
        running = false;
        Disposable d = inFlight;
        if (d != null) {
            d.dispose();
        }
    }

    private void scheduleNextCycle(Duration delay) {
        if (!running) {
            return;
        }
        inFlight = Mono.delay(delay)
            .then(Mono.defer(universe::load))
            .subscribe(
                snapshot -> scheduleNextCycle(interval),
                err -> {
                    log.error("Universe refresh cycle failed, rescheduling. intervalSeconds={}",
                              interval.toSeconds(), err);
                    scheduleNextCycle(interval);
                });
    }
}

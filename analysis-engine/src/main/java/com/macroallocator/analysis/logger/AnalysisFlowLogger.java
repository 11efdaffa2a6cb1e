package com.macroallocator.analysis.logger;

import com.macroallocator.common.model.AnalysisResult;
import com.macroallocator.common.optimizer.OptimizationOutcome;
import com.macroallocator.common.trace.RequestTrace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Stage logging for one analysis request. Pure side effects; never changes the pipeline.
 *
 * <p>Stages (in order):
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED}     : narrative accepted by the controller</li>
 *   <li>{@link #NARRATIVE_RESOLVED}   : plain text ready (URL pages fetched and extracted)</li>
 *   <li>{@link #CONTEXT_FETCHED}      : headlines, macro indicators and universe snapshot in hand</li>
 *   <li>{@link #REGIME_CLASSIFIED}    : regime and sector tilt decided</li>
 *   <li>{@link #PORTFOLIO_OPTIMIZED}  : subset and weights chosen</li>
 *   <li>{@link #RISK_ANALYZED}        : simulation finished</li>
 * </ol>
 *
 * <p>With {@code doOnEach} the request id is read from the Reactor Context:
 * <pre>
 *     .doOnEach(flowLogger.stage(AnalysisFlowLogger.NARRATIVE_RESOLVED))
 * </pre>
 */
@Component
public class AnalysisFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(AnalysisFlowLogger.class);

    public static final String REQUEST_RECEIVED    = "REQUEST_RECEIVED";
    public static final String NARRATIVE_RESOLVED  = "NARRATIVE_RESOLVED";
    public static final String CONTEXT_FETCHED     = "CONTEXT_FETCHED";
    public static final String REGIME_CLASSIFIED   = "REGIME_CLASSIFIED";
    public static final String PORTFOLIO_OPTIMIZED = "PORTFOLIO_OPTIMIZED";
    public static final String RISK_ANALYZED       = "RISK_ANALYZED";

    /**
     * {@code doOnEach} consumer that logs {@code stageName} on every onNext signal.
     * Errors and completion are ignored.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String requestId = RequestTrace.requestId(signal.getContextView());
            logWithRequestId(stageName, requestId);
        };
    }

    public void logWithRequestId(String stageName, String requestId) {
        RequestTrace.inStage(requestId, stageName, () ->
            log.info("[AnalysisFlow] stage={} requestId={}", stageName, requestId)
        );
    }

    public void logOptimization(OptimizationOutcome outcome, String requestId) {
        RequestTrace.inStage(requestId, PORTFOLIO_OPTIMIZED, () -> {
            if (outcome.exactTimedOut()) {
                log.warn("[AnalysisFlow] Exact solver exceeded its time budget, used {} instead. requestId={}",
                         outcome.solver(), requestId);
            }
            log.info("[AnalysisFlow] stage={} solver={} subsets={} tickers={} feasible={} requestId={}",
                     PORTFOLIO_OPTIMIZED, outcome.solver(), outcome.evaluatedSubsets(),
                     outcome.selection().tickers(), outcome.selection().feasible(), requestId);
        });
    }

    /** One-line summary once the result is assembled. */
    public void logResult(AnalysisResult result, String requestId) {
        RequestTrace.inStage(requestId, RISK_ANALYZED, () ->
            log.info("[AnalysisFlow] stage={} regime={} sentiment={} candidates={} selected={} "
                     + "var={} cvar={} economic={} synthetic={} requestId={}",
                     RISK_ANALYZED,
                     result.assessment().regime(),
                     String.format("%.3f", result.assessment().sentiment()),
                     result.candidates().size(),
                     result.selection().tickers(),
                     String.format("%.4f", result.risk().var()),
                     String.format("%.4f", result.risk().cvar()),
                     result.economic() != null ? result.economic().label() : "N/A",
                     result.synthetic(),
                     requestId)
        );
    }
}

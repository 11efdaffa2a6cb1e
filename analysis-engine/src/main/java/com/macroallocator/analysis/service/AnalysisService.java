package com.macroallocator.analysis.service;

import com.macroallocator.analysis.client.EconomicDataWebClient;
import com.macroallocator.analysis.client.NarrativeResolver;
import com.macroallocator.analysis.client.NewsWebClient;
import com.macroallocator.analysis.logger.AnalysisFlowLogger;
import com.macroallocator.analysis.universe.CandidateUniverse;
import com.macroallocator.common.classifier.RegimeClassifier;
import com.macroallocator.common.exception.AllocatorException;
import com.macroallocator.common.exception.InternalException;
import com.macroallocator.common.model.AnalysisResult;
import com.macroallocator.common.model.EconomicSnapshot;
import com.macroallocator.common.model.HeadlineBatch;
import com.macroallocator.common.model.PortfolioSelection;
import com.macroallocator.common.model.RegimeAssessment;
import com.macroallocator.common.model.RiskMetrics;
import com.macroallocator.common.model.Ticker;
import com.macroallocator.common.optimizer.OptimizationOutcome;
import com.macroallocator.common.optimizer.PortfolioOptimizer;
import com.macroallocator.common.optimizer.SolverDeadline;
import com.macroallocator.common.risk.RiskAnalyzer;
import com.macroallocator.common.trace.RequestTrace;
import com.macroallocator.common.universe.CatalogSnapshot;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Runs one narrative through the full pipeline:
 * <pre>
 *   resolve narrative → (headlines ∥ macro indicators ∥ universe snapshot)
 *     → classify → filter by sector tilt → optimize → simulate risk → result
 * </pre>
 *
 * <p>The CPU-bound part runs on {@code boundedElastic} under the exact solver's time budget;
 * the whole request is bounded by {@code analysis.request-timeout}. Cancelling the
 * subscription (client disconnect, request timeout) sets the solver's cancel flag.
 *
 * <p>Failures other than {@link AllocatorException}s are wrapped in
 * {@link InternalException}; no partial result is ever emitted.
 */
@Service
public class AnalysisService {

    private static final String COMPONENT = "AnalysisService";

    private final NarrativeResolver narrativeResolver;
    private final NewsWebClient newsClient;
    private final EconomicDataWebClient economicClient;
    private final CandidateUniverse universe;
    private final RegimeClassifier classifier;
    private final PortfolioOptimizer optimizer;
    private final RiskAnalyzer riskAnalyzer;
    private final AnalysisFlowLogger flowLogger;

    @Value("${analysis.request-timeout:20s}")
    private Duration requestTimeout;

    @Value("${optimizer.exact-time-budget:2s}")
    private Duration exactTimeBudget;

    public AnalysisService(NarrativeResolver narrativeResolver,
                           NewsWebClient newsClient,
                           EconomicDataWebClient economicClient,
                           CandidateUniverse universe,
                           RegimeClassifier classifier,
                           PortfolioOptimizer optimizer,
                           RiskAnalyzer riskAnalyzer,
                           AnalysisFlowLogger flowLogger) {
        this.narrativeResolver = narrativeResolver;
        this.newsClient        = newsClient;
        this.economicClient    = economicClient;
        this.universe          = universe;
        this.classifier        = classifier;
        this.optimizer         = optimizer;
        this.riskAnalyzer      = riskAnalyzer;
        this.flowLogger        = flowLogger;
    }

    public Mono<AnalysisResult> analyze(String text) {
        String requestId = UUID.randomUUID().toString();
        flowLogger.logWithRequestId(AnalysisFlowLogger.REQUEST_RECEIVED, requestId);

        Mono<AnalysisResult> pipeline = narrativeResolver.resolve(text)
            .doOnEach(flowLogger.stage(AnalysisFlowLogger.NARRATIVE_RESOLVED))
            .flatMap(narrative -> Mono.zip(
                    newsClient.fetchHeadlines(),
                    economicClient.fetchSnapshot(),
                    universe.snapshot())
                .doOnEach(flowLogger.stage(AnalysisFlowLogger.CONTEXT_FETCHED))
                .flatMap(ctx -> compute(narrative, ctx.getT1(), ctx.getT2(), ctx.getT3(), requestId)))
            .timeout(requestTimeout)
            .onErrorMap(e -> !(e instanceof AllocatorException), e -> e instanceof TimeoutException
                ? new InternalException(COMPONENT, "analysis exceeded " + requestTimeout.toMillis() + "ms", e)
                : new InternalException(COMPONENT, "unexpected failure: " + e.getMessage(), e));

        return RequestTrace.bind(pipeline, requestId);
    }

    // ── CPU-bound stages ──────────────────────────────────────────────────

    private Mono<AnalysisResult> compute(String narrative, HeadlineBatch headlines, EconomicSnapshot economic,
                                         CatalogSnapshot snapshot, String requestId) {
        return Mono.defer(() -> {
            SolverDeadline deadline = SolverDeadline.after(exactTimeBudget);
            return Mono.fromCallable(() -> run(narrative, headlines, economic, snapshot, deadline, requestId))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnCancel(deadline::cancel);
        });
    }

    private AnalysisResult run(String narrative, HeadlineBatch headlines, EconomicSnapshot economic,
                               CatalogSnapshot snapshot, SolverDeadline deadline, String requestId) {
        RegimeAssessment assessment = classifier.classify(narrative, headlines);
        flowLogger.logWithRequestId(AnalysisFlowLogger.REGIME_CLASSIFIED, requestId);

        List<Ticker> candidates = snapshot.filter(assessment.sectors());

        OptimizationOutcome outcome = optimizer.optimize(candidates, assessment.regime(), deadline);
        flowLogger.logOptimization(outcome, requestId);

        PortfolioSelection selection = outcome.selection();
        RiskMetrics risk = riskAnalyzer.analyze(selection, candidates);

        AnalysisResult result = new AnalysisResult(assessment, selection, risk, candidates, economic);
        flowLogger.logResult(result, requestId);
        return result;
    }
}

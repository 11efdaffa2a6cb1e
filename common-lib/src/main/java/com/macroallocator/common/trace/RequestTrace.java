package com.macroallocator.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Request id and analysis stage for log correlation.
 *
 * <p>The id lives in the Reactor Context of the analysis pipeline. MDC sees it (and the
 * current stage) only while one log action runs; whatever the thread held before is put
 * back afterwards, so nested calls and pooled threads stay clean.
 */
public final class RequestTrace {

    public static final String REQUEST_ID_KEY = "requestId";
    public static final String STAGE_KEY = "stage";
    public static final String UNKNOWN = "unknown";

    private RequestTrace() {}

    /** Binds {@code requestId} to {@code pipeline}; apply at the end of assembly. */
    public static <T> Mono<T> bind(Mono<T> pipeline, String requestId) {
        return pipeline.contextWrite(ctx -> ctx.put(REQUEST_ID_KEY, requestId));
    }

    public static String requestId(ContextView ctx) {
        return ctx.getOrDefault(REQUEST_ID_KEY, UNKNOWN);
    }

    /**
     * Runs {@code logAction} with {@code requestId} and {@code stage} in MDC, then restores
     * the previous MDC values for both keys.
     */
    public static void inStage(String requestId, String stage, Runnable logAction) {
        String previousId = MDC.get(REQUEST_ID_KEY);
        String previousStage = MDC.get(STAGE_KEY);
        MDC.put(REQUEST_ID_KEY, requestId);
        MDC.put(STAGE_KEY, stage);
        try {
            logAction.run();
        } finally {
            restore(REQUEST_ID_KEY, previousId);
            restore(STAGE_KEY, previousStage);
        }
    }

    private static void restore(String key, String previous) {
        if (previous == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, previous);
        }
    }
}

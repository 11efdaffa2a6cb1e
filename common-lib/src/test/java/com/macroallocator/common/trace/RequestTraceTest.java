package com.macroallocator.common.trace;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class RequestTraceTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Nested
    @DisplayName("Reactor Context")
    class Context {

        @Test
        @DisplayName("bound request id is visible upstream")
        void bound() {
            Mono<String> pipeline = Mono.deferContextual(ctx -> Mono.just(RequestTrace.requestId(ctx)));
            assertEquals("req-1", RequestTrace.bind(pipeline, "req-1").block());
        }

        @Test
        @DisplayName("unbound pipeline reports unknown")
        void unbound() {
            Mono<String> pipeline = Mono.deferContextual(ctx -> Mono.just(RequestTrace.requestId(ctx)));
            assertEquals(RequestTrace.UNKNOWN, pipeline.block());
        }
    }

    @Nested
    @DisplayName("MDC bridge")
    class Mdc {

        @Test
        @DisplayName("id and stage present only while the action runs")
        void scoped() {
            AtomicReference<String> seenId = new AtomicReference<>();
            AtomicReference<String> seenStage = new AtomicReference<>();

            RequestTrace.inStage("req-2", "REGIME_CLASSIFIED", () -> {
                seenId.set(MDC.get(RequestTrace.REQUEST_ID_KEY));
                seenStage.set(MDC.get(RequestTrace.STAGE_KEY));
            });

            assertEquals("req-2", seenId.get());
            assertEquals("REGIME_CLASSIFIED", seenStage.get());
            assertNull(MDC.get(RequestTrace.REQUEST_ID_KEY));
            assertNull(MDC.get(RequestTrace.STAGE_KEY));
        }

        @Test
        @DisplayName("nested call restores the outer values, even on failure")
        void nested() {
            AtomicReference<String> afterInner = new AtomicReference<>();

            RequestTrace.inStage("outer", "CONTEXT_FETCHED", () -> {
                assertThrows(IllegalStateException.class, () ->
                    RequestTrace.inStage("inner", "RISK_ANALYZED", () -> {
                        throw new IllegalStateException("boom");
                    }));
                afterInner.set(MDC.get(RequestTrace.REQUEST_ID_KEY) + "/" + MDC.get(RequestTrace.STAGE_KEY));
            });

            assertEquals("outer/CONTEXT_FETCHED", afterInner.get());
            assertNull(MDC.get(RequestTrace.REQUEST_ID_KEY));
        }
    }
}

package com.killfeed.engine.infra.disruptor.handler;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineExceptionHandlerTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final PipelineExceptionHandler<String> handler = new PipelineExceptionHandler<>("ingest", registry);

    @Test
    void countsDroppedSlotsByCause() {
        handler.handleEventException(new IllegalStateException("boom"), 3, "chunk");
        handler.handleEventException(new IllegalStateException("boom"), 9, "chunk");
        handler.handleEventException(new NullPointerException(), 12, "chunk");

        assertThat(registry.get("killfeed.pipeline.exceptions")
                .tag("pipeline", "ingest").tag("cause", "IllegalStateException").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("killfeed.pipeline.exceptions")
                .tag("cause", "NullPointerException").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void streakGrowsOnlyForAdjacentSequences() {
        handler.handleEventException(new RuntimeException(), 5, "a");
        handler.handleEventException(new RuntimeException(), 6, "b");
        handler.handleEventException(new RuntimeException(), 7, "c");
        assertThat(handler.currentFailureStreak()).isEqualTo(3);

        handler.handleEventException(new RuntimeException(), 20, "d");
        assertThat(handler.currentFailureStreak()).isEqualTo(1);
    }

    @Test
    void startFailureAbortsPipeline() {
        assertThatThrownBy(() -> handler.handleOnStartException(new RuntimeException("no file")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("ingest");
    }
}

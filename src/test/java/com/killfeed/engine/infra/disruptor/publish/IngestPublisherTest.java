package com.killfeed.engine.infra.disruptor.publish;

import com.killfeed.engine.infra.disruptor.event.IngestEvent;
import com.killfeed.engine.infra.disruptor.event.IngestEventFactory;
import com.killfeed.engine.infra.disruptor.event.IngestEventType;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.Sequence;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IngestPublisherTest {

    private RingBuffer<IngestEvent> ringBuffer;
    private SimpleMeterRegistry meterRegistry;
    private IngestPublisher publisher;

    @BeforeEach
    void setUp() {
        ringBuffer = RingBuffer.createSingleProducer(new IngestEventFactory(), 16);
        // consumer that never advances, so published slots stay occupied
        ringBuffer.addGatingSequences(new Sequence());
        meterRegistry = new SimpleMeterRegistry();
        publisher = new IngestPublisher(ringBuffer, meterRegistry);
        publisher.initMetrics();
    }

    @Test
    void publishesChunkIntoRing() {
        assertThat(publisher.publishChunk("line\n", "Game.log")).isTrue();

        IngestEvent event = ringBuffer.get(0);
        assertThat(event.getType()).isEqualTo(IngestEventType.LOG_CHUNK);
        assertThat(event.getChunk()).isEqualTo("line\n");
        assertThat(event.getOrigin()).isEqualTo("Game.log");
        assertThat(meterRegistry.get("killfeed.ingest.chunks").counter().count()).isEqualTo(1.0);
    }

    @Test
    void resetIsQueuedBehindChunks() {
        publisher.publishChunk("line\n", "Game.log");
        publisher.publishReset("rescan");

        assertThat(ringBuffer.get(1).getType()).isEqualTo(IngestEventType.SESSION_RESET);
        assertThat(ringBuffer.get(1).getChunk()).isNull();
        assertThat(ringBuffer.get(1).getOrigin()).isEqualTo("rescan");
    }

    @Test
    void rejectsChunksAboveBackpressureThreshold() {
        for (int i = 0; i < 15; i++) {
            assertThat(publisher.publishChunk("line " + i + "\n", "api")).isTrue();
        }
        assertThat(publisher.getRingBufferUtilization()).isGreaterThan(0.9);

        assertThat(publisher.publishChunk("one too many\n", "api")).isFalse();
        assertThat(meterRegistry.get("killfeed.events.dropped").tag("reason", "backpressure").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void emptyChunkIsAcceptedWithoutPublishing() {
        assertThat(publisher.publishChunk("", "api")).isTrue();

        assertThat(ringBuffer.getCursor()).isEqualTo(-1L);
    }
}

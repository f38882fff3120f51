package com.killfeed.engine.infra.disruptor.config;

import com.killfeed.engine.infra.disruptor.event.IngestEvent;
import com.killfeed.engine.infra.disruptor.event.IngestEventFactory;
import com.killfeed.engine.infra.disruptor.handler.LogScanEventHandler;
import com.killfeed.engine.infra.disruptor.handler.PipelineExceptionHandler;
import com.killfeed.engine.infra.disruptor.handler.SessionRelayHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class IngestDisruptorConfig {

    private final LogScanEventHandler logScanEventHandler;
    private final SessionRelayHandler sessionRelayHandler;
    private final PipelineProperties pipelineProperties;
    private final MeterRegistry meterRegistry;
    private final Environment environment;

    private Disruptor<IngestEvent> ingestDisruptor;

    @Bean
    public Disruptor<IngestEvent> ingestDisruptor() {
        int size = PipelineThreads.checkedSize(pipelineProperties.getIngestBufferSize(), "ingest-buffer-size");
        WaitStrategy waitStrategy = PipelineThreads.waitStrategy(pipelineProperties, environment);

        ingestDisruptor = new Disruptor<>(new IngestEventFactory(), size,
                PipelineThreads.consumerThreads("ingest"), ProducerType.SINGLE, waitStrategy);

        ingestDisruptor.setDefaultExceptionHandler(
                new PipelineExceptionHandler<>("ingest", meterRegistry));

        ingestDisruptor.handleEventsWith(logScanEventHandler).then(sessionRelayHandler);
        ingestDisruptor.start();

        log.info("[Disruptor] ingest 링 기동 (scan → relay) size={} wait={}",
                size, waitStrategy.getClass().getSimpleName());

        return ingestDisruptor;
    }

    @Bean
    public RingBuffer<IngestEvent> ingestRingBuffer(Disruptor<IngestEvent> ingestDisruptor) {
        return ingestDisruptor.getRingBuffer();
    }

    @PreDestroy
    public void shutdown() {
        PipelineThreads.drainAndStop(ingestDisruptor, "ingest", pipelineProperties.getShutdownTimeoutMs());
    }
}

package com.killfeed.engine.infra.disruptor.config;

import com.killfeed.engine.infra.disruptor.event.FeedNotification;
import com.killfeed.engine.infra.disruptor.event.FeedNotificationFactory;
import com.killfeed.engine.infra.disruptor.handler.FeedBroadcastHandler;
import com.killfeed.engine.infra.disruptor.handler.PipelineExceptionHandler;
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
public class OutputDisruptorConfig {

    private final FeedBroadcastHandler feedBroadcastHandler;
    private final PipelineProperties pipelineProperties;
    private final MeterRegistry meterRegistry;
    private final Environment environment;

    private Disruptor<FeedNotification> outputDisruptor;

    @Bean
    public Disruptor<FeedNotification> feedNotificationDisruptor() {
        int size = PipelineThreads.checkedSize(pipelineProperties.getOutputBufferSize(), "output-buffer-size");
        WaitStrategy waitStrategy = PipelineThreads.waitStrategy(pipelineProperties, environment);

        outputDisruptor = new Disruptor<>(new FeedNotificationFactory(), size,
                PipelineThreads.consumerThreads("output"), ProducerType.MULTI, waitStrategy);

        outputDisruptor.setDefaultExceptionHandler(
                new PipelineExceptionHandler<>("output", meterRegistry));

        outputDisruptor.handleEventsWith(feedBroadcastHandler);
        outputDisruptor.start();

        log.info("[Disruptor] output 링 기동 (store change → STOMP) size={} wait={}",
                size, waitStrategy.getClass().getSimpleName());

        return outputDisruptor;
    }

    @Bean
    public RingBuffer<FeedNotification> feedNotificationRingBuffer(Disruptor<FeedNotification> feedNotificationDisruptor) {
        return feedNotificationDisruptor.getRingBuffer();
    }

    @PreDestroy
    public void shutdown() {
        PipelineThreads.drainAndStop(outputDisruptor, "output", pipelineProperties.getShutdownTimeoutMs());
    }
}

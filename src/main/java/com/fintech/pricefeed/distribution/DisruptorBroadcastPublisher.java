package com.fintech.pricefeed.distribution;

import com.fintech.pricefeed.config.PriceFeedProperties;
import com.fintech.pricefeed.domain.Observation;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.EventFactory;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands observations to the broadcast channel through an LMAX Disruptor ring buffer.
 *
 * Publishing never blocks ingestion: when the ring buffer is full the observation is
 * dropped and counted. A single consumer thread drains the buffer into the channel,
 * so per-instrument publish order is kept. Channel failures are logged and dropped.
 */
@Component
public class DisruptorBroadcastPublisher {

    private static final Logger log = LoggerFactory.getLogger(DisruptorBroadcastPublisher.class);

    private final BroadcastChannel channel;
    private final PriceFeedProperties.Distribution.Broadcast config;

    private final AtomicLong broadcastsDropped = new AtomicLong(0);
    private final AtomicLong channelFailures = new AtomicLong(0);
    private final AtomicLong broadcastsDelivered = new AtomicLong(0);

    private Disruptor<ObservationWrapper> disruptor;
    private RingBuffer<ObservationWrapper> ringBuffer;

    public DisruptorBroadcastPublisher(
            BroadcastChannel channel,
            PriceFeedProperties properties,
            MeterRegistry meterRegistry) {
        this.channel = channel;
        this.config = properties.getDistribution().getBroadcast();

        meterRegistry.gauge("price.feed.broadcast.dropped", broadcastsDropped);
        meterRegistry.gauge("price.feed.broadcast.channel.failures", channelFailures);
        meterRegistry.gauge("price.feed.broadcast.delivered", broadcastsDelivered);
        meterRegistry.gauge("price.feed.broadcast.remaining.capacity", this,
                DisruptorBroadcastPublisher::getRemainingCapacity);
    }

    @PostConstruct
    public void start() {
        int bufferSize = config.getBufferSize();

        EventFactory<ObservationWrapper> eventFactory = ObservationWrapper::new;

        ThreadFactory threadFactory = new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r);
                thread.setName("broadcast-publisher-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            }
        };

        WaitStrategy waitStrategy = createWaitStrategy();

        disruptor = new Disruptor<>(
            eventFactory,
            bufferSize,
            threadFactory,
            ProducerType.MULTI,  // fetch workers publish concurrently
            waitStrategy
        );

        disruptor.handleEventsWith(this::handleEvent);

        disruptor.setDefaultExceptionHandler(new ExceptionHandler<ObservationWrapper>() {
            @Override
            public void handleEventException(Throwable ex, long sequence, ObservationWrapper event) {
                channelFailures.incrementAndGet();
                log.warn("Broadcast channel failed, dropping update at sequence {}: {}",
                        sequence, event.observation, ex);
                event.observation = null;
            }

            @Override
            public void handleOnStartException(Throwable ex) {
                log.error("Exception during broadcast publisher startup", ex);
            }

            @Override
            public void handleOnShutdownException(Throwable ex) {
                log.error("Exception during broadcast publisher shutdown", ex);
            }
        });

        ringBuffer = disruptor.start();

        log.info("Broadcast publisher started: bufferSize={}, waitStrategy={}",
                bufferSize, waitStrategy.getClass().getSimpleName());
    }

    /**
     * Queues an observation for broadcast without blocking.
     *
     * @param observation The observation to broadcast
     * @return true if queued, false if the buffer was full (or not started) and it was dropped
     */
    public boolean tryPublish(Observation observation) {
        if (ringBuffer == null) {
            broadcastsDropped.incrementAndGet();
            return false;
        }
        try {
            long sequence = ringBuffer.tryNext();
            try {
                ringBuffer.get(sequence).observation = observation;
                return true;
            } finally {
                ringBuffer.publish(sequence);
            }
        } catch (InsufficientCapacityException e) {
            broadcastsDropped.incrementAndGet();
            log.debug("Broadcast buffer full, dropping update for {}", observation.instrumentId());
            return false;
        }
    }

    private void handleEvent(ObservationWrapper wrapper, long sequence, boolean endOfBatch) {
        Observation observation = wrapper.observation;
        if (observation != null) {
            channel.publish(observation);
            broadcastsDelivered.incrementAndGet();
        }
        wrapper.observation = null;
    }

    @PreDestroy
    public void shutdown() {
        if (disruptor != null) {
            log.info("Shutting down broadcast publisher...");
            disruptor.shutdown();
            ringBuffer = null;
            log.info("Broadcast publisher shutdown complete");
        }
    }

    private WaitStrategy createWaitStrategy() {
        String strategy = config.getWaitStrategy();

        return switch (strategy.toUpperCase()) {
            case "BLOCKING" -> new BlockingWaitStrategy();
            case "SLEEPING" -> new SleepingWaitStrategy();
            case "YIELDING" -> new YieldingWaitStrategy();
            case "BUSY_SPIN" -> new BusySpinWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy: {}, using BLOCKING", strategy);
                yield new BlockingWaitStrategy();
            }
        };
    }

    /**
     * Ring buffer slot. Pre-allocated by the Disruptor.
     */
    private static class ObservationWrapper {
        Observation observation;
    }

    public long getRemainingCapacity() {
        return ringBuffer != null ? ringBuffer.remainingCapacity() : 0;
    }

    /** Returns total observations dropped because the buffer was full. */
    public long getBroadcastsDropped() {
        return broadcastsDropped.get();
    }

    /** Returns total observations the channel rejected. */
    public long getChannelFailures() {
        return channelFailures.get();
    }

    /** Returns total observations handed to the channel. */
    public long getBroadcastsDelivered() {
        return broadcastsDelivered.get();
    }
}

package com.fintech.pricefeed.distribution;

import com.fintech.pricefeed.domain.Observation;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Synchronous PriceUpdateBus. Listeners run on the publishing thread, so they see
 * an instrument's updates in distribution order.
 */
@Component
public class InProcessPriceUpdateBus implements PriceUpdateBus {

    private static final Logger log = LoggerFactory.getLogger(InProcessPriceUpdateBus.class);

    private final ConcurrentMap<String, List<ListenerSubscription>> topics = new ConcurrentHashMap<>();
    private final List<ListenerSubscription> global = new CopyOnWriteArrayList<>();

    private final AtomicLong listenerErrors = new AtomicLong(0);

    public InProcessPriceUpdateBus(MeterRegistry meterRegistry) {
        meterRegistry.gauge("price.feed.bus.listener.errors", listenerErrors);
        meterRegistry.gauge("price.feed.bus.topics", topics, ConcurrentMap::size);
    }

    @Override
    public Subscription subscribe(String instrumentId, PriceUpdateListener listener) {
        Objects.requireNonNull(instrumentId, "Instrument id cannot be null");
        Objects.requireNonNull(listener, "Listener cannot be null");

        ListenerSubscription subscription = new ListenerSubscription(listener,
            self -> topics.computeIfPresent(instrumentId, (id, subscribers) -> {
                subscribers.remove(self);
                // The last cancellation drops the topic
                return subscribers.isEmpty() ? null : subscribers;
            }));
        topics.compute(instrumentId, (id, subscribers) -> {
            List<ListenerSubscription> target = subscribers != null ? subscribers : new CopyOnWriteArrayList<>();
            target.add(subscription);
            return target;
        });
        return subscription;
    }

    @Override
    public Subscription subscribeAll(PriceUpdateListener listener) {
        Objects.requireNonNull(listener, "Listener cannot be null");

        ListenerSubscription subscription = new ListenerSubscription(listener, global::remove);
        global.add(subscription);
        return subscription;
    }

    @Override
    public void publish(Observation observation) {
        List<ListenerSubscription> subscribers = topics.get(observation.instrumentId());
        if (subscribers != null) {
            subscribers.forEach(subscription -> deliver(subscription, observation));
        }
        global.forEach(subscription -> deliver(subscription, observation));
    }

    /** Returns the number of active subscriptions for an instrument topic. */
    public int subscriberCount(String instrumentId) {
        List<ListenerSubscription> subscribers = topics.get(instrumentId);
        return subscribers != null ? subscribers.size() : 0;
    }

    /** Returns the number of instruments with at least one subscription. */
    public int topicCount() {
        return topics.size();
    }

    public long getListenerErrors() {
        return listenerErrors.get();
    }

    private void deliver(ListenerSubscription subscription, Observation observation) {
        if (!subscription.isActive()) {
            return;
        }
        try {
            subscription.listener.onPriceUpdate(observation);
        } catch (RuntimeException e) {
            listenerErrors.incrementAndGet();
            log.error("Price update listener failed: instrument={}", observation.instrumentId(), e);
        }
    }

    private static final class ListenerSubscription implements Subscription {

        private final PriceUpdateListener listener;
        private final Consumer<ListenerSubscription> onCancel;
        private final AtomicBoolean active = new AtomicBoolean(true);

        ListenerSubscription(PriceUpdateListener listener, Consumer<ListenerSubscription> onCancel) {
            this.listener = listener;
            this.onCancel = onCancel;
        }

        @Override
        public void cancel() {
            if (active.compareAndSet(true, false)) {
                onCancel.accept(this);
            }
        }

        @Override
        public boolean isActive() {
            return active.get();
        }
    }
}

package com.fintech.pricefeed.distribution;

import com.fintech.pricefeed.config.PriceFeedProperties;
import com.fintech.pricefeed.domain.Observation;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Default broadcast transport: Server-Sent Events to HTTP clients.
 *
 * Clients either follow one instrument or every instrument. An emitter that fails to
 * send is completed and forgotten; the client is expected to reconnect.
 */
@Component
public class SseBroadcastChannel implements BroadcastChannel {

    private static final Logger log = LoggerFactory.getLogger(SseBroadcastChannel.class);

    static final String EVENT_NAME = "price";

    private final long emitterTimeoutMs;

    private final Set<SseEmitter> allClients = ConcurrentHashMap.newKeySet();
    private final ConcurrentMap<String, Set<SseEmitter>> instrumentClients = new ConcurrentHashMap<>();

    public SseBroadcastChannel(PriceFeedProperties properties, MeterRegistry meterRegistry) {
        this.emitterTimeoutMs = properties.getDistribution().getBroadcast().getSseTimeoutMs();

        meterRegistry.gauge("price.feed.stream.clients", this, SseBroadcastChannel::clientCount);
    }

    /**
     * Opens a stream for one instrument, or for every instrument when {@code instrumentId} is null.
     */
    public SseEmitter connect(String instrumentId) {
        SseEmitter emitter = new SseEmitter(emitterTimeoutMs);
        if (instrumentId == null) {
            allClients.add(emitter);
        } else {
            instrumentClients.compute(instrumentId, (id, clients) -> {
                Set<SseEmitter> target = clients != null ? clients : ConcurrentHashMap.newKeySet();
                target.add(emitter);
                return target;
            });
        }

        emitter.onCompletion(() -> disconnect(instrumentId, emitter));
        emitter.onTimeout(() -> disconnect(instrumentId, emitter));
        emitter.onError(e -> disconnect(instrumentId, emitter));

        log.info("Stream client connected: instrument={}, clients={}, streamedInstruments={}",
                instrumentId == null ? "*" : instrumentId, clientCount(), streamedInstrumentCount());
        return emitter;
    }

    @Override
    public void publish(Observation observation) {
        String instrumentId = observation.instrumentId();
        Set<SseEmitter> clients = instrumentClients.get(instrumentId);
        if (clients != null) {
            send(clients, instrumentId, observation);
        }
        send(allClients, null, observation);
    }

    /** Returns the number of open streams across all instruments. */
    public int clientCount() {
        int count = allClients.size();
        for (Set<SseEmitter> clients : instrumentClients.values()) {
            count += clients.size();
        }
        return count;
    }

    /** Returns the number of instruments with at least one dedicated stream. */
    int streamedInstrumentCount() {
        return instrumentClients.size();
    }

    private void disconnect(String instrumentId, SseEmitter emitter) {
        if (instrumentId == null) {
            allClients.remove(emitter);
            return;
        }
        // Drop the instrument's set with its last client
        instrumentClients.computeIfPresent(instrumentId, (id, clients) -> {
            clients.remove(emitter);
            return clients.isEmpty() ? null : clients;
        });
    }

    private void send(Set<SseEmitter> clients, String instrumentId, Observation observation) {
        for (SseEmitter emitter : clients) {
            try {
                emitter.send(SseEmitter.event()
                    .name(EVENT_NAME)
                    .id(observation.instrumentId())
                    .data(observation, MediaType.APPLICATION_JSON));
            } catch (IOException e) {
                log.debug("Dropping stream client for {}: {}", observation.instrumentId(), e.getMessage());
                disconnect(instrumentId, emitter);
                emitter.completeWithError(e);
            } catch (IllegalStateException e) {
                // already completed
                disconnect(instrumentId, emitter);
            }
        }
    }
}

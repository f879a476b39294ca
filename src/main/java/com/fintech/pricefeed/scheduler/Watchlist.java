package com.fintech.pricefeed.scheduler;

import com.fintech.pricefeed.config.PriceFeedProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Instruments polled by the fetch cycle. Ids are trimmed on every operation.
 * Removing an instrument stops polling only; its stored history is kept.
 */
@Component
public class Watchlist {

    private final Set<String> instruments = ConcurrentHashMap.newKeySet();

    @Autowired
    public Watchlist(PriceFeedProperties properties) {
        this(properties.getScheduler().getWatchlist());
    }

    public Watchlist(Collection<String> initial) {
        initial.forEach(this::watch);
    }

    /**
     * @return true if the instrument was not already watched
     * @throws IllegalArgumentException if the id is null or blank
     */
    public boolean watch(String instrumentId) {
        return instruments.add(requireId(instrumentId));
    }

    /**
     * @return true if the instrument was watched
     */
    public boolean unwatch(String instrumentId) {
        String id = normalize(instrumentId);
        return id != null && instruments.remove(id);
    }

    public boolean contains(String instrumentId) {
        String id = normalize(instrumentId);
        return id != null && instruments.contains(id);
    }

    /** Returns a sorted copy; later changes do not affect it. */
    public Set<String> snapshot() {
        return new TreeSet<>(instruments);
    }

    public int size() {
        return instruments.size();
    }

    private static String requireId(String instrumentId) {
        Objects.requireNonNull(instrumentId, "Instrument id cannot be null");
        String id = normalize(instrumentId);
        if (id == null) {
            throw new IllegalArgumentException("Instrument id cannot be blank");
        }
        return id;
    }

    /** Returns the trimmed id, or null if it is null or blank. */
    private static String normalize(String instrumentId) {
        if (instrumentId == null) {
            return null;
        }
        String trimmed = instrumentId.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}

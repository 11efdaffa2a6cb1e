package com.macroallocator.common.universe;

import com.macroallocator.common.model.Ticker;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable view of the loaded candidate universe. A new snapshot is published on every
 * refresh; a request keeps the snapshot it started with.
 */
public record CatalogSnapshot(List<Ticker> tickers, Instant loadedAt) {

    public CatalogSnapshot {
        tickers = List.copyOf(tickers);
    }

    public static CatalogSnapshot empty() {
        return new CatalogSnapshot(List.of(), Instant.EPOCH);
    }

    /**
     * Tickers whose sector matches one of {@code sectors}, ignoring case. When nothing
     * matches (or {@code sectors} is empty) the whole universe is returned.
     */
    public List<Ticker> filter(List<String> sectors) {
        if (sectors == null || sectors.isEmpty()) {
            return tickers;
        }
        Set<String> wanted = sectors.stream()
            .map(s -> s.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
        List<Ticker> matched = tickers.stream()
            .filter(t -> wanted.contains(t.sector().toLowerCase(Locale.ROOT)))
            .toList();
        return matched.isEmpty() ? tickers : matched;
    }

    public int size() {
        return tickers.size();
    }

    public long syntheticCount() {
        return tickers.stream().filter(Ticker::synthetic).count();
    }

    public boolean isEmpty() {
        return tickers.isEmpty();
    }
}

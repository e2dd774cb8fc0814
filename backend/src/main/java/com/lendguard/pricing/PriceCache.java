package com.lendguard.pricing;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Thread-safe price cache owned by {@link PriceOracleClient}. Entries are fresh for {@code ttl}; after that they
 * are kept as degraded fallbacks until {@code retention} elapses and Caffeine evicts them. Caffeine reads time
 * from the injected Clock so expiry follows the same time source as the freshness check.
 */
public class PriceCache {

    private final Cache<String, Entry> cache;
    private final Clock clock;
    private final Duration ttl;

    public PriceCache(Clock clock, Duration ttl, Duration retention, long maximumSize) {
        if (retention.compareTo(ttl) < 0) {
            throw new IllegalArgumentException("retention must not be shorter than ttl");
        }
        this.clock = clock;
        this.ttl = ttl;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(retention)
                .maximumSize(maximumSize)
                .ticker(() -> clock.millis() * 1_000_000L)
                .build();
    }

    public Optional<PriceQuote> fresh(String asset) {
        Entry entry = cache.getIfPresent(asset);
        if (entry == null) {
            return Optional.empty();
        }
        Duration age = Duration.between(entry.storedAt(), clock.instant());
        return age.compareTo(ttl) < 0 ? Optional.of(entry.quote()) : Optional.empty();
    }

    /**
     * Any retained entry regardless of TTL.
     */
    public Optional<PriceQuote> retained(String asset) {
        Entry entry = cache.getIfPresent(asset);
        return entry != null ? Optional.of(entry.quote()) : Optional.empty();
    }

    public void put(String asset, PriceQuote quote) {
        cache.put(asset, new Entry(quote, clock.instant()));
    }

    public void clear() {
        cache.invalidateAll();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private record Entry(PriceQuote quote, Instant storedAt) {
    }
}

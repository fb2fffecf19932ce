package com.contacthub.backend.modules.session.infrastructure;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import com.contacthub.backend.modules.session.application.SessionCache;
import com.contacthub.backend.modules.session.domain.CachedUserProjection;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-process cache for local runs and tests, backed by Caffeine with a TTL per entry.
 * Time is read from the injected {@link Clock}.
 */
public class InMemorySessionCache implements SessionCache {

    private static final Logger log = LoggerFactory.getLogger(InMemorySessionCache.class);
    private static final long MAXIMUM_ENTRIES = 100_000L;

    private final Cache<String, Entry> entries;

    public InMemorySessionCache(Clock clock) {
        this.entries = Caffeine.newBuilder()
                .maximumSize(MAXIMUM_ENTRIES)
                .expireAfter(new EntryExpiry())
                .ticker(() -> epochNanos(clock.instant()))
                .build();
    }

    @Override
    public void connect() {
        log.info("Session cache using in-process store");
    }

    @Override
    public void disconnect() {
        entries.invalidateAll();
    }

    @Override
    public void set(String key, CachedUserProjection projection, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(projection, "projection");
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        entries.put(key, new Entry(projection, ttl));
    }

    @Override
    public Optional<CachedUserProjection> get(String key) {
        return Optional.ofNullable(entries.getIfPresent(key)).map(Entry::projection);
    }

    @Override
    public void evict(String key) {
        entries.invalidate(key);
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    long size() {
        entries.cleanUp();
        return entries.estimatedSize();
    }

    private static long epochNanos(Instant instant) {
        return TimeUnit.SECONDS.toNanos(instant.getEpochSecond()) + instant.getNano();
    }

    private record Entry(CachedUserProjection projection, Duration ttl) {
    }

    // Reads never extend an entry; every write restarts it with its own TTL.
    private static final class EntryExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry value, long currentTime) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry value, long currentTime, long currentDuration) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}

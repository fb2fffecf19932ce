package com.contacthub.backend.modules.session.application;

import java.time.Duration;
import java.util.Optional;

import com.contacthub.backend.modules.session.domain.CachedUserProjection;

/**
 * Advisory key-value cache of {@link CachedUserProjection}s keyed by username.
 * <p>
 * Implementations must absorb their own failures: an unreachable store reads as a miss and
 * writes become no-ops, so callers always keep a repository fallback. {@code set} overwrites
 * unconditionally; concurrent writers race with last-write-wins.
 */
public interface SessionCache {

    void connect();

    void disconnect();

    void set(String key, CachedUserProjection projection, Duration ttl);

    Optional<CachedUserProjection> get(String key);

    void evict(String key);

    /**
     * Whether the last interaction with the backing store succeeded.
     */
    boolean isAvailable();
}

package com.contacthub.backend.modules.session.application;

import java.util.Optional;

import com.contacthub.backend.modules.auth.domain.UserAccount;
import com.contacthub.backend.modules.session.domain.CachedUserProjection;

import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Keeps username-keyed projections in the {@link SessionCache} with the configured TTL.
 */
@Service
public class SessionProjectionService {

    private final SessionCache sessionCache;
    private final SessionCacheProperties properties;

    public SessionProjectionService(SessionCache sessionCache, SessionCacheProperties properties) {
        this.sessionCache = sessionCache;
        this.properties = properties;
    }

    public CachedUserProjection remember(UserAccount user) {
        CachedUserProjection projection = CachedUserProjection.of(user);
        sessionCache.set(user.getUsername(), projection, properties.ttl());
        return projection;
    }

    public Optional<CachedUserProjection> lookup(String username) {
        return sessionCache.get(username);
    }

    /**
     * Evicts now and, inside a transaction, once more after commit so a concurrent reader
     * cannot re-cache the pre-commit row.
     */
    public void forget(String username) {
        sessionCache.evict(username);
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    sessionCache.evict(username);
                }
            });
        }
    }
}

package com.contacthub.backend.modules.session.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;

import com.contacthub.backend.modules.auth.domain.UserAccount;
import com.contacthub.backend.modules.session.domain.CachedUserProjection;
import com.contacthub.backend.modules.session.infrastructure.InMemorySessionCache;
import com.contacthub.backend.support.MutableClock;
import com.contacthub.backend.support.TestUsers;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

class SessionProjectionServiceTest {

    private MutableClock clock;
    private InMemorySessionCache cache;
    private SessionProjectionService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-01-01T00:00:00Z");
        cache = new InMemorySessionCache(clock);
        service = new SessionProjectionService(cache, new SessionCacheProperties("memory", Duration.ofMinutes(10), "user:"));
    }

    @AfterEach
    void clearSynchronization() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    void remembersProjectionWithConfiguredTtl() {
        UserAccount alice = TestUsers.user("alice", "alice@example.com", "hash", true);

        CachedUserProjection remembered = service.remember(alice);

        assertThat(service.lookup("alice")).contains(remembered);
        clock.advance(Duration.ofMinutes(10));
        assertThat(service.lookup("alice")).isEmpty();
    }

    @Test
    void forgetEvictsAgainAfterCommit() {
        UserAccount alice = TestUsers.user("alice", "alice@example.com", "hash", true);
        service.remember(alice);
        TransactionSynchronizationManager.initSynchronization();

        service.forget("alice");
        assertThat(service.lookup("alice")).isEmpty();

        // a concurrent reader re-caches the stale row before the commit lands
        service.remember(alice);
        for (TransactionSynchronization synchronization : TransactionSynchronizationManager.getSynchronizations()) {
            synchronization.afterCommit();
        }

        assertThat(service.lookup("alice")).isEmpty();
    }
}

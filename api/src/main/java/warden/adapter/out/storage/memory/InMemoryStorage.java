package warden.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.jboss.logging.Logger;

import warden.core.model.lockout.LockoutPolicy;

/**
 * The full set of in-memory stores plus the daemon thread that sweeps their
 * expired entries.
 *
 * <p>
 * This backend is intended for development, tests and single-instance
 * deployments. State is lost on restart and not shared across instances.
 */
public class InMemoryStorage {

    private static final Logger LOG = Logger.getLogger(InMemoryStorage.class);

    private final InMemoryCounterStore counterStore;
    private final InMemoryBlockListRepository blockListRepository;
    private final InMemoryTokenRevocationRepository tokenRevocationRepository;
    private final InMemorySessionRepository sessionRepository;
    private final InMemoryLoginAttemptRepository loginAttemptRepository;
    private final InMemoryAlertRepository alertRepository;
    private final InMemoryReviewQueue reviewQueue;
    private final LockoutPolicy lockoutPolicy;
    private final ScheduledExecutorService cleanupExecutor;

    public InMemoryStorage(Clock clock, LockoutPolicy lockoutPolicy, Duration cleanupInterval) {
        this.counterStore = new InMemoryCounterStore(clock);
        this.blockListRepository = new InMemoryBlockListRepository(clock);
        this.tokenRevocationRepository = new InMemoryTokenRevocationRepository(clock);
        this.sessionRepository = new InMemorySessionRepository(clock);
        this.loginAttemptRepository = new InMemoryLoginAttemptRepository(clock);
        this.alertRepository = new InMemoryAlertRepository();
        this.reviewQueue = new InMemoryReviewQueue();
        this.lockoutPolicy = lockoutPolicy;

        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "warden-memory-cleanup");
            t.setDaemon(true);
            return t;
        });
        final var intervalMs = Math.max(1000, cleanupInterval.toMillis());
        cleanupExecutor.scheduleAtFixedRate(this::sweepExpired, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        LOG.infof("Initialized in-memory storage (cleanup every %s)", Duration.ofMillis(intervalMs));
    }

    public InMemoryCounterStore counterStore() {
        return counterStore;
    }

    public InMemoryBlockListRepository blockListRepository() {
        return blockListRepository;
    }

    public InMemoryTokenRevocationRepository tokenRevocationRepository() {
        return tokenRevocationRepository;
    }

    public InMemorySessionRepository sessionRepository() {
        return sessionRepository;
    }

    public InMemoryLoginAttemptRepository loginAttemptRepository() {
        return loginAttemptRepository;
    }

    public InMemoryAlertRepository alertRepository() {
        return alertRepository;
    }

    public InMemoryReviewQueue reviewQueue() {
        return reviewQueue;
    }

    /**
     * Run one cleanup pass over every store.
     */
    public void sweepExpired() {
        try {
            counterStore.sweepExpired();
            blockListRepository.sweepExpired();
            tokenRevocationRepository.sweepExpired();
            sessionRepository.sweepExpired();
            loginAttemptRepository.sweepExpired(lockoutPolicy);
        } catch (RuntimeException e) {
            // A failed pass must not cancel the scheduled task
            LOG.warnf(e, "In-memory cleanup pass failed");
        }
    }

    public void shutdown() {
        cleanupExecutor.shutdownNow();
    }
}

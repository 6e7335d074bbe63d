package warden.core.service.threat;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.ResiliencyConfig;
import warden.core.model.threat.BlockEntry;
import warden.core.model.threat.BlockSubject;
import warden.core.port.out.BlockListRepository;
import warden.core.port.out.Metrics;
import warden.core.port.out.SecurityNotifications;
import warden.core.service.common.StoreCallGuard;
import warden.spi.AuditEntry;
import warden.spi.AuditOutcome;

/**
 * Creates, lifts and looks up blocks on source addresses and principals.
 */
@ApplicationScoped
public class BlockListService {

    private static final Logger LOG = Logger.getLogger(BlockListService.class);

    private final BlockListRepository repository;
    private final SecurityNotifications notifications;
    private final StoreCallGuard storeGuard;
    private final Metrics metrics;
    private final Clock clock;

    @Inject
    public BlockListService(
            BlockListRepository repository,
            SecurityNotifications notifications,
            ResiliencyConfig resiliency,
            Metrics metrics,
            Clock clock) {
        this.repository = repository;
        this.notifications = notifications;
        this.storeGuard = new StoreCallGuard(resiliency.store().operationTimeout(), metrics, "block-list");
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Block a subject for {@code duration}, replacing any existing block.
     */
    public Uni<BlockEntry> block(BlockSubject subject, String reason, Duration duration) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("block duration must be positive");
        }
        final var now = clock.instant();
        final var entry = new BlockEntry(subject, reason, now, now.plus(duration));
        return storeGuard
                .withTimeout(repository.put(entry), "block")
                .invoke(() -> {
                    LOG.infof("Blocked %s until %s: %s", subject.key(), entry.expiresAt(), reason);
                    metrics.recordBlock(reason);
                    notifications.audit(new AuditEntry(
                            null,
                            "source_blocked",
                            "block_entry",
                            subject.key(),
                            Map.of("reason", reason, "expires_at", entry.expiresAt().toString()),
                            now,
                            AuditOutcome.SUCCESS));
                })
                .replaceWith(entry);
    }

    /**
     * @return true if a block was lifted
     */
    public Uni<Boolean> unblock(BlockSubject subject) {
        return storeGuard.withTimeout(repository.remove(subject), "unblock").invoke(removed -> {
            if (removed) {
                LOG.infof("Lifted block on %s", subject.key());
            }
        });
    }

    /**
     * Active block for a subject. Store failures propagate so callers can apply
     * their own failure policy.
     */
    public Uni<Optional<BlockEntry>> find(BlockSubject subject) {
        final var now = clock.instant();
        return storeGuard
                .withTimeout(repository.find(subject), "find")
                .map(found -> found.filter(entry -> entry.isActiveAt(now)));
    }

    public Uni<List<BlockEntry>> activeBlocks() {
        final var now = clock.instant();
        return storeGuard.withTimeout(
                repository.streamActive()
                        .filter(entry -> entry.isActiveAt(now))
                        .collect()
                        .asList(),
                "activeBlocks");
    }
}

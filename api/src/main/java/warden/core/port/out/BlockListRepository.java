package warden.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import warden.core.model.threat.BlockEntry;
import warden.core.model.threat.BlockSubject;

/**
 * Port for self-expiring block entries.
 */
public interface BlockListRepository {

    /**
     * Store a block, replacing any existing block for the same subject.
     */
    Uni<Void> put(BlockEntry entry);

    /**
     * Find the active block for a subject.
     *
     * @return the block, or empty when none is active
     */
    Uni<Optional<BlockEntry>> find(BlockSubject subject);

    /**
     * Remove a block.
     *
     * @return true if a block was removed
     */
    Uni<Boolean> remove(BlockSubject subject);

    /**
     * Stream all active blocks.
     */
    Multi<BlockEntry> streamActive();
}

package cadence.store;

import cadence.player.QueueEntry;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import java.util.List;

/**
 * Durable copy of each tenant's pending queue. Only used to restore queues after a restart;
 * players never read from it while running.
 */
public interface PlaylistStore {
    /**
     * @param tenantId Tenant id.
     *
     * @return The last saved queue, or an empty list.
     */
    @Nonnull
    @CheckReturnValue
    List<QueueEntry> load(@Nonnull String tenantId);
    
    /**
     * Replaces the saved queue of a tenant. An empty list clears it.
     *
     * @param tenantId Tenant id.
     * @param entries  Pending queue, in order.
     */
    void save(@Nonnull String tenantId, @Nonnull List<QueueEntry> entries);
}

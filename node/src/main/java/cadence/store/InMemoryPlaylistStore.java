package cadence.store;

import cadence.player.QueueEntry;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps snapshots for the lifetime of the process. Restores survive a tenant leaving and
 * joining again, but not a restart.
 */
public class InMemoryPlaylistStore implements PlaylistStore {
    private final Map<String, List<QueueEntry>> snapshots = new ConcurrentHashMap<>();
    
    @Nonnull
    @Override
    public List<QueueEntry> load(@Nonnull String tenantId) {
        return snapshots.getOrDefault(tenantId, List.of());
    }
    
    @Override
    public void save(@Nonnull String tenantId, @Nonnull List<QueueEntry> entries) {
        if(entries.isEmpty()) {
            snapshots.remove(tenantId);
        } else {
            snapshots.put(tenantId, List.copyOf(entries));
        }
    }
}

package cadence.player;

import cadence.Cadence;
import cadence.error.VoiceConnectException;
import cadence.event.TenantLifecycleListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Owns the players of every tenant. The map has its own lock, which is never held while
 * calling into a player except to check whether it was closed.
 */
public class PlayerRegistry implements TenantLifecycleListener {
    private static final Logger log = LoggerFactory.getLogger(PlayerRegistry.class);
    
    @GuardedBy("players")
    private final Map<String, Player> players = new HashMap<>();
    private final Cadence cadence;
    
    public PlayerRegistry(@Nonnull Cadence cadence) {
        this.cadence = cadence;
    }
    
    /**
     * Gets or creates the player of a tenant. A closed player is replaced.
     *
     * @param tenantId Tenant id.
     *
     * @return The live player of the tenant.
     */
    @Nonnull
    public Player player(@Nonnull String tenantId) {
        Player created;
        Player replaced;
        synchronized(players) {
            replaced = players.get(tenantId);
            if(replaced != null && replaced.state() != PlayerState.CLOSED) {
                return replaced;
            }
            created = new Player(cadence, tenantId);
            players.put(tenantId, created);
        }
        if(replaced != null) {
            cadence.dispatcher().onPlayerDestroyed(tenantId, replaced);
        }
        log.debug("Created player for {}", tenantId);
        cadence.dispatcher().onPlayerCreated(tenantId, created);
        return created;
    }
    
    @Nullable
    @CheckReturnValue
    public Player existingPlayer(@Nonnull String tenantId) {
        synchronized(players) {
            return players.get(tenantId);
        }
    }
    
    /**
     * Snapshot of the registered players, including closed ones not yet replaced.
     *
     * @return The registered players.
     */
    @Nonnull
    @CheckReturnValue
    public List<Player> players() {
        synchronized(players) {
            return List.copyOf(players.values());
        }
    }
    
    @Override
    public void onTenantJoin(@Nonnull String tenantId) {
        var player = player(tenantId);
        var store = cadence.playlistStore();
        List<QueueEntry> snapshot;
        try {
            snapshot = store.load(tenantId);
        } catch(RuntimeException e) {
            log.error("Unable to load saved queue of {}", tenantId, e);
            return;
        }
        if(snapshot.isEmpty()) {
            return;
        }
        try {
            if(!player.restore(snapshot)) {
                log.debug("Not restoring queue of {}, player already in use", tenantId);
            }
        } catch(VoiceConnectException e) {
            log.warn("Unable to rejoin voice channel of {}, discarding {} saved songs", tenantId, snapshot.size(), e);
            store.save(tenantId, List.of());
        }
    }
    
    @Override
    public void onTenantLeave(@Nonnull String tenantId) {
        var player = existingPlayer(tenantId);
        if(player == null) {
            return;
        }
        player.stop();
        boolean removed;
        synchronized(players) {
            removed = players.remove(tenantId, player);
        }
        if(removed) {
            log.info("Removed player of {}", tenantId);
            cadence.dispatcher().onPlayerDestroyed(tenantId, player);
        }
    }
    
    /**
     * Stops and removes every player.
     */
    public void close() {
        List<Player> all;
        synchronized(players) {
            all = new ArrayList<>(players.values());
            players.clear();
        }
        for(var player : all) {
            try {
                player.stop();
            } catch(RuntimeException e) {
                log.error("Error stopping player of {}", player.tenantId(), e);
            }
            cadence.dispatcher().onPlayerDestroyed(player.tenantId(), player);
        }
    }
}

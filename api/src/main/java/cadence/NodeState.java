package cadence;

import cadence.event.EventDispatcher;
import cadence.player.CadencePlayer;
import cadence.source.SongLookupService;
import com.typesafe.config.Config;
import io.vertx.core.Vertx;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.stream.Stream;

/**
 * Provides access to cadence objects for the platform binding.
 */
public interface NodeState {
    /**
     * Config instance used by the node.
     *
     * @return The node configuration.
     */
    @Nonnull
    @CheckReturnValue
    Config config();
    
    /**
     * Vertx instance used by the node for timers.
     *
     * @return The vertx instance.
     */
    @Nonnull
    @CheckReturnValue
    Vertx vertx();
    
    /**
     * The event dispatcher used by the node. You can use this to dynamically register/unregister listeners.
     *
     * @return The event dispatcher.
     */
    @Nonnull
    @CheckReturnValue
    EventDispatcher dispatcher();
    
    /**
     * Lookup service commands should use to turn user input into songs.
     *
     * @return The song lookup service.
     */
    @Nonnull
    @CheckReturnValue
    SongLookupService songLookup();
    
    /**
     * Gets or creates the player of a tenant. A stopped player is replaced by a new one.
     *
     * @param tenantId Tenant id.
     *
     * @return The current player, if it exists, or a new player.
     */
    @Nonnull
    @CheckReturnValue
    CadencePlayer getPlayer(@Nonnull String tenantId);
    
    /**
     * Returns the existing player of a tenant, or null if it doesn't exist.
     *
     * @param tenantId Tenant id.
     *
     * @return The current player.
     */
    @Nullable
    @CheckReturnValue
    CadencePlayer getExistingPlayer(@Nonnull String tenantId);
    
    /**
     * Stream containing all existing players.
     *
     * @return All existing players.
     */
    @Nonnull
    @CheckReturnValue
    Stream<? extends CadencePlayer> allPlayers();
}

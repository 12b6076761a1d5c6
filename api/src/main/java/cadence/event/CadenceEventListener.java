package cadence.event;

import cadence.NodeState;
import cadence.player.CadencePlayer;
import cadence.player.QueueEntry;

import javax.annotation.Nonnull;

/**
 * Receives player lifecycle and playback events. The messaging collaborator implements this
 * to tell users what's playing or what failed.
 *
 * <br>Methods are called from the thread that caused the event, which may hold the player's
 * lock, so implementations must not block or call back into the player synchronously.
 */
public interface CadenceEventListener {
    default void onPlayerCreated(@Nonnull NodeState state, @Nonnull String tenantId,
                                 @Nonnull CadencePlayer player) {}
    
    default void onPlayerDestroyed(@Nonnull NodeState state, @Nonnull String tenantId,
                                   @Nonnull CadencePlayer player) {}
    
    default void onSongStarted(@Nonnull NodeState state, @Nonnull CadencePlayer player,
                               @Nonnull QueueEntry entry) {}
    
    /**
     * Called when a song stops playing without failing.
     *
     * @param state   Node state.
     * @param player  Player that played the song.
     * @param entry   Song that stopped.
     * @param skipped Whether it was skipped or stopped rather than played until the end.
     */
    default void onSongFinished(@Nonnull NodeState state, @Nonnull CadencePlayer player,
                                @Nonnull QueueEntry entry, boolean skipped) {}
    
    /**
     * Called when a song couldn't be fetched or streamed. The player moves on to the next song.
     *
     * @param state  Node state.
     * @param player Player that tried to play the song.
     * @param entry  Song that failed.
     * @param cause  Failure cause.
     */
    default void onSongFailed(@Nonnull NodeState state, @Nonnull CadencePlayer player,
                              @Nonnull QueueEntry entry, @Nonnull Throwable cause) {}
}

package cadence.player;

import cadence.NodeState;
import cadence.error.InvalidPositionException;
import cadence.error.PlayerClosedException;
import cadence.error.VoiceConnectException;
import cadence.source.Song;
import io.vertx.core.json.JsonObject;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * Queue and playback state of a single tenant. All methods are thread safe and return
 * without waiting for audio to be fetched or streamed.
 */
public interface CadencePlayer {
    /**
     * Returns the node that owns this player.
     *
     * @return The node that owns this player.
     */
    @Nonnull
    @CheckReturnValue
    NodeState node();
    
    /**
     * Returns the tenant id of this player.
     *
     * @return The tenant id for this player.
     */
    @Nonnull
    @CheckReturnValue
    String tenantId();
    
    @Nonnull
    @CheckReturnValue
    PlayerState state();
    
    /**
     * Voice channel of the open session, if any.
     *
     * @return The connected voice channel, or null if no session is open.
     */
    @Nullable
    @CheckReturnValue
    String voiceChannelId();
    
    /**
     * Appends a song to the queue, joining the voice channel first if needed. If nothing is
     * playing, playback starts in the background.
     *
     * @param textChannelId  Channel notifications about this song are sent to.
     * @param voiceChannelId Channel the song is played in.
     * @param song           Song to play.
     *
     * @throws VoiceConnectException If the voice channel can't be joined. Nothing is queued.
     * @throws PlayerClosedException If this player was stopped.
     */
    void addSong(@Nonnull String textChannelId, @Nonnull String voiceChannelId, @Nonnull Song song);
    
    /**
     * Cancels the current song and moves on to the next one. Does nothing if idle.
     */
    void skipSong();
    
    /**
     * Cancels the current song, clears the queue, leaves the voice channel and closes this
     * player. Calling this more than once has no effect.
     */
    void stop();
    
    /**
     * Removes a pending song. The song currently playing is not part of the pending queue.
     *
     * @param position 1-based position in {@link #playlist()}.
     *
     * @return The removed song.
     *
     * @throws InvalidPositionException If there is no pending song at that position.
     * @throws PlayerClosedException    If this player was stopped.
     */
    @Nonnull
    Song removeSong(int position);
    
    /**
     * Snapshot of the pending songs, in playback order. Doesn't include the current song.
     *
     * @return The pending songs.
     */
    @Nonnull
    @CheckReturnValue
    List<Song> playlist();
    
    /**
     * The song currently loading or streaming.
     *
     * @return The current song, or null if idle.
     */
    @Nullable
    @CheckReturnValue
    Song nowPlaying();
    
    /**
     * Returns the frame loss counter of this player, which tracks how
     * many frames were sent or lost over the past minute.
     *
     * @return The frame loss counter of this player.
     */
    @Nonnull
    @CheckReturnValue
    FrameLossCounter frameLossCounter();
    
    /**
     * Encodes the state of this player for sending to clients.
     *
     * @return A json object containing the state of this player.
     */
    @Nonnull
    @CheckReturnValue
    JsonObject encodeState();
}

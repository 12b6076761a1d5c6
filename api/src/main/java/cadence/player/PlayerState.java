package cadence.player;

/**
 * Playback state of a player.
 *
 * <pre>
 * IDLE -&gt; LOADING -&gt; PLAYING -&gt; IDLE
 *            |                    ^
 *            +--------------------+
 * any  -&gt; CLOSED
 * </pre>
 */
public enum PlayerState {
    /**
     * Nothing is loading or streaming. The queue is empty, or about to be polled.
     */
    IDLE(false),
    /**
     * The head of the queue was taken and its audio is being resolved.
     */
    LOADING(true),
    /**
     * Frames are being written to the voice session.
     */
    PLAYING(true),
    /**
     * Stopped. Terminal, no further commands are accepted.
     */
    CLOSED(false);
    
    private final boolean hasSong;
    
    PlayerState(boolean hasSong) {
        this.hasSong = hasSong;
    }
    
    /**
     * Whether a song is taken off the queue in this state.
     *
     * @return {@code true} for {@link #LOADING} and {@link #PLAYING}.
     */
    public boolean hasSong() {
        return hasSong;
    }
}

package cadence.player;

import cadence.source.Song;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A queued song, with the channels it was requested from and should be played in.
 */
public final class QueueEntry {
    private final Song song;
    private final String textChannelId;
    private final String voiceChannelId;
    
    public QueueEntry(@Nonnull Song song, @Nonnull String textChannelId, @Nonnull String voiceChannelId) {
        this.song = Objects.requireNonNull(song, "song");
        this.textChannelId = Objects.requireNonNull(textChannelId, "textChannelId");
        this.voiceChannelId = Objects.requireNonNull(voiceChannelId, "voiceChannelId");
    }
    
    @Nonnull
    @CheckReturnValue
    public Song song() {
        return song;
    }
    
    /**
     * Channel where notifications about this song should be sent.
     *
     * @return The text channel id.
     */
    @Nonnull
    @CheckReturnValue
    public String textChannelId() {
        return textChannelId;
    }
    
    @Nonnull
    @CheckReturnValue
    public String voiceChannelId() {
        return voiceChannelId;
    }
    
    @Override
    public boolean equals(Object o) {
        if(this == o) return true;
        if(!(o instanceof QueueEntry)) return false;
        var that = (QueueEntry) o;
        return song.equals(that.song) && textChannelId.equals(that.textChannelId) &&
                voiceChannelId.equals(that.voiceChannelId);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(song, textChannelId, voiceChannelId);
    }
    
    @Override
    public String toString() {
        return "QueueEntry(" + song + " -> " + voiceChannelId + ")";
    }
}

package cadence.source.lavaplayer;

import cadence.source.Song;
import com.sedmelluq.discord.lavaplayer.player.AudioPlayerManager;
import com.sedmelluq.discord.lavaplayer.tools.io.MessageInput;
import com.sedmelluq.discord.lavaplayer.tools.io.MessageOutput;
import com.sedmelluq.discord.lavaplayer.track.AudioTrack;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.Base64;

/**
 * Conversions between lavaplayer tracks and cadence types.
 */
class TrackCodec {
    private TrackCodec() {}
    
    /**
     * Decodes an audio track from it's base64 representation.
     *
     * @param playerManager Player manager used for decoding (must have the source manager enabled).
     * @param base64        Base64 encoded track.
     *
     * @return The decoded track, or null if no source manager recognizes it.
     */
    @Nullable
    @CheckReturnValue
    static AudioTrack decode(@Nonnull AudioPlayerManager playerManager, @Nonnull String base64) {
        try {
            var v = playerManager.decodeTrack(new MessageInput(new ByteArrayInputStream(
                    Base64.getDecoder().decode(base64)
            )));
            return v == null ? null : v.decodedTrack;
        } catch(IOException e) {
            throw new AssertionError(e);
        }
    }
    
    /**
     * Encodes the provided track to base64.
     *
     * @param playerManager Player manager used for encoding (must have the source manager enabled).
     * @param track         Track to encode.
     *
     * @return Base64 encoded track.
     */
    @Nonnull
    @CheckReturnValue
    static String encode(@Nonnull AudioPlayerManager playerManager, @Nonnull AudioTrack track) {
        var baos = new ByteArrayOutputStream();
        try {
            playerManager.encodeTrack(new MessageOutput(baos), track);
        } catch(IOException e) {
            throw new AssertionError(e);
        }
        return Base64.getEncoder().encodeToString(baos.toByteArray());
    }
    
    /**
     * Identifier unique across sources, used as the audio cache key.
     *
     * @param track Track to identify.
     *
     * @return {@code source:identifier}.
     */
    @Nonnull
    @CheckReturnValue
    static String mediaIdentifier(@Nonnull AudioTrack track) {
        var source = track.getSourceManager() == null ? "unknown" : track.getSourceManager().getSourceName();
        return source + ":" + track.getIdentifier();
    }
    
    @Nonnull
    @CheckReturnValue
    static Song toSong(@Nonnull AudioTrack track) {
        var info = track.getInfo();
        var url = info.uri == null ? info.identifier : info.uri;
        var duration = info.isStream ? Duration.ZERO : Duration.ofMillis(info.length);
        String thumbnail = null;
        if(track.getSourceManager() != null && "youtube".equals(track.getSourceManager().getSourceName())) {
            thumbnail = "https://i.ytimg.com/vi/" + info.identifier + "/hqdefault.jpg";
        }
        return new Song(url, info.title == null ? "" : info.title, duration, thumbnail, null);
    }
}

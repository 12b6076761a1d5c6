package cadence.source.lavaplayer;

import cadence.error.TranscodeException;
import cadence.source.FrameSource;
import com.sedmelluq.discord.lavaplayer.player.AudioPlayer;
import com.sedmelluq.discord.lavaplayer.player.event.AudioEventAdapter;
import com.sedmelluq.discord.lavaplayer.tools.FriendlyException;
import com.sedmelluq.discord.lavaplayer.track.AudioTrack;
import com.sedmelluq.discord.lavaplayer.track.AudioTrackEndReason;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pulls opus frames out of a private {@link AudioPlayer} playing a single track.
 */
class LavaplayerFrameSource extends AudioEventAdapter implements FrameSource {
    //how often a blocked read checks whether the source was closed
    private static final long POLL_MILLIS = 500;
    
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AudioPlayer player;
    private final String identifier;
    private final Duration frameDuration;
    private final long frameTimeoutNanos;
    private volatile FriendlyException failure;
    
    /**
     * @param frameTimeout Maximum wait for a single frame, zero to wait forever.
     */
    LavaplayerFrameSource(@Nonnull AudioPlayer player, @Nonnull String identifier,
                          @Nonnull Duration frameDuration, @Nonnull Duration frameTimeout) {
        this.player = player;
        this.identifier = identifier;
        this.frameDuration = frameDuration;
        this.frameTimeoutNanos = frameTimeout.toNanos();
        player.addListener(this);
    }
    
    @Nonnull
    @Override
    public Duration frameDuration() {
        return frameDuration;
    }
    
    @Override
    public byte[] nextFrame() {
        var start = System.nanoTime();
        while(!closed.get()) {
            try {
                var frame = player.provide(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if(frame != null) {
                    return frame.getData();
                }
                break;
            } catch(TimeoutException e) {
                if(frameTimeoutNanos > 0 && System.nanoTime() - start >= frameTimeoutNanos) {
                    throw new TranscodeException("Timed out waiting for audio of " + identifier, e);
                }
            } catch(InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TranscodeException("Interrupted while fetching " + identifier, e);
            }
        }
        var error = failure;
        if(error != null && !closed.get()) {
            throw new TranscodeException("Transcoding " + identifier + " failed: " + error.getMessage(), error);
        }
        return null;
    }
    
    boolean start(@Nonnull AudioTrack track) {
        return player.startTrack(track, false);
    }
    
    @Override
    public void close() {
        if(closed.compareAndSet(false, true)) {
            player.destroy();
        }
    }
    
    @Override
    public void onTrackException(AudioPlayer player, AudioTrack track, FriendlyException exception) {
        failure = exception;
    }
    
    @Override
    public void onTrackEnd(AudioPlayer player, AudioTrack track, AudioTrackEndReason endReason) {
        if(endReason == AudioTrackEndReason.LOAD_FAILED && failure == null) {
            failure = new FriendlyException("Track failed to load", FriendlyException.Severity.SUSPICIOUS, null);
        }
    }
}

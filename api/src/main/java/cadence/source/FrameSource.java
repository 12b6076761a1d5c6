package cadence.source;

import cadence.error.TranscodeException;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;

/**
 * Lazily decoded media, returned by {@link AudioFetcher#fetch(MediaReference)}. Frames are
 * pulled one at a time as the decoder produces them, usually faster than real time.
 * <br>
 * {@link #nextFrame()} is only called by one thread, {@link #close()} may be called from any
 * thread to abort decoding.
 */
public interface FrameSource extends AutoCloseable {
    /**
     * @return Playback time of every frame.
     */
    @Nonnull
    @CheckReturnValue
    Duration frameDuration();
    
    /**
     * Blocks until the next frame is decoded.
     *
     * @return The next frame, or null once the media ended or this source was closed.
     *
     * @throws TranscodeException If decoding fails or no frame arrives in time.
     */
    @Nullable
    byte[] nextFrame();
    
    /**
     * Stops decoding and releases the decoder. A blocked {@link #nextFrame()} returns null
     * shortly after. Calling this more than once has no effect.
     */
    @Override
    void close();
}

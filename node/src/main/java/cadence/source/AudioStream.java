package cadence.source;

import cadence.error.SourceException;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;

/**
 * One listener's position in the frames of a song. Frames may still be decoding, so
 * {@link #poll()} never blocks; it returns null when the next frame isn't ready yet.
 */
public interface AudioStream extends AutoCloseable {
    @Nonnull
    @CheckReturnValue
    Duration frameDuration();
    
    /**
     * Returns the next frame if it's available.
     *
     * @return The next frame, or null if it isn't decoded yet or the stream ended.
     *
     * @throws SourceException If decoding failed. Thrown once every frame decoded before the
     * failure was returned.
     */
    @Nullable
    byte[] poll();
    
    /**
     * @return Whether every frame was returned and no more will be decoded.
     */
    @CheckReturnValue
    boolean isEnded();
    
    /**
     * Releases this stream. The fetch behind it is abandoned once every stream reading
     * it is closed.
     */
    @Override
    void close();
}

package cadence.source;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Every frame of a fully decoded {@link FrameSource}, each holding {@link #frameDuration()} of audio.
 *
 * <br>Instances are shared between every player streaming the same media (they live in
 * the audio cache), so the frame arrays must never be modified.
 */
public final class EncodedAudio {
    private final List<byte[]> frames;
    private final Duration frameDuration;
    private final long sizeBytes;
    
    public EncodedAudio(@Nonnull List<byte[]> frames, @Nonnull Duration frameDuration) {
        Objects.requireNonNull(frames, "frames");
        Objects.requireNonNull(frameDuration, "frameDuration");
        if(frameDuration.isZero() || frameDuration.isNegative()) {
            throw new IllegalArgumentException("Frame duration must be positive");
        }
        this.frames = Collections.unmodifiableList(List.copyOf(frames));
        this.frameDuration = frameDuration;
        var size = 0L;
        for(var f : this.frames) {
            size += f.length;
        }
        this.sizeBytes = size;
    }
    
    @Nonnull
    @CheckReturnValue
    public List<byte[]> frames() {
        return frames;
    }
    
    @Nonnegative
    @CheckReturnValue
    public int frameCount() {
        return frames.size();
    }
    
    @Nonnull
    @CheckReturnValue
    public byte[] frame(@Nonnegative int index) {
        return frames.get(index);
    }
    
    @Nonnull
    @CheckReturnValue
    public Duration frameDuration() {
        return frameDuration;
    }
    
    /**
     * Total playback time of this audio.
     *
     * @return Frame duration times frame count.
     */
    @Nonnull
    @CheckReturnValue
    public Duration duration() {
        return frameDuration.multipliedBy(frames.size());
    }
    
    /**
     * Sum of the sizes of all frames, used as this audio's weight in the audio cache.
     *
     * @return The size of this audio, in bytes.
     */
    @Nonnegative
    @CheckReturnValue
    public long sizeBytes() {
        return sizeBytes;
    }
    
    @Override
    public String toString() {
        return "EncodedAudio(frames=" + frames.size() + ", bytes=" + sizeBytes + ")";
    }
}

package cadence.source;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.concurrent.GuardedBy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Frames of one song, appended by the fetch that decodes it and read concurrently by every
 * player streaming it. Each reader keeps its own position.
 */
public class FrameRecording {
    private final Duration frameDuration;
    @GuardedBy("this")
    private final List<byte[]> frames;
    @GuardedBy("this")
    private boolean complete;
    @GuardedBy("this")
    private RuntimeException failure;
    
    FrameRecording(@Nonnull Duration frameDuration) {
        this.frameDuration = frameDuration;
        this.frames = new ArrayList<>();
    }
    
    private FrameRecording(@Nonnull EncodedAudio audio) {
        this.frameDuration = audio.frameDuration();
        this.frames = audio.frames();
        this.complete = true;
    }
    
    /**
     * Wraps cached audio.
     *
     * @param audio Fully decoded audio.
     *
     * @return A complete recording of the audio.
     */
    @Nonnull
    @CheckReturnValue
    public static FrameRecording of(@Nonnull EncodedAudio audio) {
        return new FrameRecording(audio);
    }
    
    @Nonnull
    @CheckReturnValue
    public Duration frameDuration() {
        return frameDuration;
    }
    
    @CheckReturnValue
    public synchronized int frameCount() {
        return frames.size();
    }
    
    @CheckReturnValue
    public synchronized boolean isComplete() {
        return complete;
    }
    
    synchronized void append(@Nonnull byte[] frame) {
        if(complete || failure != null) {
            throw new IllegalStateException("Recording already ended");
        }
        frames.add(frame);
    }
    
    /**
     * Marks the recording as complete.
     *
     * @return Every recorded frame, to be cached.
     */
    @Nonnull
    synchronized EncodedAudio finish() {
        complete = true;
        return new EncodedAudio(frames, frameDuration);
    }
    
    /**
     * Ends the recording with an error, thrown to readers once they read every frame
     * recorded before it.
     */
    synchronized void fail(@Nonnull RuntimeException error) {
        if(complete || failure != null) return;
        failure = error;
    }
    
    /**
     * Opens a reader starting at the first frame.
     *
     * @param onClose Called once, when the reader is closed.
     *
     * @return A new reader.
     */
    @Nonnull
    @CheckReturnValue
    public AudioStream reader(@Nonnull Runnable onClose) {
        return new Reader(onClose);
    }
    
    private class Reader implements AudioStream {
        private final AtomicBoolean closed = new AtomicBoolean();
        private final Runnable onClose;
        @GuardedBy("FrameRecording.this")
        private int position;
        
        Reader(Runnable onClose) {
            this.onClose = onClose;
        }
        
        @Nonnull
        @Override
        public Duration frameDuration() {
            return frameDuration;
        }
        
        @Override
        public byte[] poll() {
            synchronized(FrameRecording.this) {
                if(position < frames.size()) {
                    return frames.get(position++);
                }
                if(failure != null) {
                    throw failure;
                }
                return null;
            }
        }
        
        @Override
        public boolean isEnded() {
            synchronized(FrameRecording.this) {
                return complete && position >= frames.size();
            }
        }
        
        @Override
        public void close() {
            if(closed.compareAndSet(false, true)) {
                onClose.run();
            }
        }
    }
}

package cadence.send;

import cadence.error.TransportException;
import cadence.player.FrameLossTracker;
import cadence.source.AudioStream;
import cadence.util.CancellationToken;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.concurrent.GuardedBy;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Writes encoded frames into a voice session at a fixed cadence. Vertx timers only keep the
 * time; every frame is written on the send executor, so a session blocking in
 * {@link VoiceSession#sendFrame(byte[])} delays its own tenant and no other.
 * <br>
 * A stream writes one frame at a time and schedules the next one only once the previous
 * write returned, so frames of a tenant never overtake each other.
 * <br>
 * The schedule advances by exactly one interval per frame, so timer jitter doesn't accumulate.
 * If sending falls more than three intervals behind, the clock is reset to the current time
 * instead of bursting the backlog.
 */
public class FrameStreamer {
    private static final Logger log = LoggerFactory.getLogger(FrameStreamer.class);
    private static final int MAX_FRAMES_BEHIND = 3;
    
    private final Vertx vertx;
    private final Executor sendExecutor;
    private final long frameMillis;
    
    public FrameStreamer(@Nonnull Vertx vertx, @Nonnull Executor sendExecutor, @Nonnull Duration frameDuration) {
        if(frameDuration.toMillis() <= 0) {
            throw new IllegalArgumentException("Frame duration must be at least 1ms, got " + frameDuration);
        }
        this.vertx = vertx;
        this.sendExecutor = sendExecutor;
        this.frameMillis = frameDuration.toMillis();
    }
    
    @CheckReturnValue
    public long frameMillis() {
        return frameMillis;
    }
    
    /**
     * Starts streaming. Returns immediately. The stream is closed once streaming ends, whatever
     * the reason.
     *
     * @param stream  Frames to send. A frame that isn't decoded yet when it's due counts as lost.
     * @param session Session to write into.
     * @param token   Token that stops the stream when cancelled. Once {@code cancel()} returns,
     *                no further frame is written.
     * @param tracker Tracker updated with sent and late frames.
     *
     * @return A future completed with {@link StreamResult#FINISHED} after the last frame,
     * {@link StreamResult#CANCELLED} when the token is cancelled, or exceptionally with the
     * {@link TransportException} thrown by the session or the error that ended the stream.
     */
    @Nonnull
    public CompletableFuture<StreamResult> stream(@Nonnull AudioStream stream, @Nonnull VoiceSession session,
                                                  @Nonnull CancellationToken token,
                                                  @Nonnull FrameLossTracker tracker) {
        var transmission = new Transmission(stream, session, token, tracker);
        transmission.start();
        return transmission.future;
    }
    
    private class Transmission implements Runnable {
        private final CompletableFuture<StreamResult> future = new CompletableFuture<>();
        private final AudioStream stream;
        private final VoiceSession session;
        private final CancellationToken token;
        private final FrameLossTracker tracker;
        @GuardedBy("this")
        private int sent;
        private long nextFrameAt;
        
        Transmission(AudioStream stream, VoiceSession session, CancellationToken token, FrameLossTracker tracker) {
            this.stream = stream;
            this.session = session;
            this.token = token;
            this.tracker = tracker;
        }
        
        void start() {
            tracker.start();
            future.whenComplete((__, ___) -> stream.close());
            token.onCancel(() -> {
                //waits for a write in progress, so no frame goes out after cancel() returns
                synchronized(this) {
                    log.debug("Stream to {} cancelled after {} frames", session.tenantId(), sent);
                }
                end(StreamResult.CANCELLED);
            });
            nextFrameAt = System.currentTimeMillis();
            submit();
        }
        
        private void submit() {
            try {
                sendExecutor.execute(this);
            } catch(RejectedExecutionException e) {
                log.debug("Send pool rejected stream to {}", session.tenantId(), e);
                end(StreamResult.CANCELLED);
            }
        }
        
        @Override
        public void run() {
            Throwable error = null;
            boolean ended = false;
            //futures are completed outside the lock, their dependents may take the player's lock
            synchronized(this) {
                if(token.isCancelled() || future.isDone()) return;
                byte[] frame = null;
                try {
                    frame = stream.poll();
                } catch(RuntimeException e) {
                    error = e;
                }
                if(frame != null) {
                    try {
                        session.sendFrame(frame);
                        sent++;
                        tracker.onSuccess();
                    } catch(TransportException e) {
                        error = e;
                    } catch(RuntimeException e) {
                        error = new TransportException("Error sending frame to " + session.tenantId(), e);
                    }
                    if(error != null) {
                        tracker.onFail();
                    }
                } else if(error == null && !stream.isEnded()) {
                    //decoding is behind playback
                    tracker.onFail();
                }
                ended = error == null && stream.isEnded();
            }
            if(error != null) {
                if(future.completeExceptionally(error)) {
                    tracker.end();
                }
                return;
            }
            if(ended) {
                log.debug("Finished streaming {} frames to {}", sent(), session.tenantId());
                end(StreamResult.FINISHED);
                return;
            }
            scheduleNextFrame();
        }
        
        private synchronized int sent() {
            return sent;
        }
        
        private void scheduleNextFrame() {
            var now = System.currentTimeMillis();
            if(now < nextFrameAt + frameMillis * MAX_FRAMES_BEHIND) {
                nextFrameAt += frameMillis;
            } else {
                log.debug("Stream to {} fell {}ms behind, resetting clock", session.tenantId(), now - nextFrameAt);
                tracker.onFail();
                nextFrameAt = now;
            }
            var sleepTime = nextFrameAt - now;
            if(sleepTime > 0) {
                vertx.setTimer(sleepTime, __ -> submit());
            } else {
                submit();
            }
        }
        
        private void end(StreamResult result) {
            if(future.complete(result)) {
                tracker.end();
            }
        }
    }
}

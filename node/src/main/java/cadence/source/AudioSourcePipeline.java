package cadence.source;

import cadence.cache.LruCache;
import cadence.error.SourceException;
import cadence.error.TranscodeException;
import cadence.util.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Resolves songs into audio streams, going through the metadata cache, then the audio cache,
 * then the {@link AudioFetcher}. Concurrent resolves of the same song share a single fetch,
 * and every caller reads the frames decoded so far through its own {@link AudioStream}.
 *
 * <br>A fetch is abandoned when every caller waiting on it leaves. Audio is cached only once
 * every frame was decoded; failures and abandoned fetches are never cached.
 */
public class AudioSourcePipeline {
    private static final Logger log = LoggerFactory.getLogger(AudioSourcePipeline.class);
    
    @GuardedBy("inFlight")
    private final Map<String, Fetch> inFlight = new HashMap<>();
    private final LruCache<String, MediaReference> metadataCache;
    private final LruCache<String, EncodedAudio> audioCache;
    private final AudioFetcher fetcher;
    private final Executor executor;
    private final Duration timeout;
    
    /**
     * @param metadataCache Normalized song key -> media reference.
     * @param audioCache    Media identifier -> audio.
     * @param fetcher       Fetcher called on cache misses.
     * @param executor      Executor fetches run on.
     * @param timeout       Maximum time until the first frame is decoded, or null for no limit.
     */
    public AudioSourcePipeline(@Nonnull LruCache<String, MediaReference> metadataCache,
                               @Nonnull LruCache<String, EncodedAudio> audioCache,
                               @Nonnull AudioFetcher fetcher, @Nonnull Executor executor,
                               @Nullable Duration timeout) {
        this.metadataCache = metadataCache;
        this.audioCache = audioCache;
        this.fetcher = fetcher;
        this.executor = executor;
        this.timeout = timeout;
    }
    
    @Nonnull
    @CheckReturnValue
    public LruCache<String, MediaReference> metadataCache() {
        return metadataCache;
    }
    
    @Nonnull
    @CheckReturnValue
    public LruCache<String, EncodedAudio> audioCache() {
        return audioCache;
    }
    
    /**
     * Number of distinct fetches currently running.
     *
     * @return The in-flight fetch count.
     */
    @CheckReturnValue
    public int inFlight() {
        synchronized(inFlight) {
            return inFlight.size();
        }
    }
    
    /**
     * Resolves a song with a token that's never cancelled. The fetch is abandoned if the
     * returned stream is closed before every frame was decoded.
     *
     * @param song Song to resolve.
     *
     * @return Future completed with a stream, or with a {@link SourceException}.
     */
    @Nonnull
    @CheckReturnValue
    public CompletableFuture<AudioStream> resolve(@Nonnull Song song) {
        return resolve(song, new CancellationToken());
    }
    
    /**
     * Resolves a song. The future completes as soon as the first frame is decoded; cached
     * audio completes it immediately. Every caller gets its own future and stream, so
     * cancelling one leaves the others untouched, but the shared fetch stops once none
     * is left.
     *
     * @param song  Song to resolve.
     * @param token Cancellation token of the song.
     *
     * @return Future completed with a stream, a {@link SourceException}, or cancelled.
     */
    @Nonnull
    @CheckReturnValue
    public CompletableFuture<AudioStream> resolve(@Nonnull Song song, @Nonnull CancellationToken token) {
        var key = SongKeys.normalize(song.url());
        var reference = metadataCache.get(key);
        if(reference != null) {
            var audio = audioCache.get(reference.identifier());
            if(audio != null) {
                return CompletableFuture.completedFuture(FrameRecording.of(audio).reader(() -> {}));
            }
        }
        Fetch fetch;
        boolean created = false;
        synchronized(inFlight) {
            fetch = inFlight.get(key);
            if(fetch == null) {
                fetch = new Fetch(key, song, reference);
                inFlight.put(key, fetch);
                created = true;
            } else {
                log.debug("Joining in-flight fetch for {}", key);
            }
            fetch.waiters++;
        }
        var waiter = fetch.attach(token);
        if(created) {
            fetch.start();
        }
        return waiter;
    }
    
    private class Fetch implements Runnable {
        private final CompletableFuture<FrameRecording> ready = new CompletableFuture<>();
        private final String key;
        private final Song song;
        private final MediaReference knownReference;
        @GuardedBy("inFlight")
        private int waiters;
        @GuardedBy("inFlight")
        private boolean done;
        private volatile boolean abandoned;
        private volatile FrameSource source;
        
        Fetch(String key, Song song, MediaReference knownReference) {
            this.key = key;
            this.song = song;
            this.knownReference = knownReference;
            if(timeout != null) {
                ready.orTimeout(timeout.toNanos(), TimeUnit.NANOSECONDS);
                ready.whenComplete((__, error) -> {
                    if(error instanceof TimeoutException) {
                        timedOut();
                    }
                });
            }
        }
        
        CompletableFuture<AudioStream> attach(CancellationToken token) {
            var waiter = new CompletableFuture<AudioStream>();
            var released = new AtomicBoolean();
            Runnable release = () -> {
                if(released.compareAndSet(false, true)) {
                    leave();
                }
            };
            waiter.whenComplete((__, error) -> {
                if(error != null) {
                    release.run();
                }
            });
            ready.whenComplete((recording, error) -> {
                if(error != null) {
                    waiter.completeExceptionally(error);
                    return;
                }
                var stream = recording.reader(release);
                if(!waiter.complete(stream)) {
                    stream.close();
                }
            });
            token.onCancel(() -> waiter.cancel(false));
            return waiter;
        }
        
        void start() {
            try {
                executor.execute(this);
            } catch(RejectedExecutionException e) {
                fail(null, new TranscodeException("Fetch pool rejected " + song.url(), e));
            }
        }
        
        @Override
        public void run() {
            if(abandoned) {
                return;
            }
            FrameRecording recording = null;
            try {
                var reference = knownReference;
                if(reference == null) {
                    log.debug("Locating media for {}", key);
                    reference = fetcher.locate(song);
                    metadataCache.put(key, reference);
                }
                var cached = audioCache.get(reference.identifier());
                if(cached != null) {
                    finish(FrameRecording.of(cached));
                    return;
                }
                if(abandoned) {
                    return;
                }
                log.info("Fetching audio for {} ({})", song.humanName(), reference.identifier());
                var start = System.nanoTime();
                try(var frames = fetcher.fetch(reference)) {
                    source = frames;
                    recording = new FrameRecording(frames.frameDuration());
                    byte[] frame;
                    while(!abandoned && (frame = frames.nextFrame()) != null) {
                        recording.append(frame);
                        if(recording.frameCount() == 1) {
                            log.debug("First frame of {} after {} ms", key, (System.nanoTime() - start) / 1_000_000);
                            ready.complete(recording);
                        }
                    }
                }
                if(abandoned) {
                    fail(recording, new CancellationException("Fetch abandoned"));
                    return;
                }
                var audio = recording.finish();
                log.info("Fetched {} in {} ms", audio, (System.nanoTime() - start) / 1_000_000);
                audioCache.put(reference.identifier(), audio);
                finish(recording);
            } catch(SourceException e) {
                fail(recording, e);
            } catch(Throwable t) {
                fail(recording, new TranscodeException("Unable to fetch " + song.url(), t));
            }
        }
        
        //removed before completing, so a caller that saw the end can never join this fetch
        private void finish(FrameRecording recording) {
            synchronized(inFlight) {
                done = true;
                inFlight.remove(key, this);
            }
            ready.complete(recording);
        }
        
        private void fail(FrameRecording recording, RuntimeException error) {
            synchronized(inFlight) {
                done = true;
                inFlight.remove(key, this);
            }
            if(abandoned) {
                log.debug("Abandoned fetch for {} ended", key, error);
            }
            if(recording != null) {
                recording.fail(error);
            }
            ready.completeExceptionally(error);
        }
        
        private void leave() {
            synchronized(inFlight) {
                if(--waiters > 0 || done) return;
                abandoned = true;
                inFlight.remove(key, this);
            }
            log.debug("Every caller left, abandoning fetch for {}", key);
            closeSource();
            ready.completeExceptionally(new CancellationException("Fetch abandoned"));
        }
        
        private void timedOut() {
            synchronized(inFlight) {
                if(done) return;
                abandoned = true;
                inFlight.remove(key, this);
            }
            log.warn("Timed out waiting for the first frame of {}", key);
            closeSource();
        }
        
        private void closeSource() {
            var s = source;
            if(s != null) {
                s.close();
            }
        }
    }
    
    /**
     * Converts a failure from a resolve future into the exception it carries.
     *
     * @param t Failure observed on the future.
     *
     * @return The underlying cause, with timeouts mapped to {@link TranscodeException}.
     */
    @Nonnull
    @CheckReturnValue
    public static Throwable unwrap(@Nonnull Throwable t) {
        while((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        if(t instanceof TimeoutException) {
            return new TranscodeException("Timed out fetching audio", t);
        }
        return t;
    }
}

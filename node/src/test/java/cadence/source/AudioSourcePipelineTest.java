package cadence.source;

import cadence.cache.LruCache;
import cadence.error.LookupException;
import cadence.error.TranscodeException;
import cadence.fake.Await;
import cadence.fake.FakeAudioFetcher;
import cadence.util.CancellationToken;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class AudioSourcePipelineTest {
    private static final Executor REJECTING = r -> {
        throw new RejectedExecutionException("shut down");
    };
    
    private final FakeAudioFetcher fetcher = new FakeAudioFetcher();
    private final LruCache<String, MediaReference> metadata = LruCache.counting("metadata-test", 100, null);
    private final LruCache<String, EncodedAudio> audio = new LruCache<>("audio-test", 1 << 20, EncodedAudio::sizeBytes, null);
    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private final AudioSourcePipeline pipeline = new AudioSourcePipeline(metadata, audio, fetcher, executor, null);
    
    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }
    
    private static Song song(String url) {
        return new Song(url, url, Duration.ofSeconds(1));
    }
    
    private static List<byte[]> drain(AudioStream stream) {
        var frames = new ArrayList<byte[]>();
        drain(stream, frames);
        return frames;
    }
    
    private static void drain(AudioStream stream, List<byte[]> into) {
        var deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while(!stream.isEnded()) {
            var frame = stream.poll();
            if(frame != null) {
                into.add(frame);
                continue;
            }
            if(System.nanoTime() > deadline) {
                fail("Stream didn't end, read " + into.size() + " frames");
            }
            try {
                Thread.sleep(1);
            } catch(InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted");
            }
        }
    }
    
    @Test
    void concurrentResolvesShareOneFetch() throws Exception {
        var gate = fetcher.hold();
        var futures = new ArrayList<CompletableFuture<AudioStream>>();
        for(int i = 0; i < 8; i++) {
            futures.add(pipeline.resolve(song("https://example.com/a")));
        }
        assertThat(pipeline.inFlight()).isEqualTo(1);
        gate.countDown();
        
        var first = drain(futures.get(0).get(5, TimeUnit.SECONDS));
        assertThat(first).hasSize(3);
        for(var f : futures.subList(1, futures.size())) {
            var frames = drain(f.get(5, TimeUnit.SECONDS));
            assertThat(frames).hasSize(3);
            for(int i = 0; i < 3; i++) {
                assertThat(frames.get(i)).isSameAs(first.get(i));
            }
        }
        assertThat(fetcher.fetches.get()).isEqualTo(1);
        assertThat(fetcher.locates.get()).isEqualTo(1);
    }
    
    @Test
    void equivalentUrlsShareOneFetch() throws Exception {
        var gate = fetcher.hold();
        var a = pipeline.resolve(song("https://youtu.be/abc"));
        var b = pipeline.resolve(song("https://www.youtube.com/watch?v=abc&feature=share"));
        gate.countDown();
        
        assertThat(drain(a.get(5, TimeUnit.SECONDS)).get(0)).isSameAs(drain(b.get(5, TimeUnit.SECONDS)).get(0));
        assertThat(fetcher.locates.get()).isEqualTo(1);
    }
    
    @Test
    void secondResolveIsServedFromCache() throws Exception {
        var first = drain(pipeline.resolve(song("https://example.com/a")).get(5, TimeUnit.SECONDS));
        Await.until(() -> audio.size() == 1 && pipeline.inFlight() == 0);
        var future = pipeline.resolve(song("https://example.com/a"));
        
        assertThat(future).isDone();
        assertThat(drain(future.get()).get(0)).isSameAs(first.get(0));
        assertThat(fetcher.fetches.get()).isEqualTo(1);
        assertThat(metadata.stats().hits()).isEqualTo(1);
        assertThat(metadata.stats().misses()).isEqualTo(1);
        assertThat(audio.stats().hits()).isEqualTo(1);
        assertThat(audio.stats().misses()).isEqualTo(1);
    }
    
    @Test
    void cachedAudioDoesntNeedTheFetchPool() throws Exception {
        drain(pipeline.resolve(song("https://example.com/a")).get(5, TimeUnit.SECONDS));
        Await.until(() -> audio.size() == 1);
        var rejecting = new AudioSourcePipeline(metadata, audio, fetcher, REJECTING, null);
        
        var future = rejecting.resolve(song("https://example.com/a"));
        assertThat(future).isDone();
        assertThat(drain(future.get())).hasSize(3);
    }
    
    @Test
    void rejectedFetchesFailAsTranscodeErrors() {
        var rejecting = new AudioSourcePipeline(metadata, audio, fetcher, REJECTING, null);
        var future = rejecting.resolve(song("https://example.com/a"));
        
        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
                .hasCauseInstanceOf(TranscodeException.class);
        assertThat(rejecting.inFlight()).isZero();
    }
    
    @Test
    void firstFrameIsAvailableBeforeDecodingEnds() throws Exception {
        fetcher.frames("https://example.com/long", 100).frameDelay(10);
        var start = System.nanoTime();
        var stream = pipeline.resolve(song("https://example.com/long")).get(5, TimeUnit.SECONDS);
        var elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        
        //decoding every frame takes a second
        assertThat(elapsedMs).isLessThan(500);
        assertThat(stream.isEnded()).isFalse();
        assertThat(audio.size()).isZero();
        assertThat(drain(stream)).hasSize(100);
    }
    
    @Test
    void latecomersReadFromTheFirstFrame() throws Exception {
        fetcher.frames("https://example.com/long", 50).frameDelay(5);
        var first = pipeline.resolve(song("https://example.com/long")).get(5, TimeUnit.SECONDS);
        Await.until(() -> fetcher.produced.get() >= 10);
        var late = pipeline.resolve(song("https://example.com/long")).get(5, TimeUnit.SECONDS);
        
        var frames = drain(late);
        assertThat(frames).hasSize(50);
        assertThat(frames.get(0)[0]).isEqualTo((byte) 0);
        assertThat(drain(first)).hasSize(50);
        assertThat(fetcher.fetches.get()).isEqualTo(1);
    }
    
    @Test
    void allWaitersSeeTheSameFailureAndNothingIsCached() throws Exception {
        fetcher.broken("https://example.com/bad");
        var gate = fetcher.hold();
        var a = pipeline.resolve(song("https://example.com/bad"));
        var b = pipeline.resolve(song("https://example.com/bad"));
        gate.countDown();
        
        var errorA = catchThrowableOfType(() -> a.get(5, TimeUnit.SECONDS), ExecutionException.class);
        var errorB = catchThrowableOfType(() -> b.get(5, TimeUnit.SECONDS), ExecutionException.class);
        assertThat(errorA.getCause()).isInstanceOf(TranscodeException.class);
        assertThat(errorB.getCause()).isSameAs(errorA.getCause());
        assertThat(audio.size()).isZero();
        assertThat(pipeline.inFlight()).isZero();
        
        pipeline.resolve(song("https://example.com/bad")).handle((r, t) -> null).get(5, TimeUnit.SECONDS);
        assertThat(fetcher.fetches.get()).isEqualTo(2);
    }
    
    @Test
    void failuresMidDecodeAreThrownAfterTheDecodedFrames() throws Exception {
        fetcher.frames("https://example.com/corrupt", 10).failAfter("https://example.com/corrupt", 3);
        var stream = pipeline.resolve(song("https://example.com/corrupt")).get(5, TimeUnit.SECONDS);
        
        var frames = new ArrayList<byte[]>();
        assertThatThrownBy(() -> drain(stream, frames))
                .isInstanceOf(TranscodeException.class);
        assertThat(frames).hasSize(3);
        assertThat(audio.size()).isZero();
        assertThat(pipeline.inFlight()).isZero();
    }
    
    @Test
    void lookupFailuresKeepTheirType() {
        fetcher.missing("https://example.com/gone");
        var future = pipeline.resolve(song("https://example.com/gone"));
        
        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
                .hasCauseInstanceOf(LookupException.class);
        assertThat(metadata.size()).isZero();
    }
    
    @Test
    void cancellingATokenOnlyCancelsThatWaiter() throws Exception {
        var gate = fetcher.hold();
        var token = new CancellationToken();
        var cancelled = pipeline.resolve(song("https://example.com/a"), token);
        var other = pipeline.resolve(song("https://example.com/a"));
        
        token.cancel();
        assertThat(cancelled).isCancelled();
        assertThat(other).isNotDone();
        
        gate.countDown();
        assertThat(drain(other.get(5, TimeUnit.SECONDS))).hasSize(3);
        assertThatThrownBy(cancelled::join).isInstanceOf(CancellationException.class);
        //someone still listened, so the audio got cached
        Await.until(() -> audio.size() == 1);
    }
    
    @Test
    void lastWaiterLeavingAbandonsTheFetch() throws Exception {
        var gate = fetcher.hold();
        var token = new CancellationToken();
        var future = pipeline.resolve(song("https://example.com/a"), token);
        Await.until(() -> fetcher.fetches.get() == 1);
        
        token.cancel();
        assertThat(future).isCancelled();
        assertThat(pipeline.inFlight()).isZero();
        gate.countDown();
        
        Await.until(() -> fetcher.closes.get() == 1);
        assertThat(fetcher.produced.get()).isZero();
        assertThat(audio.size()).isZero();
        
        //the next caller starts over
        drain(pipeline.resolve(song("https://example.com/a")).get(5, TimeUnit.SECONDS));
        assertThat(fetcher.fetches.get()).isEqualTo(2);
    }
    
    @Test
    void closingTheLastStreamStopsDecoding() throws Exception {
        fetcher.frames("https://example.com/long", 500).frameDelay(5);
        var stream = pipeline.resolve(song("https://example.com/long")).get(5, TimeUnit.SECONDS);
        Await.until(() -> fetcher.produced.get() >= 5);
        
        stream.close();
        Await.until(() -> fetcher.closes.get() == 1);
        var produced = fetcher.produced.get();
        Thread.sleep(50);
        
        assertThat(fetcher.produced.get()).isLessThanOrEqualTo(produced + 1).isLessThan(500);
        assertThat(audio.size()).isZero();
        assertThat(pipeline.inFlight()).isZero();
    }
    
    @Test
    void slowFetchesTimeOut() {
        fetcher.hold();
        var timed = new AudioSourcePipeline(metadata, audio, fetcher, executor, Duration.ofMillis(50));
        var future = timed.resolve(song("https://example.com/slow"));
        
        var error = catchThrowable(() -> future.get(5, TimeUnit.SECONDS));
        assertThat(AudioSourcePipeline.unwrap(error)).isInstanceOf(TranscodeException.class);
        assertThat(timed.inFlight()).isZero();
    }
    
    @Test
    void timeoutOnlyCoversTheFirstFrame() throws Exception {
        fetcher.frames("https://example.com/long", 100).frameDelay(10);
        var timed = new AudioSourcePipeline(metadata, audio, fetcher, executor, Duration.ofMillis(300));
        var stream = timed.resolve(song("https://example.com/long")).get(5, TimeUnit.SECONDS);
        
        //decoding takes a second, well past the timeout
        assertThat(drain(stream)).hasSize(100);
        Await.until(() -> audio.size() == 1);
    }
    
    @Test
    void unwrapStripsCompletionWrappers() {
        var cause = new LookupException("nope");
        assertThat(AudioSourcePipeline.unwrap(new CompletionException(cause))).isSameAs(cause);
        assertThat(AudioSourcePipeline.unwrap(new ExecutionException(cause))).isSameAs(cause);
    }
}

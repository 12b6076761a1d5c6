package cadence.send;

import cadence.error.TranscodeException;
import cadence.error.TransportException;
import cadence.fake.Await;
import cadence.fake.FakeAudioFetcher;
import cadence.fake.FakeVoiceSession;
import cadence.player.FrameLossTracker;
import cadence.source.AudioStream;
import cadence.source.EncodedAudio;
import cadence.source.FrameRecording;
import cadence.util.CancellationToken;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class FrameStreamerTest {
    private final Vertx vertx = Vertx.vertx();
    private final ExecutorService sendPool = Executors.newFixedThreadPool(4);
    private final FrameStreamer streamer = new FrameStreamer(vertx, sendPool, Duration.ofMillis(20));
    private final FakeVoiceSession session = new FakeVoiceSession("tenant", "voice");
    private final FrameLossTracker tracker = new FrameLossTracker();
    
    @AfterEach
    void close() {
        vertx.close();
        sendPool.shutdownNow();
    }
    
    private static AudioStream streamOf(EncodedAudio audio) {
        return FrameRecording.of(audio).reader(() -> {});
    }
    
    @Test
    void writesEveryFrameInOrder() throws Exception {
        var audio = FakeAudioFetcher.audio(10);
        var result = streamer.stream(streamOf(audio), session, new CancellationToken(), tracker).get(5, TimeUnit.SECONDS);
        
        assertThat(result).isEqualTo(StreamResult.FINISHED);
        assertThat(session.frames).hasSize(10);
        for(int i = 0; i < 10; i++) {
            assertThat(session.frames.get(i)).isSameAs(audio.frame(i));
        }
    }
    
    @Test
    void keepsTheFrameCadenceWithoutDrift() throws Exception {
        var start = System.nanoTime();
        streamer.stream(streamOf(FakeAudioFetcher.audio(50)), session, new CancellationToken(), tracker)
                .get(5, TimeUnit.SECONDS);
        var elapsedMs = TimeUnit.NANOSECONDS.toMillis(session.sentAtNanos.get(49) - start);
        
        //49 intervals between the first and the last frame
        assertThat(elapsedMs).isBetween(49L * 20 - 40, 49L * 20 + 400);
        var gaps = new ArrayList<Long>();
        for(int i = 1; i < 50; i++) {
            gaps.add(TimeUnit.NANOSECONDS.toMillis(session.sentAtNanos.get(i) - session.sentAtNanos.get(i - 1)));
        }
        assertThat(gaps).allSatisfy(gap -> assertThat(gap).isLessThan(150));
    }
    
    @Test
    void stopsWithinOneIntervalOfCancellation() throws Exception {
        var token = new CancellationToken();
        var future = streamer.stream(streamOf(FakeAudioFetcher.audio(500)), session, token, tracker);
        Await.until(() -> session.frameCount() >= 5);
        
        token.cancel();
        var sentAtCancel = session.frameCount();
        
        assertThat(future.get(1, TimeUnit.SECONDS)).isEqualTo(StreamResult.CANCELLED);
        Thread.sleep(100);
        assertThat(session.frameCount()).isEqualTo(sentAtCancel);
    }
    
    @Test
    void alreadyCancelledTokenSendsNothing() throws Exception {
        var token = new CancellationToken();
        token.cancel();
        
        assertThat(streamer.stream(streamOf(FakeAudioFetcher.audio(5)), session, token, tracker).get(1, TimeUnit.SECONDS))
                .isEqualTo(StreamResult.CANCELLED);
        Thread.sleep(60);
        assertThat(session.frameCount()).isZero();
    }
    
    @Test
    void transportErrorsFailTheStream() {
        session.failWith = new TransportException("socket closed");
        var future = streamer.stream(streamOf(FakeAudioFetcher.audio(5)), session, new CancellationToken(), tracker);
        
        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(TransportException.class);
    }
    
    @Test
    void unexpectedSessionErrorsAreReportedAsTransportErrors() {
        session.failWith = new IllegalStateException("bug");
        var future = streamer.stream(streamOf(FakeAudioFetcher.audio(5)), session, new CancellationToken(), tracker);
        
        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
                .hasCauseInstanceOf(TransportException.class)
                .hasRootCauseInstanceOf(IllegalStateException.class);
    }
    
    @Test
    void slowSessionsDontHoldBackOtherTenants() throws Exception {
        var singleLoop = Vertx.vertx(new VertxOptions().setEventLoopPoolSize(1));
        try {
            var shared = new FrameStreamer(singleLoop, sendPool, Duration.ofMillis(20));
            var slow = new FakeVoiceSession("slow", "voice");
            slow.sendDelayMillis = 200;
            var slowToken = new CancellationToken();
            var fastToken = new CancellationToken();
            shared.stream(streamOf(FakeAudioFetcher.audio(500)), slow, slowToken, new FrameLossTracker());
            shared.stream(streamOf(FakeAudioFetcher.audio(500)), session, fastToken, new FrameLossTracker());
            
            Thread.sleep(1000);
            var fastFrames = session.frameCount();
            slowToken.cancel();
            fastToken.cancel();
            
            //50 frames a second when alone
            assertThat(fastFrames).isGreaterThanOrEqualTo(40);
            assertThat(slow.frameCount()).isLessThan(fastFrames);
        } finally {
            singleLoop.close();
        }
    }
    
    @Test
    void framesOfOneTenantNeverOvertakeEachOther() throws Exception {
        session.sendDelayMillis = 30;
        streamer.stream(streamOf(FakeAudioFetcher.audio(20)), session, new CancellationToken(), tracker)
                .get(5, TimeUnit.SECONDS);
        
        for(int i = 0; i < 20; i++) {
            assertThat(session.frames.get(i)[0]).isEqualTo((byte) i);
        }
    }
    
    @Test
    void framesNotDecodedInTimeCountAsLost() throws Exception {
        var live = new LiveStream();
        var future = streamer.stream(live, session, new CancellationToken(), tracker);
        Thread.sleep(200);
        
        assertThat(session.frameCount()).isZero();
        assertThat(future).isNotDone();
        live.add(new byte[] { 1 });
        live.add(new byte[] { 2 });
        live.end();
        
        assertThat(future.get(5, TimeUnit.SECONDS)).isEqualTo(StreamResult.FINISHED);
        assertThat(session.frameCount()).isEqualTo(2);
        assertThat(live.polls.get()).isGreaterThan(5);
    }
    
    @Test
    void decodingErrorsFailTheStreamAfterTheDecodedFrames() {
        var live = new LiveStream();
        live.add(new byte[] { 1 });
        live.failure = new TranscodeException("corrupt");
        var future = streamer.stream(live, session, new CancellationToken(), tracker);
        
        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
                .hasCauseInstanceOf(TranscodeException.class);
        assertThat(session.frameCount()).isEqualTo(1);
    }
    
    @Test
    void streamIsClosedWhenStreamingEnds() throws Exception {
        var finished = new LiveStream();
        finished.add(new byte[] { 1 });
        finished.end();
        streamer.stream(finished, session, new CancellationToken(), tracker).get(5, TimeUnit.SECONDS);
        Await.until(finished.closed::get);
        
        var cancelled = new LiveStream();
        var token = new CancellationToken();
        streamer.stream(cancelled, session, token, tracker);
        token.cancel();
        assertThat(cancelled.closed).isTrue();
    }
    
    @Test
    void rejectsNonPositiveFrameDuration() {
        assertThatThrownBy(() -> new FrameStreamer(vertx, sendPool, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
    
    //frames appear when the test adds them
    private static class LiveStream implements AudioStream {
        private final List<byte[]> frames = new ArrayList<>();
        private final AtomicInteger polls = new AtomicInteger();
        private final AtomicBoolean closed = new AtomicBoolean();
        private volatile RuntimeException failure;
        private boolean ended;
        private int position;
        
        synchronized void add(byte[] frame) {
            frames.add(frame);
        }
        
        synchronized void end() {
            ended = true;
        }
        
        @Override
        public Duration frameDuration() {
            return Duration.ofMillis(20);
        }
        
        @Override
        public synchronized byte[] poll() {
            polls.incrementAndGet();
            if(position < frames.size()) {
                return frames.get(position++);
            }
            if(failure != null) {
                throw failure;
            }
            return null;
        }
        
        @Override
        public synchronized boolean isEnded() {
            return ended && position >= frames.size();
        }
        
        @Override
        public void close() {
            closed.set(true);
        }
    }
}

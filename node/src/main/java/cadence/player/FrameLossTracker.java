package cadence.player;

import cadence.util.ByteRingBuffer;

import javax.annotation.Nonnull;
import java.util.concurrent.TimeUnit;

public class FrameLossTracker implements FrameLossCounter {
    private static final long ACCEPTABLE_TRACK_SWITCH_TIME = TimeUnit.MILLISECONDS.toNanos(100);
    private static final long ONE_SECOND = TimeUnit.SECONDS.toNanos(1);
    
    private final ByteRingBuffer loss = new ByteRingBuffer(60);
    private final ByteRingBuffer success = new ByteRingBuffer(60);
    private long playingSince = Long.MAX_VALUE;
    private long streamStart;
    private long lastStreamEnd;
    private long lastUpdate;
    private byte currentLoss;
    private byte currentSuccess;
    
    public synchronized void onSuccess() {
        checkTime();
        currentSuccess++;
    }
    
    public synchronized void onFail() {
        checkTime();
        currentLoss++;
    }
    
    @Nonnull
    @Override
    public ByteRingBuffer lastMinuteLoss() {
        return loss;
    }
    
    @Nonnull
    @Override
    public ByteRingBuffer lastMinuteSuccess() {
        return success;
    }
    
    @Override
    public synchronized boolean isDataUsable() {
        if(streamStart - lastStreamEnd > ACCEPTABLE_TRACK_SWITCH_TIME && lastStreamEnd != 0) {
            return false;
        }
        return TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - playingSince) >= 60;
    }
    
    /**
     * Called by the streamer before the first frame of a song.
     */
    public synchronized void start() {
        streamStart = System.nanoTime();
        if(streamStart - lastStreamEnd > ACCEPTABLE_TRACK_SWITCH_TIME || playingSince == Long.MAX_VALUE) {
            playingSince = streamStart;
            loss.clear();
            success.clear();
        }
    }
    
    /**
     * Called by the streamer once a song stops, for any reason.
     */
    public synchronized void end() {
        lastStreamEnd = System.nanoTime();
    }
    
    private void checkTime() {
        var now = System.nanoTime();
        if(now - lastUpdate > ONE_SECOND) {
            lastUpdate = now;
            loss.put(currentLoss);
            success.put(currentSuccess);
            currentLoss = 0;
            currentSuccess = 0;
        }
    }
}

package cadence.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.concurrent.GuardedBy;
import java.util.ArrayList;
import java.util.List;

/**
 * One-shot cancellation signal. Players issue one per song; the fetch pipeline and the frame
 * streamer check it at every step.
 */
public class CancellationToken {
    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);
    
    @GuardedBy("this")
    private List<Runnable> callbacks = new ArrayList<>();
    private volatile boolean cancelled;
    
    @CheckReturnValue
    public boolean isCancelled() {
        return cancelled;
    }
    
    /**
     * Cancels this token, running the registered callbacks on the calling thread.
     *
     * @return {@code false} if it was already cancelled.
     */
    public boolean cancel() {
        List<Runnable> toRun;
        synchronized(this) {
            if(cancelled) return false;
            cancelled = true;
            toRun = callbacks;
            callbacks = null;
        }
        for(var r : toRun) {
            run(r);
        }
        return true;
    }
    
    /**
     * Registers a callback to run on cancellation. Runs it immediately if already cancelled.
     *
     * @param callback Callback to run.
     */
    public void onCancel(@Nonnull Runnable callback) {
        synchronized(this) {
            if(!cancelled) {
                callbacks.add(callback);
                return;
            }
        }
        run(callback);
    }
    
    private static void run(Runnable r) {
        try {
            r.run();
        } catch(Throwable t) {
            log.error("Error running cancellation callback {}", r, t);
        }
    }
}

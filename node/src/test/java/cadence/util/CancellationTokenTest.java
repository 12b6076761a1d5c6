package cadence.util;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class CancellationTokenTest {
    @Test
    void callbacksRunOnceOnCancel() {
        var token = new CancellationToken();
        var runs = new AtomicInteger();
        token.onCancel(runs::incrementAndGet);
        
        assertThat(token.cancel()).isTrue();
        assertThat(token.cancel()).isFalse();
        assertThat(token.isCancelled()).isTrue();
        assertThat(runs.get()).isEqualTo(1);
    }
    
    @Test
    void lateCallbacksRunImmediately() {
        var token = new CancellationToken();
        token.cancel();
        var runs = new AtomicInteger();
        
        token.onCancel(runs::incrementAndGet);
        
        assertThat(runs.get()).isEqualTo(1);
    }
    
    @Test
    void failingCallbackDoesNotStopTheOthers() {
        var token = new CancellationToken();
        var runs = new AtomicInteger();
        token.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        token.onCancel(runs::incrementAndGet);
        
        assertThatCode(token::cancel).doesNotThrowAnyException();
        assertThat(runs.get()).isEqualTo(1);
    }
}

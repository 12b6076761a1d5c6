package cadence.fake;

import java.time.Duration;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.fail;

public class Await {
    private Await() {}
    
    public static void until(BooleanSupplier condition) {
        until(condition, Duration.ofSeconds(5));
    }
    
    public static void until(BooleanSupplier condition, Duration timeout) {
        var deadline = System.nanoTime() + timeout.toNanos();
        while(!condition.getAsBoolean()) {
            if(System.nanoTime() > deadline) {
                fail("Condition not met within " + timeout);
            }
            try {
                Thread.sleep(5);
            } catch(InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted while waiting");
            }
        }
    }
}

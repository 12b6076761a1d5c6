package cadence.util;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import java.time.Duration;

public class Durations {
    private Durations() {}
    
    /**
     * Formats a duration as {@code m:ss}, or {@code h:mm:ss} when longer than an hour.
     * Negative durations are formatted as zero.
     *
     * @param duration Duration to format.
     *
     * @return The formatted duration.
     */
    @Nonnull
    @CheckReturnValue
    public static String format(@Nonnull Duration duration) {
        var seconds = Math.max(0, duration.getSeconds());
        var hours = seconds / 3600;
        var minutes = (seconds % 3600) / 60;
        var secs = seconds % 60;
        if(hours > 0) {
            return String.format("%d:%02d:%02d", hours, minutes, secs);
        }
        return String.format("%d:%02d", minutes, secs);
    }
}

package cadence.error;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Thrown by a voice session when a frame can't be written. Ends the current song only.
 */
public class TransportException extends RuntimeException {
    public TransportException(@Nonnull String message, @Nullable Throwable cause) {
        super(message, cause);
    }
    
    public TransportException(@Nonnull String message) {
        this(message, null);
    }
}

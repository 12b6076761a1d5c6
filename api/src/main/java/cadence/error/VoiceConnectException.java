package cadence.error;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Thrown when a voice session can't be opened, eg missing channel or permissions.
 * Never retried automatically.
 */
public class VoiceConnectException extends RuntimeException {
    public VoiceConnectException(@Nonnull String message, @Nullable Throwable cause) {
        super(message, cause);
    }
    
    public VoiceConnectException(@Nonnull String message) {
        this(message, null);
    }
}

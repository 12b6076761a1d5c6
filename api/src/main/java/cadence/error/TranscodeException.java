package cadence.error;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Thrown when downloading or transcoding media fails.
 */
public class TranscodeException extends SourceException {
    public TranscodeException(@Nonnull String message, @Nullable Throwable cause) {
        super(message, cause);
    }
    
    public TranscodeException(@Nonnull String message) {
        this(message, null);
    }
    
    @Nonnull
    @Override
    public String kind() {
        return "transcode";
    }
}

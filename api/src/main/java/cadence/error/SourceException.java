package cadence.error;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Base class for failures getting audio for a song.
 */
public abstract class SourceException extends RuntimeException {
    protected SourceException(@Nonnull String message, @Nullable Throwable cause) {
        super(message, cause);
    }
    
    /**
     * Short name of the failure kind, used as a metrics label.
     *
     * @return The failure kind.
     */
    @Nonnull
    public abstract String kind();
}

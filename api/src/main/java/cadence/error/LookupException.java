package cadence.error;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Thrown when a song or its media can't be found.
 */
public class LookupException extends SourceException {
    public LookupException(@Nonnull String message, @Nullable Throwable cause) {
        super(message, cause);
    }
    
    public LookupException(@Nonnull String message) {
        this(message, null);
    }
    
    @Nonnull
    @Override
    public String kind() {
        return "lookup";
    }
}

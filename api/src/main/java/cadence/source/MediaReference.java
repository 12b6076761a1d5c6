package cadence.source;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Result of locating the media behind a {@link Song}. The identifier is used as the
 * audio cache key, so two songs pointing at the same media share cached audio.
 */
public final class MediaReference {
    private final String identifier;
    private final String payload;
    
    /**
     * @param identifier Unique identifier of the media, eg {@code youtube:dQw4w9WgXcQ}.
     * @param payload    Opaque data the {@link AudioFetcher} needs to fetch the media again.
     */
    public MediaReference(@Nonnull String identifier, @Nonnull String payload) {
        this.identifier = Objects.requireNonNull(identifier, "identifier");
        this.payload = Objects.requireNonNull(payload, "payload");
    }
    
    @Nonnull
    @CheckReturnValue
    public String identifier() {
        return identifier;
    }
    
    @Nonnull
    @CheckReturnValue
    public String payload() {
        return payload;
    }
    
    @Override
    public boolean equals(Object o) {
        if(this == o) return true;
        if(!(o instanceof MediaReference)) return false;
        var that = (MediaReference) o;
        return identifier.equals(that.identifier) && payload.equals(that.payload);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(identifier, payload);
    }
    
    @Override
    public String toString() {
        return "MediaReference(" + identifier + ")";
    }
}

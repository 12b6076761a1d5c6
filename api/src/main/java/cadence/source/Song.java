package cadence.source;

import cadence.util.Durations;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Objects;

/**
 * A resolved song, as returned by a {@link SongLookupService}. Instances are immutable.
 */
public final class Song {
    private final String url;
    private final String title;
    private final Duration duration;
    private final String thumbnailUrl;
    private final String requestedBy;
    
    public Song(@Nonnull String url, @Nonnull String title, @Nonnull Duration duration,
                @Nullable String thumbnailUrl, @Nullable String requestedBy) {
        this.url = Objects.requireNonNull(url, "url");
        this.title = Objects.requireNonNull(title, "title");
        this.duration = Objects.requireNonNull(duration, "duration");
        this.thumbnailUrl = thumbnailUrl;
        this.requestedBy = requestedBy;
    }
    
    public Song(@Nonnull String url, @Nonnull String title, @Nonnull Duration duration) {
        this(url, title, duration, null, null);
    }
    
    /**
     * Url or identifier of this song. This is what audio is fetched from.
     *
     * @return The url of this song.
     */
    @Nonnull
    @CheckReturnValue
    public String url() {
        return url;
    }
    
    @Nonnull
    @CheckReturnValue
    public String title() {
        return title;
    }
    
    @Nonnull
    @CheckReturnValue
    public Duration duration() {
        return duration;
    }
    
    @Nullable
    @CheckReturnValue
    public String thumbnailUrl() {
        return thumbnailUrl;
    }
    
    @Nullable
    @CheckReturnValue
    public String requestedBy() {
        return requestedBy;
    }
    
    /**
     * Returns a copy of this song with the given requester.
     *
     * @param requester Name of the member that requested the song.
     *
     * @return A copy of this song.
     */
    @Nonnull
    @CheckReturnValue
    public Song withRequester(@Nullable String requester) {
        return new Song(url, title, duration, thumbnailUrl, requester);
    }
    
    /**
     * Name suitable for displaying to users. Falls back to the url for untitled songs.
     *
     * @return The display name of this song.
     */
    @Nonnull
    @CheckReturnValue
    public String humanName() {
        return title.isBlank() ? url : title;
    }
    
    @Override
    public boolean equals(Object o) {
        if(this == o) return true;
        if(!(o instanceof Song)) return false;
        var song = (Song) o;
        return url.equals(song.url) && title.equals(song.title) && duration.equals(song.duration) &&
                Objects.equals(thumbnailUrl, song.thumbnailUrl) && Objects.equals(requestedBy, song.requestedBy);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(url, title, duration, thumbnailUrl, requestedBy);
    }
    
    @Override
    public String toString() {
        return humanName() + " (" + Durations.format(duration) + ")";
    }
}

package cadence.source;

import cadence.error.LookupException;
import cadence.error.TranscodeException;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;

/**
 * Fetches and transcodes audio from an external source. Only called on cache misses,
 * so implementations are free to be slow and blocking; they run on the fetch pool.
 * <br>
 * Fetched audio is decoded lazily: playback starts with the first frame and the frames are
 * only stored in the audio cache once the {@link FrameSource} ends cleanly.
 */
public interface AudioFetcher {
    /**
     * Locates the media a song points to.
     *
     * @param song Song to locate.
     *
     * @return Reference to the media, used as the audio cache key.
     *
     * @throws LookupException If the media can't be found.
     */
    @Nonnull
    @CheckReturnValue
    MediaReference locate(@Nonnull Song song);
    
    /**
     * Starts downloading and transcoding the referenced media.
     *
     * @param reference Media to fetch, as returned by {@link #locate(Song)}.
     *
     * @return A source producing the frames as they are decoded. The caller closes it.
     *
     * @throws TranscodeException If the media can't be opened.
     */
    @Nonnull
    @CheckReturnValue
    FrameSource fetch(@Nonnull MediaReference reference);
}

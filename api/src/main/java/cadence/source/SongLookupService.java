package cadence.source;

import cadence.error.LookupException;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import java.util.List;

/**
 * Turns user input (a url or a search query) into songs. Used by the command layer
 * before anything reaches a player.
 */
public interface SongLookupService {
    /**
     * @param query Url or search terms.
     *
     * @return Matching songs, in the order the provider returned them. Never empty.
     *
     * @throws LookupException If nothing matched or the provider failed.
     */
    @Nonnull
    @CheckReturnValue
    List<Song> lookupSongs(@Nonnull String query);
}

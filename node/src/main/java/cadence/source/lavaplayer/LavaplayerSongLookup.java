package cadence.source.lavaplayer;

import cadence.source.Song;
import cadence.source.SongLookupService;
import com.sedmelluq.discord.lavaplayer.player.AudioPlayerManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Resolves user input to songs with lavaplayer. Input that looks like a url is loaded as is,
 * anything else is prefixed with the configured search prefix.
 */
public class LavaplayerSongLookup implements SongLookupService {
    private static final Logger log = LoggerFactory.getLogger(LavaplayerSongLookup.class);
    
    private final Supplier<AudioPlayerManager> manager;
    private final String searchPrefix;
    private final Duration timeout;
    
    public LavaplayerSongLookup(@Nonnull Supplier<AudioPlayerManager> manager, @Nonnull String searchPrefix,
                                @Nonnull Duration timeout) {
        this.manager = manager;
        this.searchPrefix = searchPrefix;
        this.timeout = timeout;
    }
    
    @Nonnull
    @Override
    public List<Song> lookupSongs(@Nonnull String query) {
        var trimmed = query.trim();
        var identifier = isUrl(trimmed) ? trimmed : searchPrefix + trimmed;
        log.debug("Looking up {}", identifier);
        var result = LoadResult.load(manager.get(), identifier, timeout);
        if(result.isSearchResult()) {
            return List.of(TrackCodec.toSong(result.tracks().get(0)));
        }
        return result.tracks().stream()
                .map(TrackCodec::toSong)
                .collect(Collectors.toUnmodifiableList());
    }
    
    static boolean isUrl(@Nonnull String input) {
        return input.startsWith("http://") || input.startsWith("https://");
    }
}

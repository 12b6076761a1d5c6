package cadence.source;

import cadence.cache.LruCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Caches lookup results by normalized query, so repeated searches and links don't hit the
 * provider again. Failures are not cached.
 */
public class CachingSongLookupService implements SongLookupService {
    private static final Logger log = LoggerFactory.getLogger(CachingSongLookupService.class);
    
    private final SongLookupService delegate;
    private final LruCache<String, List<Song>> cache;
    
    public CachingSongLookupService(@Nonnull SongLookupService delegate, @Nonnull LruCache<String, List<Song>> cache) {
        this.delegate = delegate;
        this.cache = cache;
    }
    
    @Nonnull
    @Override
    public List<Song> lookupSongs(@Nonnull String query) {
        var key = SongKeys.query(query);
        var cached = cache.get(key);
        if(cached != null) {
            log.debug("Lookup cache hit for {}", key);
            return cached;
        }
        var songs = List.copyOf(delegate.lookupSongs(query));
        if(!songs.isEmpty()) {
            cache.put(key, songs);
        }
        return songs;
    }
}

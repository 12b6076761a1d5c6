package cadence.source.lavaplayer;

import cadence.error.LookupException;
import com.sedmelluq.discord.lavaplayer.player.AudioLoadResultHandler;
import com.sedmelluq.discord.lavaplayer.player.AudioPlayerManager;
import com.sedmelluq.discord.lavaplayer.tools.FriendlyException;
import com.sedmelluq.discord.lavaplayer.track.AudioPlaylist;
import com.sedmelluq.discord.lavaplayer.track.AudioTrack;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Blocking wrapper around {@link AudioPlayerManager#loadItem(String, AudioLoadResultHandler)}.
 */
class LoadResult {
    private final List<AudioTrack> tracks;
    private final boolean searchResult;
    
    private LoadResult(List<AudioTrack> tracks, boolean searchResult) {
        this.tracks = tracks;
        this.searchResult = searchResult;
    }
    
    /**
     * Loaded tracks. For playlists, the selected track comes first.
     *
     * @return The loaded tracks, never empty.
     */
    @Nonnull
    List<AudioTrack> tracks() {
        return tracks;
    }
    
    boolean isSearchResult() {
        return searchResult;
    }
    
    /**
     * Loads an identifier, waiting for the result.
     *
     * @param timeout Maximum wait, zero to wait forever.
     *
     * @throws cadence.error.LookupException If nothing was found, loading failed or timed out.
     */
    @Nonnull
    @CheckReturnValue
    static LoadResult load(@Nonnull AudioPlayerManager manager, @Nonnull String identifier, @Nonnull Duration timeout) {
        var future = new CompletableFuture<LoadResult>();
        manager.loadItem(identifier, new AudioLoadResultHandler() {
            @Override
            public void trackLoaded(AudioTrack track) {
                future.complete(new LoadResult(List.of(track), false));
            }
            
            @Override
            public void playlistLoaded(AudioPlaylist playlist) {
                var tracks = playlist.getTracks();
                if(tracks.isEmpty()) {
                    future.completeExceptionally(new LookupException("Playlist " + identifier + " is empty"));
                    return;
                }
                var selected = playlist.getSelectedTrack();
                if(selected != null && tracks.contains(selected) && tracks.get(0) != selected) {
                    var reordered = new ArrayList<AudioTrack>(tracks.size());
                    reordered.add(selected);
                    for(var t : tracks) {
                        if(t != selected) reordered.add(t);
                    }
                    tracks = reordered;
                }
                future.complete(new LoadResult(List.copyOf(tracks), playlist.isSearchResult()));
            }
            
            @Override
            public void noMatches() {
                future.completeExceptionally(new LookupException("No matches for " + identifier));
            }
            
            @Override
            public void loadFailed(FriendlyException exception) {
                future.completeExceptionally(new LookupException("Loading " + identifier + " failed: " +
                        exception.getMessage(), exception));
            }
        });
        try {
            return timeout.isZero() ? future.get() : future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch(InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LookupException("Interrupted while loading " + identifier, e);
        } catch(ExecutionException e) {
            if(e.getCause() instanceof LookupException) {
                throw (LookupException) e.getCause();
            }
            throw new LookupException("Loading " + identifier + " failed", e.getCause());
        } catch(TimeoutException e) {
            throw new LookupException("Timed out loading " + identifier, e);
        }
    }
}

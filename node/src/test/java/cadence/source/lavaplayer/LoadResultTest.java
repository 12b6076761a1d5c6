package cadence.source.lavaplayer;

import cadence.error.LookupException;
import com.sedmelluq.discord.lavaplayer.container.MediaContainer;
import com.sedmelluq.discord.lavaplayer.container.MediaContainerDescriptor;
import com.sedmelluq.discord.lavaplayer.player.AudioPlayerManager;
import com.sedmelluq.discord.lavaplayer.player.DefaultAudioPlayerManager;
import com.sedmelluq.discord.lavaplayer.source.AudioSourceManager;
import com.sedmelluq.discord.lavaplayer.source.http.HttpAudioSourceManager;
import com.sedmelluq.discord.lavaplayer.source.http.HttpAudioTrack;
import com.sedmelluq.discord.lavaplayer.source.local.LocalAudioSourceManager;
import com.sedmelluq.discord.lavaplayer.track.AudioItem;
import com.sedmelluq.discord.lavaplayer.track.AudioReference;
import com.sedmelluq.discord.lavaplayer.track.AudioTrack;
import com.sedmelluq.discord.lavaplayer.track.AudioTrackInfo;
import com.sedmelluq.discord.lavaplayer.track.BasicAudioPlaylist;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.DataInput;
import java.io.DataOutput;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class LoadResultTest {
    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    
    private final HttpAudioSourceManager http = new HttpAudioSourceManager();
    private final DefaultAudioPlayerManager manager = new DefaultAudioPlayerManager();
    private final AudioTrack first = track("first");
    private final AudioTrack second = track("second");
    private final AudioTrack third = track("third");
    
    @TempDir
    Path dir;
    
    LoadResultTest() {
        manager.registerSourceManager(new PlaylistSource());
        manager.registerSourceManager(new LocalAudioSourceManager());
    }
    
    @AfterEach
    void shutdown() {
        manager.shutdown();
    }
    
    private AudioTrack track(String name) {
        var info = new AudioTrackInfo(name, "artist", 1000, name, false, "https://example.com/" + name);
        return new HttpAudioTrack(info, new MediaContainerDescriptor(MediaContainer.MP3.probe, null), http);
    }
    
    @Test
    void localFilesLoadAsASingleTrack() throws Exception {
        var wav = WavFiles.tone(dir.resolve("tone.wav"), Duration.ofMillis(500));
        
        var result = LoadResult.load(manager, wav.toString(), TIMEOUT);
        
        assertThat(result.tracks()).hasSize(1);
        assertThat(result.isSearchResult()).isFalse();
        assertThat(result.tracks().get(0).getDuration()).isBetween(450L, 550L);
    }
    
    @Test
    void missingFilesAreNoMatches() {
        assertThatThrownBy(() -> LoadResult.load(manager, dir.resolve("missing.wav").toString(), TIMEOUT))
                .isInstanceOf(LookupException.class)
                .hasMessageContaining("No matches");
    }
    
    @Test
    void unreadableFilesFailToLoad() throws Exception {
        var garbage = Files.write(dir.resolve("garbage.bin"), "definitely not audio".getBytes());
        
        assertThatThrownBy(() -> LoadResult.load(manager, garbage.toString(), TIMEOUT))
                .isInstanceOf(LookupException.class)
                .hasMessageContaining("failed");
    }
    
    @Test
    void selectedPlaylistTrackComesFirst() {
        var result = LoadResult.load(manager, "playlist:selected", TIMEOUT);
        
        assertThat(result.tracks()).containsExactly(second, first, third);
        assertThat(result.isSearchResult()).isFalse();
    }
    
    @Test
    void playlistsWithoutSelectionKeepTheirOrder() {
        assertThat(LoadResult.load(manager, "playlist:plain", TIMEOUT).tracks())
                .containsExactly(first, second, third);
    }
    
    @Test
    void searchResultsAreFlagged() {
        assertThat(LoadResult.load(manager, "playlist:search", TIMEOUT).isSearchResult()).isTrue();
    }
    
    @Test
    void emptyPlaylistsAreLookupFailures() {
        assertThatThrownBy(() -> LoadResult.load(manager, "playlist:empty", TIMEOUT))
                .isInstanceOf(LookupException.class)
                .hasMessageContaining("empty");
    }
    
    @Test
    void slowLoadsTimeOut() {
        assertThatThrownBy(() -> LoadResult.load(manager, "playlist:slow", Duration.ofMillis(100)))
                .isInstanceOf(LookupException.class)
                .hasMessageContaining("Timed out");
    }
    
    //serves the playlists above for "playlist:<kind>" identifiers
    private class PlaylistSource implements AudioSourceManager {
        @Override
        public String getSourceName() {
            return "playlist";
        }
        
        @Override
        public AudioItem loadItem(AudioPlayerManager manager, AudioReference reference) {
            return switch(reference.identifier) {
                case "playlist:selected" -> new BasicAudioPlaylist("list", List.of(first, second, third), second, false);
                case "playlist:plain" -> new BasicAudioPlaylist("list", List.of(first, second, third), null, false);
                case "playlist:search" -> new BasicAudioPlaylist("search", List.of(first, second), null, true);
                case "playlist:empty" -> new BasicAudioPlaylist("list", List.of(), null, false);
                case "playlist:slow" -> {
                    try {
                        Thread.sleep(2000);
                    } catch(InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    yield null;
                }
                default -> null;
            };
        }
        
        @Override
        public boolean isTrackEncodable(AudioTrack track) {
            return false;
        }
        
        @Override
        public void encodeTrack(AudioTrack track, DataOutput output) {
            throw new UnsupportedOperationException();
        }
        
        @Override
        public AudioTrack decodeTrack(AudioTrackInfo trackInfo, DataInput input) {
            throw new UnsupportedOperationException();
        }
        
        @Override
        public void shutdown() {
            //nothing to release
        }
    }
}

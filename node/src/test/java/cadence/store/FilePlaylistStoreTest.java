package cadence.store;

import cadence.player.QueueEntry;
import cadence.source.Song;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class FilePlaylistStoreTest {
    @TempDir
    Path directory;
    
    private static QueueEntry entry(String name, String requester) {
        return new QueueEntry(new Song("https://example.com/" + name, name.toUpperCase(),
                Duration.ofSeconds(215), "https://img.example.com/" + name + ".jpg", requester), "text", "voice");
    }
    
    @Test
    void savedQueueCanBeLoadedBack() {
        var queue = List.of(entry("a", "alice"), entry("b", null));
        new FilePlaylistStore(directory).save("guild", queue);
        
        //a fresh instance, as after a restart
        assertThat(new FilePlaylistStore(directory).load("guild")).isEqualTo(queue);
    }
    
    @Test
    void unknownTenantHasAnEmptyQueue() {
        assertThat(new FilePlaylistStore(directory).load("nobody")).isEmpty();
    }
    
    @Test
    void savingAnEmptyQueueRemovesTheFile() {
        var store = new FilePlaylistStore(directory);
        store.save("guild", List.of(entry("a", null)));
        assertThat(store.fileFor("guild")).exists();
        
        store.save("guild", List.of());
        
        assertThat(store.fileFor("guild")).doesNotExist();
        assertThat(store.load("guild")).isEmpty();
    }
    
    @Test
    void tenantIdsCantEscapeTheDirectory() {
        var store = new FilePlaylistStore(directory);
        
        assertThat(store.fileFor("../../etc/passwd").getParent()).isEqualTo(directory);
    }
    
    @Test
    void corruptFilesAreIgnored() throws Exception {
        var store = new FilePlaylistStore(directory);
        Files.writeString(store.fileFor("guild"), "{not json");
        
        assertThat(store.load("guild")).isEmpty();
    }
}

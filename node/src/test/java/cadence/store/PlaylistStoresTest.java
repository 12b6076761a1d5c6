package cadence.store;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class PlaylistStoresTest {
    @TempDir
    Path directory;
    
    @Test
    void memoryStoreIsTheDefault() {
        var config = ConfigFactory.parseResources("reference.conf").getConfig("cadence");
        
        assertThat(PlaylistStores.fromConfig(config)).isInstanceOf(InMemoryPlaylistStore.class);
    }
    
    @Test
    void fileStoreUsesTheConfiguredDirectory() {
        var config = ConfigFactory.parseMap(Map.of(
                "playlist-store.type", "file",
                "playlist-store.directory", directory.toString()
        ));
        
        var store = PlaylistStores.fromConfig(config);
        assertThat(store).isInstanceOf(FilePlaylistStore.class);
        assertThat(((FilePlaylistStore) store).directory()).isEqualTo(directory);
    }
    
    @Test
    void unknownTypesAreRejected() {
        var config = ConfigFactory.parseMap(Map.of("playlist-store.type", "redis"));
        
        assertThatThrownBy(() -> PlaylistStores.fromConfig(config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("redis");
    }
}

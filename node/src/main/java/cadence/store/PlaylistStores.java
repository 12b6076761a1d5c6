package cadence.store;

import com.typesafe.config.Config;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import java.nio.file.Paths;

public class PlaylistStores {
    private PlaylistStores() {}
    
    /**
     * Creates the store selected by {@code playlist-store.type}.
     *
     * @param config The {@code cadence} config block.
     *
     * @return A new store.
     */
    @Nonnull
    @CheckReturnValue
    public static PlaylistStore fromConfig(@Nonnull Config config) {
        var type = config.getString("playlist-store.type").strip().toLowerCase();
        return switch(type) {
            case "memory" -> new InMemoryPlaylistStore();
            case "file" -> new FilePlaylistStore(Paths.get(config.getString("playlist-store.directory")));
            default -> throw new IllegalArgumentException("Unknown playlist store type '" + type + "'");
        };
    }
}

package cadence.store;

import cadence.player.QueueEntry;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Stores one json file per tenant. Writes go to a temporary file first, which then replaces the
 * previous snapshot, so a crash mid-write leaves the old snapshot intact.
 */
public class FilePlaylistStore implements PlaylistStore {
    private static final Logger log = LoggerFactory.getLogger(FilePlaylistStore.class);
    
    private final Path directory;
    
    public FilePlaylistStore(@Nonnull Path directory) {
        this.directory = directory;
        try {
            Files.createDirectories(directory);
        } catch(IOException e) {
            throw new UncheckedIOException("Unable to create playlist directory " + directory, e);
        }
    }
    
    @Nonnull
    @CheckReturnValue
    public Path directory() {
        return directory;
    }
    
    @Nonnull
    @Override
    public List<QueueEntry> load(@Nonnull String tenantId) {
        var path = fileFor(tenantId);
        if(!Files.isReadable(path)) {
            return List.of();
        }
        try {
            var content = Files.readString(path, StandardCharsets.UTF_8);
            return List.copyOf(QueueEntryCodec.decodeAll(new JsonArray(content)));
        } catch(IOException e) {
            throw new UncheckedIOException("Unable to read playlist of " + tenantId, e);
        } catch(DecodeException | IllegalArgumentException | ClassCastException e) {
            log.warn("Ignoring corrupt playlist file {}", path, e);
            return List.of();
        }
    }
    
    @Override
    public void save(@Nonnull String tenantId, @Nonnull List<QueueEntry> entries) {
        var path = fileFor(tenantId);
        try {
            if(entries.isEmpty()) {
                Files.deleteIfExists(path);
                return;
            }
            var tmp = path.resolveSibling(path.getFileName() + ".tmp");
            Files.writeString(tmp, QueueEntryCodec.encodeAll(entries).encode(), StandardCharsets.UTF_8);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch(IOException e) {
            throw new UncheckedIOException("Unable to write playlist of " + tenantId, e);
        }
    }
    
    @Nonnull
    @CheckReturnValue
    Path fileFor(@Nonnull String tenantId) {
        return directory.resolve(URLEncoder.encode(tenantId, StandardCharsets.UTF_8) + ".json");
    }
}

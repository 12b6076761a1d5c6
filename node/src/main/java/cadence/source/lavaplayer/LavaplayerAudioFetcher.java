package cadence.source.lavaplayer;

import cadence.error.TranscodeException;
import cadence.source.AudioFetcher;
import cadence.source.FrameSource;
import cadence.source.MediaReference;
import cadence.source.Song;
import com.sedmelluq.discord.lavaplayer.player.AudioPlayer;
import com.sedmelluq.discord.lavaplayer.player.AudioPlayerManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * Locates songs with lavaplayer and decodes them with a private {@link AudioPlayer} per fetch.
 * <br>
 * Streams are rejected, since they never end.
 */
public class LavaplayerAudioFetcher implements AudioFetcher {
    private static final Logger log = LoggerFactory.getLogger(LavaplayerAudioFetcher.class);
    
    private final Supplier<AudioPlayerManager> manager;
    private final Duration loadTimeout;
    private final Duration frameTimeout;
    
    /**
     * @param manager      Supplies the manager, called on the first locate or fetch.
     * @param loadTimeout  Maximum time locating a song may take.
     * @param frameTimeout Maximum wait for a single decoded frame, zero to wait forever.
     */
    public LavaplayerAudioFetcher(@Nonnull Supplier<AudioPlayerManager> manager, @Nonnull Duration loadTimeout,
                                  @Nonnull Duration frameTimeout) {
        this.manager = manager;
        this.loadTimeout = loadTimeout;
        this.frameTimeout = frameTimeout;
    }
    
    @Nonnull
    @Override
    public MediaReference locate(@Nonnull Song song) {
        var manager = this.manager.get();
        var result = LoadResult.load(manager, song.url(), loadTimeout);
        var track = result.tracks().get(0);
        return new MediaReference(TrackCodec.mediaIdentifier(track), TrackCodec.encode(manager, track));
    }
    
    @Nonnull
    @Override
    public FrameSource fetch(@Nonnull MediaReference reference) {
        var manager = this.manager.get();
        var track = TrackCodec.decode(manager, reference.payload());
        if(track == null) {
            throw new TranscodeException("No source manager can decode " + reference.identifier());
        }
        if(track.getInfo().isStream) {
            throw new TranscodeException(reference.identifier() + " is a live stream");
        }
        var frameDuration = Duration.ofMillis(manager.getConfiguration().getOutputFormat().frameDuration());
        var source = new LavaplayerFrameSource(manager.createPlayer(), reference.identifier(),
                frameDuration, frameTimeout);
        try {
            if(!source.start(track)) {
                throw new TranscodeException("Unable to start " + reference.identifier());
            }
        } catch(RuntimeException e) {
            source.close();
            throw e;
        }
        log.debug("Started decoding {}", reference.identifier());
        return source;
    }
}

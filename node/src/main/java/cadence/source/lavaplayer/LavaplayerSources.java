package cadence.source.lavaplayer;

import com.sedmelluq.discord.lavaplayer.player.AudioPlayerManager;
import com.sedmelluq.discord.lavaplayer.player.DefaultAudioPlayerManager;
import com.sedmelluq.discord.lavaplayer.source.AudioSourceManager;
import com.sedmelluq.discord.lavaplayer.source.bandcamp.BandcampAudioSourceManager;
import com.sedmelluq.discord.lavaplayer.source.http.HttpAudioSourceManager;
import com.sedmelluq.discord.lavaplayer.source.local.LocalAudioSourceManager;
import com.sedmelluq.discord.lavaplayer.source.soundcloud.SoundCloudAudioSourceManager;
import com.sedmelluq.discord.lavaplayer.source.twitch.TwitchStreamAudioSourceManager;
import com.sedmelluq.discord.lavaplayer.source.vimeo.VimeoAudioSourceManager;
import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Builds the player manager backing the default lookup and fetcher. Youtube support is not
 * bundled with lavaplayer anymore; register its source manager on a manager passed to the
 * builder instead.
 */
public class LavaplayerSources {
    private static final Logger log = LoggerFactory.getLogger(LavaplayerSources.class);
    private static final Map<String, Supplier<AudioSourceManager>> SOURCE_MANAGERS = Map.of(
            "bandcamp", BandcampAudioSourceManager::new,
            "http", HttpAudioSourceManager::new,
            "local", LocalAudioSourceManager::new,
            "soundcloud", SoundCloudAudioSourceManager::createDefault,
            "twitch", TwitchStreamAudioSourceManager::new,
            "vimeo", VimeoAudioSourceManager::new
    );
    private static final Set<String> DISABLED_BY_DEFAULT = Set.of("http", "local");
    
    private LavaplayerSources() {}
    
    /**
     * @param config The {@code cadence} config block.
     *
     * @return A manager with the enabled sources registered.
     */
    @Nonnull
    @CheckReturnValue
    public static AudioPlayerManager createManager(@Nonnull Config config) {
        var manager = new DefaultAudioPlayerManager();
        var enabled = SOURCE_MANAGERS.keySet().stream()
                .filter(key -> {
                    if(config.hasPath("lavaplayer.sources." + key)) {
                        return config.getBoolean("lavaplayer.sources." + key);
                    }
                    return !DISABLED_BY_DEFAULT.contains(key);
                })
                .peek(key -> manager.registerSourceManager(SOURCE_MANAGERS.get(key).get()))
                .collect(Collectors.toSet());
        log.info("Enabled default sources: {}", enabled);
        manager.setFrameBufferDuration(config.getInt("lavaplayer.frame-buffer-duration"));
        return manager;
    }
}

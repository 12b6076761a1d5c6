package cadence;

import cadence.cache.LruCache;
import cadence.event.EventDispatcherImpl;
import cadence.event.TenantLifecycleListener;
import cadence.player.Player;
import cadence.player.PlayerRegistry;
import cadence.player.PresenceMonitor;
import cadence.send.FrameStreamer;
import cadence.send.VoiceTransport;
import cadence.source.AudioFetcher;
import cadence.source.AudioSourcePipeline;
import cadence.source.CachingSongLookupService;
import cadence.source.EncodedAudio;
import cadence.source.SongLookupService;
import cadence.source.lavaplayer.LavaplayerAudioFetcher;
import cadence.source.lavaplayer.LavaplayerSongLookup;
import cadence.source.lavaplayer.LavaplayerSources;
import cadence.store.PlaylistStore;
import cadence.store.PlaylistStores;
import cadence.util.ConfigUtil;
import cadence.util.Init;
import cadence.util.LazyInit;
import cadence.util.Version;
import com.sedmelluq.discord.lavaplayer.player.AudioPlayerManager;
import com.typesafe.config.Config;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * A playback node. Owns every player, the shared caches and the timers driving them.
 * <br>
 * The platform binding creates one with {@link #builder()}, forwards guild membership changes
 * to {@link #lifecycleListener()}, turns user commands into calls on {@link #getPlayer(String)}
 * and listens to playback events through {@link #dispatcher()}.
 */
public class Cadence implements NodeState, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Cadence.class);

    private final AtomicBoolean closed = new AtomicBoolean();
    private final EventDispatcherImpl dispatcher = new EventDispatcherImpl(this);
    private final Config rootConfig;
    private final Vertx vertx;
    private final boolean ownsVertx;
    private final ExecutorService fetchExecutor;
    private final boolean ownsFetchExecutor;
    private final ExecutorService sendExecutor;
    private final boolean ownsSendExecutor;
    private final LazyInit<AudioPlayerManager> playerManager;
    private final boolean ownsPlayerManager;
    private final VoiceTransport voiceTransport;
    private final PlaylistStore playlistStore;
    private final SongLookupService songLookup;
    private final AudioSourcePipeline pipeline;
    private final FrameStreamer streamer;
    private final PlayerRegistry registry;
    private final PresenceMonitor presenceMonitor;

    private Cadence(@Nonnull CadenceBuilder builder, @Nonnull Config rootConfig) {
        var config = rootConfig.getConfig("cadence");
        this.rootConfig = rootConfig;
        this.ownsVertx = builder.vertx == null;
        this.vertx = ownsVertx ? Vertx.vertx() : builder.vertx;
        this.ownsFetchExecutor = builder.fetchExecutor == null;
        this.fetchExecutor = ownsFetchExecutor ?
                createPool("fetch", config.getInt("fetch.threads")) : builder.fetchExecutor;
        this.ownsSendExecutor = builder.sendExecutor == null;
        this.sendExecutor = ownsSendExecutor ?
                createPool("send", config.getInt("send.threads")) : builder.sendExecutor;
        var manager = builder.audioPlayerManager;
        this.ownsPlayerManager = manager == null;
        this.playerManager = new LazyInit<>(() -> manager == null ? LavaplayerSources.createManager(config) : manager);
        this.voiceTransport = builder.voiceTransport;
        this.playlistStore = builder.playlistStore == null ? PlaylistStores.fromConfig(config) : builder.playlistStore;

        var fetchTimeout = config.getDuration("fetch.timeout");
        var metadataCapacity = config.getLong("cache.metadata.capacity");
        var metadataExpiry = config.getDuration("cache.metadata.expire-after");
        var lookup = builder.songLookup == null ?
                new LavaplayerSongLookup(playerManager, config.getString("lavaplayer.search-prefix"), fetchTimeout) :
                builder.songLookup;
        this.songLookup = new CachingSongLookupService(lookup,
                LruCache.counting("lookup", metadataCapacity, metadataExpiry));
        AudioFetcher fetcher = builder.audioFetcher == null ?
                new LavaplayerAudioFetcher(playerManager, fetchTimeout, fetchTimeout) :
                builder.audioFetcher;
        this.pipeline = new AudioSourcePipeline(
                LruCache.counting("metadata", metadataCapacity, metadataExpiry),
                new LruCache<>("audio", config.getBytes("cache.audio.capacity"), EncodedAudio::sizeBytes,
                        config.getDuration("cache.audio.expire-after")),
                fetcher,
                fetchExecutor,
                fetchTimeout.isZero() ? null : fetchTimeout
        );
        this.streamer = new FrameStreamer(vertx, sendExecutor, config.getDuration("frame-duration"));
        this.registry = new PlayerRegistry(this);
        if(builder.presenceQuery == null) {
            log.info("No presence query set, players won't be stopped when left alone");
            this.presenceMonitor = null;
        } else {
            this.presenceMonitor = new PresenceMonitor(vertx, registry, builder.presenceQuery,
                    config.getDuration("presence.interval"));
        }
    }

    @Nonnull
    @CheckReturnValue
    public static CadenceBuilder builder() {
        return new CadenceBuilder();
    }

    @Nonnull
    @CheckReturnValue
    static Cadence create(@Nonnull CadenceBuilder builder) {
        var start = System.nanoTime();
        var rootConfig = builder.config == null ? ConfigUtil.load() : builder.config.resolve();
        Init.preInit(rootConfig.getConfig("cadence"));
        var cadence = new Cadence(builder, rootConfig);
        Init.postInit(cadence);
        log.info("Started cadence {} in {} ms", Version.VERSION, (System.nanoTime() - start) / 1_000_000);
        return cadence;
    }

    @Nonnull
    @CheckReturnValue
    @Override
    public Config config() {
        return rootConfig;
    }

    @Nonnull
    @CheckReturnValue
    @Override
    public Vertx vertx() {
        return vertx;
    }

    @Nonnull
    @CheckReturnValue
    @Override
    public EventDispatcherImpl dispatcher() {
        return dispatcher;
    }

    @Nonnull
    @CheckReturnValue
    @Override
    public SongLookupService songLookup() {
        return songLookup;
    }

    @Nonnull
    @CheckReturnValue
    public AudioSourcePipeline pipeline() {
        return pipeline;
    }

    @Nonnull
    @CheckReturnValue
    public FrameStreamer streamer() {
        return streamer;
    }

    @Nonnull
    @CheckReturnValue
    public VoiceTransport voiceTransport() {
        return voiceTransport;
    }

    @Nonnull
    @CheckReturnValue
    public PlaylistStore playlistStore() {
        return playlistStore;
    }

    @Nonnull
    @CheckReturnValue
    public PlayerRegistry registry() {
        return registry;
    }

    /**
     * Listener the platform binding notifies when the bot joins or leaves a tenant.
     *
     * @return The tenant lifecycle listener.
     */
    @Nonnull
    @CheckReturnValue
    public TenantLifecycleListener lifecycleListener() {
        return registry;
    }

    @Nonnull
    @CheckReturnValue
    @Override
    public Player getPlayer(@Nonnull String tenantId) {
        return registry.player(tenantId);
    }

    @Nullable
    @CheckReturnValue
    @Override
    public Player getExistingPlayer(@Nonnull String tenantId) {
        return registry.existingPlayer(tenantId);
    }

    @Nonnull
    @CheckReturnValue
    @Override
    public Stream<Player> allPlayers() {
        List<Player> players = registry.players();
        return players.stream();
    }

    /**
     * Stops every player and releases the resources owned by this node. Calling this more than
     * once has no effect.
     */
    @Override
    public void close() {
        if(!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down");
        if(presenceMonitor != null) {
            presenceMonitor.close();
        }
        registry.close();
        if(ownsFetchExecutor) {
            shutdown(fetchExecutor, "fetch");
        }
        if(ownsSendExecutor) {
            shutdown(sendExecutor, "send");
        }
        if(ownsPlayerManager) {
            playerManager.ifInitialized(AudioPlayerManager::shutdown);
        }
        if(ownsVertx) {
            vertx.close();
        }
    }

    @Nonnull
    @CheckReturnValue
    private static ExecutorService createPool(@Nonnull String name, int threads) {
        var threadNumber = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            var thread = new Thread(r);
            thread.setDaemon(true);
            thread.setName("cadence-" + name + "-thread-" + threadNumber.incrementAndGet());
            return thread;
        });
    }
    
    private static void shutdown(@Nonnull ExecutorService pool, @Nonnull String name) {
        pool.shutdownNow();
        try {
            if(!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("{} pool didn't terminate in time", name);
            }
        } catch(InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

package cadence;

import cadence.send.PresenceQuery;
import cadence.send.VoiceTransport;
import cadence.source.AudioFetcher;
import cadence.source.SongLookupService;
import cadence.store.PlaylistStore;
import com.sedmelluq.discord.lavaplayer.player.AudioPlayerManager;
import com.typesafe.config.Config;
import io.vertx.core.Vertx;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import java.util.concurrent.ExecutorService;

/**
 * Wires a {@link Cadence} node. Only the voice transport is required; every other collaborator
 * falls back to a default built from the configuration.
 */
public class CadenceBuilder {
    Config config;
    Vertx vertx;
    VoiceTransport voiceTransport;
    PresenceQuery presenceQuery;
    AudioFetcher audioFetcher;
    SongLookupService songLookup;
    PlaylistStore playlistStore;
    AudioPlayerManager audioPlayerManager;
    ExecutorService fetchExecutor;
    ExecutorService sendExecutor;
    
    /**
     * Root config, containing a {@code cadence} block. Defaults to {@code application.conf} over
     * {@code reference.conf}.
     */
    public CadenceBuilder setConfig(Config config) {
        this.config = config;
        return this;
    }
    
    /**
     * Vertx instance used for timers. If not set, the node creates one and closes it on shutdown.
     */
    public CadenceBuilder setVertx(Vertx vertx) {
        this.vertx = vertx;
        return this;
    }
    
    public CadenceBuilder setVoiceTransport(VoiceTransport voiceTransport) {
        this.voiceTransport = voiceTransport;
        return this;
    }
    
    /**
     * Without a presence query, players are never stopped for being alone.
     */
    public CadenceBuilder setPresenceQuery(PresenceQuery presenceQuery) {
        this.presenceQuery = presenceQuery;
        return this;
    }
    
    public CadenceBuilder setAudioFetcher(AudioFetcher audioFetcher) {
        this.audioFetcher = audioFetcher;
        return this;
    }
    
    public CadenceBuilder setSongLookup(SongLookupService songLookup) {
        this.songLookup = songLookup;
        return this;
    }
    
    public CadenceBuilder setPlaylistStore(PlaylistStore playlistStore) {
        this.playlistStore = playlistStore;
        return this;
    }
    
    /**
     * Player manager used by the default lookup and fetcher, for registering extra sources.
     */
    public CadenceBuilder setAudioPlayerManager(AudioPlayerManager audioPlayerManager) {
        this.audioPlayerManager = audioPlayerManager;
        return this;
    }
    
    /**
     * Executor running fetches. If not set, the node creates a pool of {@code fetch.threads}
     * threads and shuts it down on close.
     */
    public CadenceBuilder setFetchExecutor(ExecutorService fetchExecutor) {
        this.fetchExecutor = fetchExecutor;
        return this;
    }
    
    /**
     * Executor writing frames to voice sessions. If not set, the node creates a pool of
     * {@code send.threads} threads and shuts it down on close.
     */
    public CadenceBuilder setSendExecutor(ExecutorService sendExecutor) {
        this.sendExecutor = sendExecutor;
        return this;
    }
    
    @Nonnull
    @CheckReturnValue
    public Cadence create() {
        if(voiceTransport == null) {
            throw new IllegalStateException("Voice transport not set");
        }
        return Cadence.create(this);
    }
}

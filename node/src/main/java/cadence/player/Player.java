package cadence.player;

import cadence.Cadence;
import cadence.NodeState;
import cadence.error.InvalidPositionException;
import cadence.error.PlayerClosedException;
import cadence.error.SourceException;
import cadence.error.TransportException;
import cadence.error.VoiceConnectException;
import cadence.send.VoiceSession;
import cadence.source.AudioSourcePipeline;
import cadence.source.AudioStream;
import cadence.source.Song;
import cadence.store.QueueEntryCodec;
import cadence.util.CadenceMetrics;
import cadence.util.CancellationToken;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Queue and playback state machine of one tenant.
 * <br>
 * Commands and async completions all run under this object's monitor. Every song gets its own
 * {@link CancellationToken}; completions carrying a token other than the current one are stale
 * and ignored, which is what keeps a skipped song from advancing the queue a second time.
 */
public class Player implements CadencePlayer {
    private static final Logger log = LoggerFactory.getLogger(Player.class);

    private final FrameLossTracker frameLossTracker = new FrameLossTracker();
    private final Cadence cadence;
    private final String tenantId;

    @GuardedBy("this")
    private final List<QueueEntry> queue = new ArrayList<>();
    @GuardedBy("this")
    private PlayerState state = PlayerState.IDLE;
    @GuardedBy("this")
    private QueueEntry current;
    @GuardedBy("this")
    private CancellationToken currentToken;
    @GuardedBy("this")
    private VoiceSession session;

    public Player(@Nonnull Cadence cadence, @Nonnull String tenantId) {
        this.cadence = cadence;
        this.tenantId = tenantId;
    }

    @Nonnull
    @CheckReturnValue
    @Override
    public NodeState node() {
        return cadence;
    }

    @Nonnull
    @CheckReturnValue
    @Override
    public String tenantId() {
        return tenantId;
    }

    @Nonnull
    @CheckReturnValue
    @Override
    public synchronized PlayerState state() {
        return state;
    }

    @Nullable
    @CheckReturnValue
    @Override
    public synchronized String voiceChannelId() {
        return session == null ? null : session.channelId();
    }

    @Nonnull
    @CheckReturnValue
    @Override
    public FrameLossCounter frameLossCounter() {
        return frameLossTracker;
    }

    @Override
    public synchronized void addSong(@Nonnull String textChannelId, @Nonnull String voiceChannelId, @Nonnull Song song) {
        CadenceMetrics.COMMANDS.labels("add").inc();
        ensureOpen();
        connect(voiceChannelId);
        queue.add(new QueueEntry(song, textChannelId, voiceChannelId));
        log.info("{}: queued {} at position {}", tenantId, song, queue.size());
        saveQueue();
        maybeStartNext();
    }

    @Override
    public synchronized void skipSong() {
        CadenceMetrics.COMMANDS.labels("skip").inc();
        if(current == null) {
            log.debug("{}: nothing to skip ({})", tenantId, state);
            return;
        }
        var entry = current;
        var token = currentToken;
        clearCurrent();
        token.cancel();
        log.info("{}: skipped {}", tenantId, entry.song());
        cadence.dispatcher().onSongFinished(this, entry, true);
        saveQueue();
        maybeStartNext();
    }

    @Override
    public synchronized void stop() {
        CadenceMetrics.COMMANDS.labels("stop").inc();
        if(state == PlayerState.CLOSED) {
            return;
        }
        var entry = current;
        var token = currentToken;
        clearCurrent();
        queue.clear();
        state = PlayerState.CLOSED;
        if(token != null) {
            token.cancel();
        }
        closeSession();
        saveQueue();
        log.info("{}: stopped", tenantId);
        if(entry != null) {
            cadence.dispatcher().onSongFinished(this, entry, true);
        }
    }

    @Nonnull
    @Override
    public synchronized Song removeSong(int position) {
        CadenceMetrics.COMMANDS.labels("remove").inc();
        ensureOpen();
        if(position < 1 || position > queue.size()) {
            throw new InvalidPositionException(position, queue.size());
        }
        var removed = queue.remove(position - 1);
        log.info("{}: removed {} from position {}", tenantId, removed.song(), position);
        saveQueue();
        return removed.song();
    }

    @Nonnull
    @CheckReturnValue
    @Override
    public synchronized List<Song> playlist() {
        return queue.stream().map(QueueEntry::song).collect(Collectors.toUnmodifiableList());
    }

    @Nullable
    @CheckReturnValue
    @Override
    public synchronized Song nowPlaying() {
        return current == null ? null : current.song();
    }

    /**
     * Queues a saved snapshot, joining the voice channel of its first entry. Does nothing unless
     * this player is idle with an empty queue.
     *
     * @param entries Saved queue.
     *
     * @return Whether the snapshot was queued.
     *
     * @throws VoiceConnectException If the voice channel can't be joined. Nothing is queued.
     */
    public synchronized boolean restore(@Nonnull List<QueueEntry> entries) {
        if(entries.isEmpty() || state != PlayerState.IDLE || !queue.isEmpty()) {
            return false;
        }
        connect(entries.get(0).voiceChannelId());
        queue.addAll(entries);
        log.info("{}: restored {} queued songs", tenantId, entries.size());
        maybeStartNext();
        return true;
    }

    @Nonnull
    @CheckReturnValue
    @Override
    public synchronized JsonObject encodeState() {
        var pending = new JsonArray();
        for(var entry : queue) {
            pending.add(QueueEntryCodec.encodeSong(entry.song()));
        }
        return new JsonObject()
                .put("time", String.valueOf(Instant.now().toEpochMilli()))
                .put("tenant", tenantId)
                .put("state", state.name().toLowerCase())
                .put("voiceChannel", session == null ? null : session.channelId())
                .put("current", current == null ? null : QueueEntryCodec.encodeSong(current.song()))
                .put("queue", pending)
                .put("frame", new JsonObject()
                        .put("loss", frameLossTracker.lastMinuteLoss().sum())
                        .put("success", frameLossTracker.lastMinuteSuccess().sum())
                        .put("usable", frameLossTracker.isDataUsable())
                );
    }

    @Override
    public String toString() {
        return "Player(" + tenantId + ")";
    }

    @GuardedBy("this")
    private void ensureOpen() {
        if(state == PlayerState.CLOSED) {
            throw new PlayerClosedException(tenantId);
        }
    }

    @GuardedBy("this")
    private void connect(@Nonnull String channelId) {
        if(session != null) {
            if(session.channelId().equals(channelId) || state != PlayerState.IDLE) {
                return;
            }
            log.info("{}: moving from voice channel {} to {}", tenantId, session.channelId(), channelId);
            closeSession();
        }
        try {
            session = cadence.voiceTransport().open(tenantId, channelId);
        } catch(VoiceConnectException e) {
            throw e;
        } catch(RuntimeException e) {
            throw new VoiceConnectException("Unable to join voice channel " + channelId + " of " + tenantId, e);
        }
        log.info("{}: joined voice channel {}", tenantId, channelId);
    }

    @GuardedBy("this")
    private void closeSession() {
        if(session == null) return;
        var s = session;
        session = null;
        try {
            s.close();
        } catch(RuntimeException e) {
            log.warn("{}: error closing voice session", tenantId, e);
        }
    }

    @GuardedBy("this")
    private void clearCurrent() {
        current = null;
        currentToken = null;
        if(state != PlayerState.CLOSED) {
            state = PlayerState.IDLE;
        }
    }

    @GuardedBy("this")
    private void maybeStartNext() {
        if(state != PlayerState.IDLE || queue.isEmpty()) {
            return;
        }
        var entry = queue.remove(0);
        var token = new CancellationToken();
        current = entry;
        currentToken = token;
        state = PlayerState.LOADING;
        log.debug("{}: loading {}", tenantId, entry.song());
        cadence.pipeline().resolve(entry.song(), token)
                .whenComplete((stream, error) -> onResolved(entry, token, stream, error));
    }

    private synchronized void onResolved(QueueEntry entry, CancellationToken token,
                                         AudioStream stream, Throwable error) {
        if(token != currentToken) {
            if(stream != null) {
                stream.close();
            }
            return;
        }
        if(error == null && session == null) {
            stream.close();
            error = new TransportException("No voice session open for " + tenantId);
        }
        if(error != null) {
            failed(entry, AudioSourcePipeline.unwrap(error));
            clearCurrent();
            saveQueue();
            maybeStartNext();
            return;
        }
        state = PlayerState.PLAYING;
        log.info("{}: playing {}", tenantId, entry.song());
        cadence.dispatcher().onSongStarted(this, entry);
        cadence.streamer().stream(stream, session, token, frameLossTracker)
                .whenComplete((result, streamError) -> onStreamEnded(entry, token, streamError));
    }

    private synchronized void onStreamEnded(QueueEntry entry, CancellationToken token, Throwable error) {
        if(token != currentToken) {
            return;
        }
        if(error != null) {
            failed(entry, AudioSourcePipeline.unwrap(error));
        } else {
            log.debug("{}: finished {}", tenantId, entry.song());
            cadence.dispatcher().onSongFinished(this, entry, false);
        }
        clearCurrent();
        saveQueue();
        maybeStartNext();
    }

    @GuardedBy("this")
    private void failed(QueueEntry entry, Throwable cause) {
        String reason;
        if(cause instanceof SourceException) {
            reason = ((SourceException) cause).kind();
        } else if(cause instanceof TransportException) {
            reason = "transport";
        } else {
            reason = "unknown";
        }
        CadenceMetrics.SONGS_FAILED.labels(reason).inc();
        log.warn("{}: unable to play {}, skipping", tenantId, entry.song(), cause);
        cadence.dispatcher().onSongFailed(this, entry, cause);
    }

    @GuardedBy("this")
    private void saveQueue() {
        var snapshot = new ArrayList<QueueEntry>(queue.size() + 1);
        if(current != null) {
            snapshot.add(current);
        }
        snapshot.addAll(queue);
        try {
            cadence.playlistStore().save(tenantId, snapshot);
        } catch(RuntimeException e) {
            log.error("{}: unable to save queue", tenantId, e);
        }
    }
}

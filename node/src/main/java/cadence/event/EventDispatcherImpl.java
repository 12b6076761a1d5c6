package cadence.event;

import cadence.NodeState;
import cadence.player.CadencePlayer;
import cadence.player.QueueEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

public class EventDispatcherImpl implements EventDispatcher {
    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);
    
    private final Set<CadenceEventListener> listeners = ConcurrentHashMap.newKeySet();
    private final NodeState state;
    
    public EventDispatcherImpl(@Nonnull NodeState state) {
        this.state = state;
    }
    
    @Override
    public void register(@Nonnull CadenceEventListener listener) {
        listeners.add(listener);
    }
    
    @Override
    public void unregister(@Nonnull CadenceEventListener listener) {
        listeners.remove(listener);
    }
    
    public void onPlayerCreated(@Nonnull String tenantId, @Nonnull CadencePlayer player) {
        forEach(l -> l.onPlayerCreated(state, tenantId, player));
    }
    
    public void onPlayerDestroyed(@Nonnull String tenantId, @Nonnull CadencePlayer player) {
        forEach(l -> l.onPlayerDestroyed(state, tenantId, player));
    }
    
    public void onSongStarted(@Nonnull CadencePlayer player, @Nonnull QueueEntry entry) {
        forEach(l -> l.onSongStarted(state, player, entry));
    }
    
    public void onSongFinished(@Nonnull CadencePlayer player, @Nonnull QueueEntry entry, boolean skipped) {
        forEach(l -> l.onSongFinished(state, player, entry, skipped));
    }
    
    public void onSongFailed(@Nonnull CadencePlayer player, @Nonnull QueueEntry entry, @Nonnull Throwable cause) {
        forEach(l -> l.onSongFailed(state, player, entry, cause));
    }
    
    private void forEach(Consumer<CadenceEventListener> action) {
        for(var v : listeners) {
            try {
                action.accept(v);
            } catch(Throwable t) {
                log.error("Error dispatching event to {}: ", v, t);
            }
        }
    }
}

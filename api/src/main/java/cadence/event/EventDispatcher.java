package cadence.event;

import javax.annotation.Nonnull;

public interface EventDispatcher {
    void register(@Nonnull CadenceEventListener listener);
    
    void unregister(@Nonnull CadenceEventListener listener);
}

package cadence.util;

import javax.annotation.Nonnull;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Supplier computing its value on the first {@link #get()}, then returning it forever.
 * Hand it to components that may never need the value, so it's never built for them.
 *
 * @param <T> Type of the value.
 */
public class LazyInit<T> implements Supplier<T> {
    private final Supplier<T> supplier;
    private volatile T value;
    
    public LazyInit(@Nonnull Supplier<T> supplier) {
        this.supplier = supplier;
    }
    
    @Nonnull
    @Override
    public T get() {
        var v = value;
        if(v != null) {
            return v;
        }
        synchronized(this) {
            if(value == null) {
                value = Objects.requireNonNull(supplier.get(), "supplier returned null");
            }
            return value;
        }
    }
    
    /**
     * Runs an action with the value, only if it was already computed.
     *
     * @param action Action to run.
     */
    public void ifInitialized(@Nonnull Consumer<? super T> action) {
        var v = value;
        if(v != null) {
            action.accept(v);
        }
    }
}

package cadence.cache;

import cadence.util.CadenceMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.LongSupplier;
import java.util.function.ToLongFunction;

/**
 * Bounded cache evicting the least recently used entries once the total weight of its
 * values goes over capacity. Entries can optionally expire if not accessed for a while.
 *
 * <br>Values are never modified in place, a {@link #put(Object, Object) put} replaces the
 * whole entry. All operations take the cache's own lock, which is never held while calling
 * outside code other than the weigher.
 *
 * @param <K> Key type.
 * @param <V> Value type.
 */
public class LruCache<K, V> {
    private static final Logger log = LoggerFactory.getLogger(LruCache.class);
    
    @GuardedBy("this")
    private final LinkedHashMap<K, Entry<V>> entries = new LinkedHashMap<>(16, 0.75f, true);
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder evictions = new LongAdder();
    private final String name;
    private final long capacity;
    private final ToLongFunction<? super V> weigher;
    private final long expireAfterAccessNanos;
    private final LongSupplier ticker;
    @GuardedBy("this")
    private long weight;
    
    /**
     * @param name              Name used in logs and metrics.
     * @param capacity          Maximum total weight.
     * @param weigher           Weight of a value. Must be constant for a given value.
     * @param expireAfterAccess How long entries live without being read, or null to never expire.
     */
    public LruCache(@Nonnull String name, @Nonnegative long capacity, @Nonnull ToLongFunction<? super V> weigher,
                    @Nullable Duration expireAfterAccess) {
        this(name, capacity, weigher, expireAfterAccess, System::nanoTime);
    }
    
    LruCache(@Nonnull String name, @Nonnegative long capacity, @Nonnull ToLongFunction<? super V> weigher,
             @Nullable Duration expireAfterAccess, @Nonnull LongSupplier ticker) {
        if(capacity < 0) {
            throw new IllegalArgumentException("Capacity < 0");
        }
        this.name = Objects.requireNonNull(name, "name");
        this.capacity = capacity;
        this.weigher = Objects.requireNonNull(weigher, "weigher");
        this.expireAfterAccessNanos = expireAfterAccess == null || expireAfterAccess.isZero() ?
                Long.MAX_VALUE : expireAfterAccess.toNanos();
        this.ticker = ticker;
    }
    
    /**
     * Creates a cache where every entry weighs 1, so the capacity is an entry count.
     *
     * @param name              Name used in logs and metrics.
     * @param maxEntries        Maximum number of entries.
     * @param expireAfterAccess How long entries live without being read, or null to never expire.
     * @param <K>               Key type.
     * @param <V>               Value type.
     *
     * @return A new cache.
     */
    @Nonnull
    @CheckReturnValue
    public static <K, V> LruCache<K, V> counting(@Nonnull String name, @Nonnegative long maxEntries,
                                                 @Nullable Duration expireAfterAccess) {
        return new LruCache<>(name, maxEntries, __ -> 1, expireAfterAccess);
    }
    
    @Nonnull
    @CheckReturnValue
    public String name() {
        return name;
    }
    
    public long capacity() {
        return capacity;
    }
    
    /**
     * Returns the cached value and marks it as most recently used. Counts a hit or a miss.
     *
     * @param key Key to look up.
     *
     * @return The value, or null if absent or expired.
     */
    @Nullable
    public V get(@Nonnull K key) {
        V value = null;
        synchronized(this) {
            var entry = entries.get(key);
            if(entry != null) {
                var now = ticker.getAsLong();
                if(isExpired(entry, now)) {
                    entries.remove(key);
                    weight -= entry.weight;
                    evicted();
                } else {
                    entry.lastAccess = now;
                    value = entry.value;
                }
            }
        }
        if(value == null) {
            misses.increment();
            CadenceMetrics.CACHE_REQUESTS.labels(name, "miss").inc();
        } else {
            hits.increment();
            CadenceMetrics.CACHE_REQUESTS.labels(name, "hit").inc();
        }
        return value;
    }
    
    /**
     * Stores a value, evicting least recently used entries until the total weight fits.
     *
     * <br>A value heavier than the whole capacity is not stored, and nothing is evicted for it.
     *
     * @param key   Key to store.
     * @param value Value to store.
     *
     * @return Whether the value was stored.
     */
    public boolean put(@Nonnull K key, @Nonnull V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        var w = weigher.applyAsLong(value);
        if(w < 0) {
            throw new IllegalArgumentException("Negative weight " + w + " for key " + key);
        }
        if(w > capacity) {
            log.debug("Not caching {} in {}: weight {} exceeds capacity {}", key, name, w, capacity);
            return false;
        }
        synchronized(this) {
            var now = ticker.getAsLong();
            var old = entries.put(key, new Entry<>(value, w, now));
            if(old != null) {
                weight -= old.weight;
            }
            weight += w;
            removeExpired(now);
            var it = entries.entrySet().iterator();
            while(weight > capacity && it.hasNext()) {
                var eldest = it.next();
                //the new entry is the most recently used, so it's always last
                it.remove();
                weight -= eldest.getValue().weight;
                evicted();
                log.debug("Evicted {} from {}", eldest.getKey(), name);
            }
        }
        return true;
    }
    
    public synchronized void invalidate(@Nonnull K key) {
        var old = entries.remove(key);
        if(old != null) {
            weight -= old.weight;
        }
    }
    
    public synchronized void clear() {
        entries.clear();
        weight = 0;
    }
    
    public synchronized int size() {
        return entries.size();
    }
    
    public synchronized long weight() {
        return weight;
    }
    
    @Nonnull
    @CheckReturnValue
    public CacheStats stats() {
        synchronized(this) {
            return new CacheStats(hits.sum(), misses.sum(), evictions.sum(), entries.size(), weight);
        }
    }
    
    @GuardedBy("this")
    private void removeExpired(long now) {
        if(expireAfterAccessNanos == Long.MAX_VALUE) return;
        var it = entries.values().iterator();
        while(it.hasNext()) {
            var e = it.next();
            //iteration is from least to most recently used, so the first live entry ends the sweep
            if(!isExpired(e, now)) break;
            it.remove();
            weight -= e.weight;
            evicted();
        }
    }
    
    private boolean isExpired(Entry<V> entry, long now) {
        return now - entry.lastAccess >= expireAfterAccessNanos;
    }
    
    private void evicted() {
        evictions.increment();
        CadenceMetrics.CACHE_EVICTIONS.labels(name).inc();
    }
    
    private static class Entry<V> {
        final V value;
        final long weight;
        long lastAccess;
        
        Entry(V value, long weight, long lastAccess) {
            this.value = value;
            this.weight = weight;
            this.lastAccess = lastAccess;
        }
    }
}

package cadence.cache;

/**
 * Point in time counters of a {@link LruCache}.
 */
public final class CacheStats {
    private final long hits;
    private final long misses;
    private final long evictions;
    private final int size;
    private final long weight;
    
    CacheStats(long hits, long misses, long evictions, int size, long weight) {
        this.hits = hits;
        this.misses = misses;
        this.evictions = evictions;
        this.size = size;
        this.weight = weight;
    }
    
    public long hits() {
        return hits;
    }
    
    public long misses() {
        return misses;
    }
    
    public long evictions() {
        return evictions;
    }
    
    public int size() {
        return size;
    }
    
    public long weight() {
        return weight;
    }
    
    public double hitRate() {
        var total = hits + misses;
        return total == 0 ? 0 : (double) hits / total;
    }
    
    @Override
    public String toString() {
        return "CacheStats(hits=" + hits + ", misses=" + misses + ", evictions=" + evictions +
                ", size=" + size + ", weight=" + weight + ")";
    }
}

package cadence.util;

import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;

/**
 * Prometheus collectors updated by the engine. Exposing them over HTTP is up to the embedding
 * application, they live in the default registry.
 */
public class CadenceMetrics {
    public static final Counter COMMANDS = Counter.build()
            .namespace("cadence")
            .name("commands")
            .help("Player commands received, by command")
            .labelNames("command")
            .register();
    
    public static final Counter CACHE_REQUESTS = Counter.build()
            .namespace("cadence")
            .name("cache_requests")
            .help("Cache lookups, by cache and result (hit or miss)")
            .labelNames("cache", "result")
            .register();
    
    public static final Counter CACHE_EVICTIONS = Counter.build()
            .namespace("cadence")
            .name("cache_evictions")
            .help("Entries evicted from a cache, by cache")
            .labelNames("cache")
            .register();
    
    public static final Counter SONGS_FAILED = Counter.build()
            .namespace("cadence")
            .name("songs_failed")
            .help("Songs that couldn't be played, by reason")
            .labelNames("reason")
            .register();
    
    public static final Gauge PLAYERS = Gauge.build()
            .namespace("cadence")
            .name("players")
            .help("Number of players alive at a given point")
            .register();
    
    private CadenceMetrics() {}
}

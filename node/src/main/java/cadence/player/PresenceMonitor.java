package cadence.player;

import cadence.send.PresenceQuery;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.time.Duration;

/**
 * Periodically stops players left alone in their voice channel. Checks run on vertx worker
 * threads, one at a time.
 */
public class PresenceMonitor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PresenceMonitor.class);
    
    private final PlayerRegistry registry;
    private final PresenceQuery query;
    private final Vertx vertx;
    private final long timerId;
    
    public PresenceMonitor(@Nonnull Vertx vertx, @Nonnull PlayerRegistry registry,
                           @Nonnull PresenceQuery query, @Nonnull Duration interval) {
        this.vertx = vertx;
        this.registry = registry;
        this.query = query;
        this.timerId = vertx.setPeriodic(Math.max(1, interval.toMillis()), __ -> scheduleCheck());
    }
    
    //queries may block and stopping a player saves its queue, so checks run on a worker thread
    private void scheduleCheck() {
        vertx.<Integer>executeBlocking(promise -> promise.complete(check()), true, result -> {
            if(result.failed()) {
                log.error("Presence check failed", result.cause());
            } else if(result.result() > 0) {
                log.debug("Presence check stopped {} players", result.result());
            }
        });
    }
    
    /**
     * Runs one pass over every player with an open voice session.
     *
     * @return How many players were stopped.
     */
    int check() {
        int stopped = 0;
        for(var player : registry.players()) {
            var channel = player.voiceChannelId();
            if(channel == null) continue;
            try {
                var occupancy = query.occupancy(player.tenantId(), channel);
                //the bot itself counts as one
                if(occupancy <= 1) {
                    log.info("{}: voice channel {} is empty, stopping", player.tenantId(), channel);
                    player.stop();
                    stopped++;
                }
            } catch(RuntimeException e) {
                log.warn("{}: unable to check presence in {}", player.tenantId(), channel, e);
            }
        }
        return stopped;
    }
    
    @Override
    public void close() {
        vertx.cancelTimer(timerId);
    }
}

package cadence.util;

import com.sun.management.GarbageCollectionNotificationInfo;
import io.prometheus.client.Collector;
import io.prometheus.client.Histogram;

import javax.management.Notification;
import javax.management.NotificationListener;
import javax.management.openmbean.CompositeData;

import static com.sun.management.GarbageCollectionNotificationInfo.GARBAGE_COLLECTION_NOTIFICATION;

/**
 * Records collector pauses. Long pauses show up as late frames in the streamer, this makes
 * them easy to correlate.
 */
class GCListener implements NotificationListener {
    private static final Histogram GC_PAUSES = Histogram.build()
            .namespace("cadence")
            .name("gc_pauses_seconds")
            .help("Garbage collection pauses by buckets")
            .labelNames("action", "cause", "name")
            .buckets(0.005, 0.010, 0.020, 0.040, 0.080, 0.160, 0.320, 0.640)
            .register();
    
    @Override
    public void handleNotification(Notification notification, Object handback) {
        if(!GARBAGE_COLLECTION_NOTIFICATION.equals(notification.getType())) {
            return;
        }
        var gc = GarbageCollectionNotificationInfo.from((CompositeData) notification.getUserData());
        var info = gc.getGcInfo();
        if(info == null || "No GC".equals(gc.getGcCause())) {
            return;
        }
        GC_PAUSES.labels(gc.getGcAction(), gc.getGcCause(), gc.getGcName())
                .observe(info.getDuration() / Collector.MILLISECONDS_PER_SECOND);
    }
}

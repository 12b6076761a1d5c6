package cadence.util;

import cadence.NodeState;
import cadence.event.CadenceEventListener;
import cadence.player.CadencePlayer;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import io.prometheus.client.hotspot.DefaultExports;
import io.prometheus.client.logback.InstrumentedAppender;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.management.NotificationEmitter;
import java.lang.management.ManagementFactory;

class PrometheusUtils {
    private static boolean initialized;
    
    static synchronized void setup() {
        if(initialized) return;
        initialized = true;
        var prometheusAppender = new InstrumentedAppender();
        
        var factory = (LoggerContext) LoggerFactory.getILoggerFactory();
        var root = factory.getLogger(Logger.ROOT_LOGGER_NAME);
        prometheusAppender.setContext(root.getLoggerContext());
        prometheusAppender.start();
        root.addAppender(prometheusAppender);
        
        DefaultExports.initialize();
        
        var listener = new GCListener();
        for(var gcBean : ManagementFactory.getGarbageCollectorMXBeans()) {
            if(gcBean instanceof NotificationEmitter) {
                ((NotificationEmitter) gcBean)
                        .addNotificationListener(listener, null, gcBean);
            }
        }
    }
    
    static void configureMetrics(@Nonnull NodeState state) {
        state.dispatcher().register(new CadenceEventListener() {
            @Override
            public void onPlayerCreated(@Nonnull NodeState state, @Nonnull String tenantId,
                                        @Nonnull CadencePlayer player) {
                CadenceMetrics.PLAYERS.inc();
            }
            
            @Override
            public void onPlayerDestroyed(@Nonnull NodeState state, @Nonnull String tenantId,
                                          @Nonnull CadencePlayer player) {
                CadenceMetrics.PLAYERS.dec();
            }
        });
    }
}

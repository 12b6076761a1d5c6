package cadence.util;

import cadence.NodeState;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.typesafe.config.Config;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;

public class Init {
    /**
     * Applies the process wide settings of the {@code cadence} config block.
     *
     * @param config The {@code cadence} config block.
     */
    public static void preInit(@Nonnull Config config) {
        ((Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME)).setLevel(
                Level.valueOf(config.getString("log-level").toUpperCase())
        );
        if(config.getBoolean("prometheus.enabled")) {
            PrometheusUtils.setup();
        }
        if(config.getBoolean("sentry.enabled")) {
            SentryUtils.setup(config);
        }
    }
    
    public static void postInit(@Nonnull NodeState state) {
        if(state.config().getBoolean("cadence.prometheus.enabled")) {
            PrometheusUtils.configureMetrics(state);
        }
        if(state.config().getBoolean("cadence.sentry.enabled")) {
            SentryUtils.configureWarns(state);
        }
    }
}

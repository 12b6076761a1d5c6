package cadence.util;

import cadence.NodeState;
import cadence.error.TransportException;
import cadence.event.CadenceEventListener;
import cadence.player.CadencePlayer;
import cadence.player.QueueEntry;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.filter.ThresholdFilter;
import com.typesafe.config.Config;
import io.sentry.Sentry;
import io.sentry.SentryClient;
import io.sentry.event.Event;
import io.sentry.event.EventBuilder;
import io.sentry.event.interfaces.ExceptionInterface;
import io.sentry.logback.SentryAppender;
import io.sentry.util.Util;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;

class SentryUtils {
    private static final String SENTRY_APPENDER_NAME = "SENTRY";
    private static SentryClient client;
    
    static synchronized void setup(@Nonnull Config config) {
        var client = Sentry.init(config.getString("sentry.dsn"));
        client.setRelease(Version.VERSION);
        var tags = config.getString("sentry.tags");
        if(!tags.isBlank()) {
            client.setTags(Util.parseTags(tags));
        }
        SentryUtils.client = client;
        var loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        var root = loggerContext.getLogger(Logger.ROOT_LOGGER_NAME);
        
        var sentryAppender = (SentryAppender) root.getAppender(SENTRY_APPENDER_NAME);
        if(sentryAppender == null) {
            sentryAppender = new SentryAppender();
            sentryAppender.setName(SENTRY_APPENDER_NAME);
            
            var warningsOrAboveFilter = new ThresholdFilter();
            warningsOrAboveFilter.setLevel(config.hasPath("sentry.log-level") ?
                    config.getString("sentry.log-level").toUpperCase() : Level.WARN.levelStr);
            warningsOrAboveFilter.start();
            sentryAppender.addFilter(warningsOrAboveFilter);
            
            sentryAppender.setContext(loggerContext);
            sentryAppender.start();
            root.addAppender(sentryAppender);
        }
    }
    
    static void configureWarns(@Nonnull NodeState state) {
        state.dispatcher().register(new CadenceEventListener() {
            @Override
            public void onSongFailed(@Nonnull NodeState state, @Nonnull CadencePlayer player,
                                     @Nonnull QueueEntry entry, @Nonnull Throwable cause) {
                if(!(cause instanceof TransportException) || client == null) {
                    return;
                }
                client.sendEvent(new EventBuilder()
                        .withLevel(Event.Level.WARNING)
                        .withMessage("Voice transport failed mid-song")
                        .withSentryInterface(new ExceptionInterface(cause))
                        .withExtra("tenant", player.tenantId())
                        .withExtra("voiceChannel", entry.voiceChannelId())
                        .withExtra("song", entry.song().url())
                );
            }
        });
    }
}

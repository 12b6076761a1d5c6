package cadence.player;

import cadence.Cadence;
import cadence.fake.Await;
import cadence.fake.CadenceFixtures;
import cadence.fake.FakeAudioFetcher;
import cadence.fake.FakePresenceQuery;
import cadence.fake.FakeVoiceTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static cadence.fake.CadenceFixtures.song;
import static org.assertj.core.api.Assertions.*;

class PresenceMonitorTest {
    private final FakeVoiceTransport transport = new FakeVoiceTransport();
    private final FakePresenceQuery presence = new FakePresenceQuery();
    private Cadence cadence;
    private PresenceMonitor monitor;
    
    @BeforeEach
    void setUp() {
        cadence = CadenceFixtures.builder()
                .setVoiceTransport(transport)
                .setAudioFetcher(new FakeAudioFetcher().defaultFrames(500))
                .create();
        monitor = new PresenceMonitor(cadence.vertx(), cadence.registry(), presence, Duration.ofHours(1));
    }
    
    @AfterEach
    void tearDown() {
        monitor.close();
        cadence.close();
    }
    
    @Test
    void stopsPlayersLeftAloneWithTheBot() {
        var alone = cadence.getPlayer("alone");
        var company = cadence.getPlayer("company");
        alone.addSong("text", "voice", song("a"));
        company.addSong("text", "voice", song("b"));
        presence.set("alone", 1).set("company", 3);
        
        assertThat(monitor.check()).isEqualTo(1);
        assertThat(alone.state()).isEqualTo(PlayerState.CLOSED);
        assertThat(company.state()).isNotEqualTo(PlayerState.CLOSED);
    }
    
    @Test
    void emptyChannelCountsAsAlone() {
        var player = cadence.getPlayer("guild");
        player.addSong("text", "voice", song("a"));
        presence.set("guild", 0);
        
        monitor.check();
        
        assertThat(player.state()).isEqualTo(PlayerState.CLOSED);
    }
    
    @Test
    void playersWithoutSessionAreSkipped() {
        var idle = cadence.getPlayer("idle");
        presence.set("idle", 1);
        
        assertThat(monitor.check()).isZero();
        assertThat(idle.state()).isEqualTo(PlayerState.IDLE);
    }
    
    @Test
    void oneFailingQueryDoesNotAffectOthers() {
        var broken = cadence.getPlayer("broken");
        var alone = cadence.getPlayer("alone");
        broken.addSong("text", "voice", song("a"));
        alone.addSong("text", "voice", song("b"));
        presence.failing("broken").set("alone", 1);
        
        assertThat(monitor.check()).isEqualTo(1);
        assertThat(broken.state()).isNotEqualTo(PlayerState.CLOSED);
        assertThat(alone.state()).isEqualTo(PlayerState.CLOSED);
    }
    
    @Test
    void periodicChecksRunOffTheEventLoop() {
        var player = cadence.getPlayer("guild");
        player.addSong("text", "voice", song("a"));
        presence.set("guild", 1);
        
        try(var periodic = new PresenceMonitor(cadence.vertx(), cadence.registry(), presence, Duration.ofMillis(20))) {
            Await.until(() -> player.state() == PlayerState.CLOSED);
        }
        assertThat(presence.threads).isNotEmpty()
                .noneMatch(name -> name.startsWith("vert.x-eventloop"));
    }
}

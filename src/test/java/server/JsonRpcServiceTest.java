package server;

import static org.junit.jupiter.api.Assertions.*;

import audio.FakeChannelEngine;
import content.Song;
import content.Track;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import playback.TransportState;
import playback.TransportStateMachine.Phase;
import queue.QueueController;
import queue.QueueMode;
import queue.QueueStatus;
import server.rpc.JsonRpcService;
import server.rpc.dto.AddSong;
import server.rpc.dto.MixChanged;
import server.rpc.dto.Pong;
import server.rpc.dto.QueueModes;
import server.rpc.dto.SeekTo;
import server.rpc.dto.SessionRef;
import server.rpc.dto.SetVolume;
import server.rpc.dto.SongRef;
import server.rpc.dto.StartQueue;
import server.rpc.dto.TrackRef;
import session.SessionState;
import session.SessionSummary;

@Slf4j
@SpringBootTest(classes = {StemdeckApplication.class, JsonRpcServiceTest.StubsConfig.class})
class JsonRpcServiceTest {

    private static final long TIMEOUT = 2;

    @Autowired private JsonRpcService service;
    @Autowired private FakeChannelEngine engine;

    private final Song song =
            new Song(
                    "rpc-song",
                    "Rehearsal",
                    "Band",
                    List.of(
                            new Track("vox", "Vocals", "rpc/vox.wav"),
                            new Track("gtr", "Guitar", "rpc/gtr.wav")));

    @BeforeEach
    void setUp() throws Exception {
        service.addSong(new AddSong(song)).get(TIMEOUT, TimeUnit.SECONDS);
    }

    @AfterEach
    void tearDown() throws Exception {
        service.leaveSession().get(TIMEOUT, TimeUnit.SECONDS);
        service.exitQueue().get(TIMEOUT, TimeUnit.SECONDS);
        service.unload().get(TIMEOUT, TimeUnit.SECONDS);
    }

    @Test
    void testPingReturnsDeviceId() throws Exception {
        Pong pong = service.ping().get(TIMEOUT, TimeUnit.SECONDS);
        assertEquals(new Pong("test-device"), pong);
    }

    @Test
    void testLoadPlayAndSeek() throws Exception {
        TransportState loaded =
                service.load(new SongRef("rpc-song")).get(TIMEOUT, TimeUnit.SECONDS);

        assertEquals(Phase.READY, loaded.phase());
        assertEquals(2, loaded.loadedTrackIds().size());

        service.play().get(TIMEOUT, TimeUnit.SECONDS);
        service.seek(new SeekTo(4.5)).get(TIMEOUT, TimeUnit.SECONDS);

        TransportState state = service.transportState().get(TIMEOUT, TimeUnit.SECONDS);
        assertEquals(Phase.PLAYING, state.phase());
        assertTrue(engine.channel("rpc/vox.wav").isPlaying());
        assertEquals(4.5, engine.channel("rpc/gtr.wav").getPosition());
    }

    @Test
    void testLoadUnknownSongFails() {
        var error =
                assertThrows(
                        ExecutionException.class,
                        () -> service.load(new SongRef("nope")).get(TIMEOUT, TimeUnit.SECONDS));
        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }

    @Test
    void testMixerRequestsUpdateChannelsAndState() throws Exception {
        service.load(new SongRef("rpc-song")).get(TIMEOUT, TimeUnit.SECONDS);

        service.setVolume(new SetVolume("vox", 0.25f)).get(TIMEOUT, TimeUnit.SECONDS);
        service.toggleSolo(new TrackRef("vox")).get(TIMEOUT, TimeUnit.SECONDS);

        MixChanged mix = service.mixState().get(TIMEOUT, TimeUnit.SECONDS);
        assertEquals("rpc-song", mix.songId());
        assertEquals(0.25f, mix.mix().get("vox").volume());
        assertEquals(0.0f, mix.effectiveGains().get("gtr"));
        assertEquals(0.25f, engine.channel("rpc/vox.wav").getGain());

        service.toggleSolo(new TrackRef("vox")).get(TIMEOUT, TimeUnit.SECONDS);
    }

    @Test
    void testInvalidVolumeIsRejected() throws Exception {
        service.load(new SongRef("rpc-song")).get(TIMEOUT, TimeUnit.SECONDS);

        var error =
                assertThrows(
                        ExecutionException.class,
                        () ->
                                service.setVolume(new SetVolume("vox", 2f))
                                        .get(TIMEOUT, TimeUnit.SECONDS));
        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }

    @Test
    void testQueueRequests() throws Exception {
        QueueStatus status =
                service.startQueue(new StartQueue(List.of("rpc-song"), QueueMode.PLAYLIST, 0))
                        .get(TIMEOUT, TimeUnit.SECONDS);

        assertEquals(QueueController.State.PLAYING, status.state());
        assertEquals(List.of("rpc-song"), status.songIds());

        QueueStatus modes =
                service.setModes(new QueueModes(null, true, null)).get(TIMEOUT, TimeUnit.SECONDS);
        assertTrue(modes.repeatQueue());
        assertFalse(modes.repeatSingle());
    }

    @Test
    void testSessionRequests() throws Exception {
        service.load(new SongRef("rpc-song")).get(TIMEOUT, TimeUnit.SECONDS);

        SessionState session = service.createSession().get(TIMEOUT, TimeUnit.SECONDS);
        assertEquals("test-device", session.adminDeviceId());

        List<SessionSummary> sessions = service.listSessions().get(TIMEOUT, TimeUnit.SECONDS);
        assertTrue(
                sessions.stream().anyMatch(s -> s.sessionId().equals(session.sessionId())));

        service.leaveSession().get(TIMEOUT, TimeUnit.SECONDS);
        assertTrue(
                service.listSessions().get(TIMEOUT, TimeUnit.SECONDS).stream()
                        .noneMatch(s -> s.sessionId().equals(session.sessionId())));

        var error =
                assertThrows(
                        ExecutionException.class,
                        () ->
                                service.joinSession(new SessionRef(session.sessionId()))
                                        .get(TIMEOUT, TimeUnit.SECONDS));
        assertTrue(error.getCause().getMessage().contains("No such session"));
    }

    @TestConfiguration
    static class StubsConfig {
        @Bean(destroyMethod = "close")
        @Primary
        FakeChannelEngine fakeChannelEngine() {
            return new FakeChannelEngine();
        }
    }
}

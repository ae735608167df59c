package mixer;

import static org.junit.jupiter.api.Assertions.*;

import audio.FakeChannelEngine;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import content.Song;
import content.Track;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import playback.PlaybackTransport;
import store.DocumentStore;
import store.InMemoryDocumentStore;
import timing.ManualScheduler;
import trackstate.TrackStateStore;

@Slf4j
class TrackMixerTest {

    private static final String USER = "user-1";

    private final Song song =
            new Song(
                    "song-1",
                    "Song",
                    "Band",
                    List.of(
                            new Track("A", "Vocals", "song-1/a.wav"),
                            new Track("B", "Bass", "song-1/b.wav"),
                            new Track("C", "Drums", "song-1/c.wav")));

    private final ObjectMapper mapper = new ObjectMapper();
    private FakeChannelEngine engine;
    private ManualScheduler scheduler;
    private DocumentStore documents;
    private PlaybackTransport transport;
    private TrackMixer mixer;
    private List<Map<String, TrackMixState>> mixEvents;

    @BeforeEach
    void setUp() {
        setUp(new InMemoryDocumentStore(Runnable::run));
    }

    private void setUp(DocumentStore store) {
        engine = new FakeChannelEngine();
        scheduler = new ManualScheduler();
        documents = store;
        transport = new PlaybackTransport(engine, Runnable::run, scheduler, 50);
        mixer =
                new TrackMixer(
                        transport,
                        new TrackStateStore(documents, mapper, USER),
                        Runnable::run,
                        scheduler,
                        300);
        mixEvents = new ArrayList<>();
        mixer.addListener((songId, mix) -> mixEvents.add(mix));
    }

    @AfterEach
    void tearDown() {
        mixer.close();
        transport.close();
    }

    private void load(Song target) {
        transport.load(target).join();
    }

    private float gain(String ref) {
        return engine.channel(ref).getGain();
    }

    private JsonNode stored(String songId, String trackId) {
        return documents
                .read("users/" + USER + "/trackStates/" + songId + "/" + trackId)
                .join()
                .orElseThrow();
    }

    @Test
    void testNoSongMeansEmptyMix() {
        assertTrue(mixer.getMix().isEmpty());
        mixer.toggleMute("A");
        assertTrue(mixEvents.isEmpty());
    }

    @Test
    void testLoadPersistsDefaults() {
        load(song);

        assertEquals(TrackMixState.defaults(), mixer.getMix().get("B"));
        assertEquals(1.0, stored("song-1", "C").get("volume").asDouble());
        assertFalse(stored("song-1", "C").get("mute").asBoolean());
    }

    @Test
    void testSetVolumeOnlyTouchesThatChannel() {
        load(song);
        engine.clearOperations();

        mixer.setVolume("A", 0.42f);

        assertEquals(1, engine.count("setGain"));
        assertEquals(0.42f, gain("song-1/a.wav"));
        assertEquals(0.42f, mixer.getMix().get("A").volume());
        assertEquals(0.42, stored("song-1", "A").get("volume").asDouble(), 1e-6);
        assertEquals(1, mixEvents.size());
    }

    @Test
    void testSetVolumeRejectsOutOfRange() {
        load(song);
        assertThrows(IllegalArgumentException.class, () -> mixer.setVolume("A", 1.5f));
        assertThrows(IllegalArgumentException.class, () -> mixer.setVolume("A", -0.1f));
        assertEquals(1.0f, mixer.getMix().get("A").volume());
    }

    @Test
    void testUnknownTrackIsIgnored() {
        load(song);
        engine.clearOperations();

        mixer.setVolume("Z", 0.5f);

        assertEquals(0, engine.count("setGain"));
        assertFalse(mixer.getMix().containsKey("Z"));
    }

    @Test
    void testMuteRecomputesEveryChannel() {
        load(song);
        engine.clearOperations();

        mixer.toggleMute("A");

        assertEquals(3, engine.count("setGain"));
        assertEquals(0.0f, gain("song-1/a.wav"));
        assertEquals(1.0f, gain("song-1/b.wav"));
        assertTrue(stored("song-1", "A").get("mute").asBoolean());
    }

    @Test
    void testSoloSilencesOthers() {
        load(song);
        mixer.toggleSolo("B");

        assertEquals(Map.of("A", 0.0f, "B", 1.0f, "C", 0.0f), mixer.getEffectiveGains());
        assertEquals(0.0f, gain("song-1/a.wav"));
        assertEquals(1.0f, gain("song-1/b.wav"));

        mixer.toggleSolo("B");
        assertEquals(1.0f, gain("song-1/a.wav"));
    }

    @Test
    @DisplayName("Solo vocals at 0.8 with muted bass and default drums")
    void testSoloMuteScenario() {
        load(song);
        mixer.setVolume("A", 0.8f);
        mixer.toggleSolo("A");
        mixer.toggleMute("B");

        assertEquals(Map.of("A", 0.8f, "B", 0.0f, "C", 0.0f), mixer.getEffectiveGains());
        assertEquals(0.0f, gain("song-1/c.wav"));

        mixer.toggleSolo("A");
        assertEquals(Map.of("A", 0.8f, "B", 0.0f, "C", 1.0f), mixer.getEffectiveGains());
        assertEquals(1.0f, gain("song-1/c.wav"));
    }

    @Test
    void testSingleClickTogglesSolo() {
        load(song);
        mixer.classifyClick("C");
        assertFalse(mixer.getMix().get("C").solo());

        scheduler.advance(300);

        assertTrue(mixer.getMix().get("C").solo());
        assertFalse(mixer.getMix().get("C").mute());
    }

    @Test
    void testDoubleClickTogglesMuteOnly() {
        load(song);
        mixer.classifyClick("C");
        scheduler.advance(120);
        mixer.classifyClick("C");
        scheduler.advance(1000);

        assertTrue(mixer.getMix().get("C").mute());
        assertFalse(mixer.getMix().get("C").solo());
    }

    @Test
    void testPendingClickIsDroppedOnSongSwitch() {
        load(song);
        mixer.classifyClick("A");
        load(
                new Song(
                        "song-2",
                        "Other",
                        "Band",
                        List.of(new Track("A", "Vocals", "song-2/a.wav"))));
        scheduler.advance(1000);

        assertFalse(mixer.getMix().get("A").solo());
    }

    @Test
    void testUnmuteWhilePlayingStartsChannel() {
        load(song);
        mixer.toggleMute("B");
        transport.play();
        assertFalse(engine.channel("song-1/b.wav").isPlaying());

        mixer.toggleMute("B");

        assertTrue(engine.channel("song-1/b.wav").isPlaying());
        assertEquals(1.0f, gain("song-1/b.wav"));
    }

    @Test
    void testStoredMixIsRestoredOnReload() {
        load(song);
        mixer.setVolume("A", 0.42f);
        mixer.toggleMute("A");
        transport.unload();

        load(song);

        assertEquals(new TrackMixState(0.42f, true, false), mixer.getMix().get("A"));
        assertEquals(0.0f, gain("song-1/a.wav"));
    }

    @Test
    void testRemoteChangeIsApplied() {
        load(song);
        mixEvents.clear();

        documents.write(
                "users/" + USER + "/trackStates/song-1/C",
                mapper.valueToTree(new TrackMixState(0.3f, false, false)));

        assertEquals(0.3f, mixer.getMix().get("C").volume());
        assertEquals(0.3f, gain("song-1/c.wav"));
        assertEquals(1, mixEvents.size());
    }

    @Test
    void testLocalChangeIsNotEchoedBack() {
        load(song);
        mixEvents.clear();

        mixer.toggleSolo("A");

        assertEquals(1, mixEvents.size());
    }

    @Test
    void testRemoteChangeForPreviousSongIsIgnored() {
        load(song);
        load(
                new Song(
                        "song-2",
                        "Other",
                        "Band",
                        List.of(new Track("A", "Vocals", "song-2/a.wav"))));
        mixEvents.clear();

        documents.write(
                "users/" + USER + "/trackStates/song-1/A",
                mapper.valueToTree(new TrackMixState(0.1f, false, false)));

        assertTrue(mixEvents.isEmpty());
        assertEquals(1.0f, mixer.getMix().get("A").volume());
    }

    @Test
    void testPersistenceFailureKeepsLocalMix() {
        mixer.close();
        transport.close();
        setUp(
                new InMemoryDocumentStore(Runnable::run) {
                    @Override
                    public CompletableFuture<Void> write(
                            @NonNull String path, @NonNull JsonNode value) {
                        return CompletableFuture.failedFuture(
                                new IllegalStateException("store offline"));
                    }
                });
        load(song);

        mixer.setVolume("B", 0.5f);

        assertEquals(0.5f, mixer.getMix().get("B").volume());
        assertEquals(0.5f, gain("song-1/b.wav"));
    }
}

package trackstate;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import content.Song;
import content.Track;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import lombok.NonNull;
import mixer.TrackMixState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import store.InMemoryDocumentStore;
import store.Subscription;

class TrackStateStoreTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final Song song =
            new Song(
                    "song-1",
                    "Song",
                    "Band",
                    List.of(
                            new Track("vox", "Vocals", "vox.wav"),
                            new Track("bass", "Bass", "bass.wav")));

    private InMemoryDocumentStore documents;
    private TrackStateStore store;

    @BeforeEach
    void setUp() {
        documents = new InMemoryDocumentStore(Runnable::run);
        store = new TrackStateStore(documents, mapper, "alice");
    }

    @Test
    void testSaveThenLoadRoundTrips() {
        var state = new TrackMixState(0.42f, true, false);
        store.save("song-1", "vox", state).join();

        Map<String, TrackMixState> loaded = store.load(song).join();

        assertEquals(state, loaded.get("vox"));
        assertEquals(TrackMixState.defaults(), loaded.get("bass"));
        assertEquals(List.of("vox", "bass"), new ArrayList<>(loaded.keySet()));
    }

    @Test
    void testLoadPersistsDefaultsForMissingTracks() {
        store.load(song).join();

        JsonNode bass =
                documents.read("users/alice/trackStates/song-1/bass").join().orElseThrow();
        assertEquals(1.0, bass.get("volume").asDouble());
        assertFalse(bass.get("solo").asBoolean());
    }

    @Test
    void testMalformedEntryFallsBackToDefault() {
        documents.write("users/alice/trackStates/song-1/vox", TextNode.valueOf("garbage")).join();
        var tooLoud = mapper.createObjectNode().put("volume", 3.0).put("mute", false);
        documents.write("users/alice/trackStates/song-1/bass", tooLoud).join();

        Map<String, TrackMixState> loaded = store.load(song).join();

        assertEquals(TrackMixState.defaults(), loaded.get("vox"));
        assertEquals(TrackMixState.defaults(), loaded.get("bass"));
    }

    @Test
    void testUnknownFieldsAreIgnored() {
        var node =
                mapper.createObjectNode()
                        .put("volume", 0.5)
                        .put("mute", false)
                        .put("solo", true)
                        .put("color", "red");
        documents.write("users/alice/trackStates/song-1/vox", node).join();

        assertEquals(new TrackMixState(0.5f, false, true), store.load(song).join().get("vox"));
    }

    @Test
    void testSubscribeDeliversCurrentThenChanges() {
        store.save("song-1", "vox", new TrackMixState(0.5f, false, false)).join();
        var deliveries = new ArrayList<Map<String, TrackMixState>>();

        Subscription subscription = store.subscribe("song-1", deliveries::add);
        store.save("song-1", "bass", new TrackMixState(0.2f, false, true)).join();

        assertEquals(2, deliveries.size());
        assertEquals(0.5f, deliveries.get(0).get("vox").volume());
        assertEquals(new TrackMixState(0.2f, false, true), deliveries.get(1).get("bass"));

        subscription.unsubscribe();
        store.save("song-1", "bass", TrackMixState.defaults()).join();
        assertEquals(2, deliveries.size());
    }

    @Test
    void testUsersAreIsolated() {
        store.save("song-1", "vox", new TrackMixState(0.1f, false, false)).join();
        store.switchUser("bob");

        assertEquals("bob", store.getUserId());
        assertTrue(store.isOwner("bob"));
        assertFalse(store.isOwner("alice"));
        assertEquals(TrackMixState.defaults(), store.load(song).join().get("vox"));
        assertTrue(documents.read("users/alice/trackStates/song-1/vox").join().isPresent());
    }

    @Test
    void testSwitchUserCancelsSubscriptions() {
        var deliveries = new ArrayList<Map<String, TrackMixState>>();
        store.subscribe("song-1", deliveries::add);
        store.switchUser("bob");

        documents
                .write(
                        "users/alice/trackStates/song-1/vox",
                        mapper.valueToTree(new TrackMixState(0.3f, false, false)))
                .join();

        assertEquals(1, deliveries.size());
    }

    @Test
    void testLoadAllGroupsBySong() {
        store.save("song-1", "vox", new TrackMixState(0.4f, false, false)).join();
        store.save("song-2", "keys", new TrackMixState(0.6f, true, false)).join();

        Map<String, Map<String, TrackMixState>> all = store.loadAll().join();

        assertEquals(2, all.size());
        assertEquals(0.4f, all.get("song-1").get("vox").volume());
        assertTrue(all.get("song-2").get("keys").mute());
    }

    @Test
    void testLoadAllWithoutDataIsEmpty() {
        assertTrue(store.loadAll().join().isEmpty());
    }

    @Test
    void testWriteFailureSurfacesAsPersistenceException() {
        var broken =
                new InMemoryDocumentStore(Runnable::run) {
                    @Override
                    public CompletableFuture<Void> write(
                            @NonNull String path, @NonNull JsonNode value) {
                        return CompletableFuture.failedFuture(new IllegalStateException("down"));
                    }
                };
        var failing = new TrackStateStore(broken, mapper, "alice");

        var loadError = assertThrows(CompletionException.class, () -> failing.load(song).join());
        assertInstanceOf(PersistenceException.class, loadError.getCause());

        var saveError =
                assertThrows(
                        CompletionException.class,
                        () -> failing.save("song-1", "vox", TrackMixState.defaults()).join());
        assertInstanceOf(PersistenceException.class, saveError.getCause());
    }
}

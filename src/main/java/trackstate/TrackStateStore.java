package trackstate;

import audio.ChannelFanOut;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import content.Song;
import content.Track;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import mixer.TrackMixState;
import store.DocumentPaths;
import store.DocumentStore;
import store.Subscription;

/**
 * Per-user mix preferences, one document per track under {@code
 * users/{userId}/trackStates/{songId}/{trackId}}.
 *
 * <p>Only the current user's subtree is ever written, so this device is the single writer of
 * everything it saves. Reads never fail for missing data: a track without a stored state gets
 * {@link TrackMixState#defaults()}, which is persisted on first load.
 */
@Slf4j
public class TrackStateStore implements AutoCloseable {

    private final DocumentStore documents;
    private final ObjectMapper mapper;
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private volatile String userId;

    public TrackStateStore(
            @NonNull DocumentStore documents,
            @NonNull ObjectMapper mapper,
            @NonNull String userId) {
        this.documents = documents;
        this.mapper = mapper;
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }

    /** True if {@code candidate} owns the preferences this store writes. */
    public boolean isOwner(String candidate) {
        return userId.equals(candidate);
    }

    /**
     * States for every track of {@code song}, in track order. Tracks without a stored state are
     * defaulted and the defaults written back before the future completes.
     *
     * @throws PersistenceException through the returned future if the read or the write fails
     */
    public CompletableFuture<Map<String, TrackMixState>> load(@NonNull Song song) {
        String user = userId;
        return documents
                .read(songPath(user, song.id()))
                .thenCompose(stored -> fillDefaults(user, song, parseSong(stored)))
                .exceptionally(
                        error -> {
                            Throwable cause = ChannelFanOut.rootCause(error);
                            log.error("Failed to load mix for song {}", song.id(), cause);
                            if (cause instanceof PersistenceException) {
                                throw (PersistenceException) cause;
                            }
                            throw new PersistenceException(
                                    "Failed to load mix for song " + song.id(), cause);
                        });
    }

    private CompletableFuture<Map<String, TrackMixState>> fillDefaults(
            String user, Song song, Map<String, TrackMixState> stored) {
        var result = new LinkedHashMap<String, TrackMixState>();
        var writes = new ArrayList<CompletableFuture<Void>>();
        for (Track track : song.tracks()) {
            TrackMixState state = stored.get(track.id());
            if (state == null) {
                state = TrackMixState.defaults();
                writes.add(write(user, song.id(), track.id(), state));
            }
            result.put(track.id(), state);
        }
        if (!writes.isEmpty()) {
            log.debug("Initialized {} default track states for song {}", writes.size(), song.id());
        }
        return CompletableFuture.allOf(writes.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> result);
    }

    /** Write-through save of one track's state. */
    public CompletableFuture<Void> save(
            @NonNull String songId, @NonNull String trackId, @NonNull TrackMixState state) {
        return write(userId, songId, trackId, state)
                .exceptionally(
                        error -> {
                            throw new PersistenceException(
                                    "Failed to save state of track " + trackId,
                                    ChannelFanOut.rootCause(error));
                        });
    }

    /**
     * Pushes the full per-song map whenever any track of the song changes, including changes made
     * by this user on another device. The first delivery is the current content.
     */
    public Subscription subscribe(
            @NonNull String songId, @NonNull Consumer<Map<String, TrackMixState>> callback) {
        Subscription inner =
                documents.subscribe(
                        songPath(userId, songId), value -> callback.accept(parseSong(value)));
        var subscription =
                new Subscription() {
                    @Override
                    public void unsubscribe() {
                        inner.unsubscribe();
                        subscriptions.remove(this);
                    }
                };
        subscriptions.add(subscription);
        return subscription;
    }

    /** Every stored song of the current user, keyed by song id. */
    public CompletableFuture<Map<String, Map<String, TrackMixState>>> loadAll() {
        return documents
                .read(DocumentPaths.join("users", userId, "trackStates"))
                .thenApply(
                        stored -> {
                            var songs = new LinkedHashMap<String, Map<String, TrackMixState>>();
                            if (stored.isPresent()) {
                                Iterator<Map.Entry<String, JsonNode>> entries =
                                        stored.get().fields();
                                while (entries.hasNext()) {
                                    Map.Entry<String, JsonNode> entry = entries.next();
                                    songs.put(
                                            entry.getKey(),
                                            parseSong(Optional.of(entry.getValue())));
                                }
                            }
                            return songs;
                        });
    }

    /** Switch to another user; live subscriptions belong to the previous user and are dropped. */
    public void switchUser(@NonNull String newUserId) {
        if (userId.equals(newUserId)) {
            return;
        }
        log.info("Switching track state user from {} to {}", userId, newUserId);
        cancelSubscriptions();
        userId = newUserId;
    }

    @Override
    public void close() {
        cancelSubscriptions();
    }

    private void cancelSubscriptions() {
        for (Subscription subscription : List.copyOf(subscriptions)) {
            subscription.unsubscribe();
        }
    }

    private CompletableFuture<Void> write(
            String user, String songId, String trackId, TrackMixState state) {
        return documents.write(
                DocumentPaths.join(songPath(user, songId), trackId), mapper.valueToTree(state));
    }

    private Map<String, TrackMixState> parseSong(Optional<JsonNode> stored) {
        var states = new LinkedHashMap<String, TrackMixState>();
        if (stored.isEmpty() || !stored.get().isObject()) {
            return states;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = stored.get().fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            try {
                states.put(
                        entry.getKey(), mapper.treeToValue(entry.getValue(), TrackMixState.class));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn(
                        "Ignoring malformed state for track {}: {}",
                        entry.getKey(),
                        e.getMessage());
            }
        }
        return states;
    }

    private static String songPath(String user, String songId) {
        return DocumentPaths.join("users", user, "trackStates", songId);
    }
}

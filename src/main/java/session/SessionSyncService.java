package session;

import audio.ChannelFanOut;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import mixer.TrackMixer;
import playback.PlaybackContext;
import playback.PlaybackTransport;
import playback.TransportCommand;
import playback.TransportListener;
import playback.TransportState;
import store.DocumentPaths;
import store.DocumentStore;
import store.Subscription;
import timing.Scheduler;

/**
 * Shares the transport of one admin device with any number of followers through a session
 * document at {@code sessions/{sessionId}}.
 *
 * <p>The admin is the only writer: after every applied transport command it overwrites the
 * session's snapshot, last writer wins. Followers never write. They reconcile their own transport
 * towards each snapshot they receive, at most once per debounce window, and only where the local
 * state diverges: play state, playback speed, and position beyond the seek tolerance. Snapshots
 * for a song other than the locally loaded one are skipped.
 *
 * <p>Must be used from the control thread; store callbacks are marshalled onto it.
 */
@Slf4j
public class SessionSyncService implements TransportListener, AutoCloseable {

    public enum Role {
        NONE,
        ADMIN,
        FOLLOWER
    }

    private static final String SESSIONS = "sessions";
    private static final String SNAPSHOT_FIELD = "transportSnapshot";
    private static final float SPEED_EPSILON = 1e-3f;

    private final DocumentStore documents;
    private final ObjectMapper mapper;
    private final PlaybackTransport transport;
    private final TrackMixer mixer;
    private final Executor control;
    private final Scheduler scheduler;
    private final String deviceId;
    private final SyncSettings settings;
    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();

    private Role role = Role.NONE;
    private String sessionId;
    private Subscription subscription = Subscription.NONE;

    // Follower debounce
    private long lastAppliedAt;
    private boolean appliedAny;
    private TransportSnapshot pending;
    private Scheduler.Cancellable pendingTimer;
    private long pendingGeneration;
    // Newest snapshot seen, reapplied when a local song finishes loading
    private TransportSnapshot latest;

    public SessionSyncService(
            @NonNull DocumentStore documents,
            @NonNull ObjectMapper mapper,
            @NonNull PlaybackTransport transport,
            @NonNull TrackMixer mixer,
            @NonNull Executor control,
            @NonNull Scheduler scheduler,
            @NonNull String deviceId,
            @NonNull SyncSettings settings) {
        this.documents = documents;
        this.mapper = mapper;
        this.transport = transport;
        this.mixer = mixer;
        this.control = control;
        this.scheduler = scheduler;
        this.deviceId = deviceId;
        this.settings = settings;
        transport.addListener(this);
    }

    public void addListener(@NonNull SessionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(@NonNull SessionListener listener) {
        listeners.remove(listener);
    }

    public Role getRole() {
        return role;
    }

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }

    public Optional<String> getSessionId() {
        return Optional.ofNullable(sessionId);
    }

    public String getDeviceId() {
        return deviceId;
    }

    // Admin

    /** Start a session with this device as admin. The initial snapshot has nothing playing. */
    public CompletableFuture<SessionState> createSession() {
        if (role != Role.NONE) {
            return fail(new SessionException("Already in session " + sessionId));
        }
        TransportState local = transport.getState();
        var session =
                new SessionState(
                        UUID.randomUUID().toString(),
                        deviceId,
                        scheduler.currentTimeMillis(),
                        TransportSnapshot.stopped(local.songId(), local.playbackSpeed()));
        return documents
                .write(sessionPath(session.sessionId()), mapper.valueToTree(session))
                .handleAsync(
                        (ignored, error) -> {
                            if (error != null) {
                                throw report(
                                        new SessionException(
                                                "Could not create session",
                                                ChannelFanOut.rootCause(error)));
                            }
                            role = Role.ADMIN;
                            sessionId = session.sessionId();
                            log.info("Created session {} as admin", sessionId);
                            notify(l -> l.onSessionStarted(session, true));
                            return session;
                        },
                        control);
    }

    @Override
    public void onCommandApplied(TransportCommand command, TransportState state) {
        publish(state);
    }

    @Override
    public void onContextReady(PlaybackContext context) {
        if (role == Role.FOLLOWER) {
            if (latest != null) {
                log.debug("Catching up with session {} after loading {}", sessionId, context);
                receive(latest);
            }
            return;
        }
        publish(transport.getState());
    }

    private void publish(TransportState state) {
        if (role != Role.ADMIN) {
            return;
        }
        TransportSnapshot snapshot = TransportSnapshot.of(state, mixer.getMix());
        String path = DocumentPaths.join(sessionPath(sessionId), SNAPSHOT_FIELD);
        documents
                .write(path, mapper.valueToTree(snapshot))
                .whenComplete(
                        (ignored, error) -> {
                            if (error != null) {
                                log.warn("Could not publish snapshot to {}", path, error);
                            }
                        });
        log.trace("Published {}", snapshot);
    }

    // Follower

    /** Follow an existing session. Fails if no session with that id exists. */
    public CompletableFuture<SessionState> joinSession(@NonNull String id) {
        if (role != Role.NONE) {
            return fail(new SessionException("Already in session " + sessionId));
        }
        return documents
                .read(sessionPath(id))
                .handleAsync(
                        (stored, error) -> {
                            if (error != null) {
                                throw report(
                                        new SessionException(
                                                "Could not join session " + id,
                                                ChannelFanOut.rootCause(error)));
                            }
                            SessionState session =
                                    stored.flatMap(this::parseSession)
                                            .orElseThrow(
                                                    () ->
                                                            report(
                                                                    new SessionException(
                                                                            "No such session: "
                                                                                    + id)));
                            follow(session);
                            return session;
                        },
                        control);
    }

    private void follow(SessionState session) {
        role = Role.FOLLOWER;
        sessionId = session.sessionId();
        appliedAny = false;
        String followed = session.sessionId();
        subscription =
                documents.subscribe(
                        sessionPath(followed),
                        value -> control.execute(() -> onSessionDocument(followed, value)));
        log.info("Joined session {} of device {}", followed, session.adminDeviceId());
        notify(l -> l.onSessionStarted(session, false));
    }

    private void onSessionDocument(String followed, Optional<JsonNode> value) {
        if (role != Role.FOLLOWER || !followed.equals(sessionId)) {
            return;
        }
        if (value.isEmpty()) {
            log.info("Session {} ended by its admin", followed);
            stopFollowing();
            notify(l -> l.onSessionEnded(followed));
            return;
        }
        parseSession(value.get())
                .map(SessionState::transportSnapshot)
                .ifPresent(this::receive);
    }

    /**
     * Apply {@code snapshot} now if the debounce window since the last applied one has passed,
     * otherwise hold it and apply the newest held snapshot when the window ends.
     */
    void receive(@NonNull TransportSnapshot snapshot) {
        latest = snapshot;
        long now = scheduler.currentTimeMillis();
        long sinceLast = now - lastAppliedAt;
        if (!appliedAny || sinceLast >= settings.debounceMs()) {
            cancelPending();
            apply(snapshot, now);
            return;
        }
        pending = snapshot;
        if (pendingTimer == null) {
            long generation = pendingGeneration;
            pendingTimer =
                    scheduler.schedule(
                            () -> applyPending(generation), settings.debounceMs() - sinceLast);
        }
    }

    private void applyPending(long generation) {
        if (generation != pendingGeneration) {
            // A cancelled timer whose tick was already on its way
            return;
        }
        pendingGeneration++;
        pendingTimer = null;
        TransportSnapshot snapshot = pending;
        pending = null;
        if (snapshot != null && role == Role.FOLLOWER) {
            apply(snapshot, scheduler.currentTimeMillis());
        }
    }

    private void apply(TransportSnapshot snapshot, long now) {
        lastAppliedAt = now;
        appliedAny = true;
        TransportState local = transport.getState();
        if (snapshot.songId() != null && !snapshot.songId().equals(local.songId())) {
            log.debug(
                    "Skipping snapshot for song {}; {} is loaded",
                    snapshot.songId(),
                    local.songId());
            return;
        }
        if (Math.abs(snapshot.playbackSpeed() - local.playbackSpeed()) > SPEED_EPSILON) {
            transport.setSpeed(snapshot.playbackSpeed());
        }
        if (Math.abs(snapshot.seekPosition() - local.seekPositionSeconds())
                > settings.seekToleranceSeconds()) {
            transport.seek(snapshot.seekPosition());
        }
        if (snapshot.playing() && !local.playing()) {
            transport.play();
        } else if (!snapshot.playing() && local.playing()) {
            transport.pause();
        }
        notify(l -> l.onSnapshotApplied(snapshot));
    }

    // Leaving

    /**
     * Leave the current session. An admin deletes the session document, leaving followers with
     * their last snapshot; a follower only stops listening.
     */
    public CompletableFuture<Void> leave() {
        String left = sessionId;
        Role was = role;
        if (was == Role.NONE) {
            return CompletableFuture.completedFuture(null);
        }
        stopFollowing();
        log.info("Left session {} ({})", left, was);
        if (was == Role.ADMIN && settings.deleteOnAdminLeave()) {
            return documents
                    .delete(sessionPath(left))
                    .exceptionally(
                            error -> {
                                throw report(
                                        new SessionException(
                                                "Could not delete session " + left,
                                                ChannelFanOut.rootCause(error)));
                            });
        }
        return CompletableFuture.completedFuture(null);
    }

    private void stopFollowing() {
        subscription.unsubscribe();
        subscription = Subscription.NONE;
        cancelPending();
        role = Role.NONE;
        sessionId = null;
        appliedAny = false;
        latest = null;
    }

    private void cancelPending() {
        pendingGeneration++;
        if (pendingTimer != null) {
            pendingTimer.cancel();
            pendingTimer = null;
        }
        pending = null;
    }

    // Session list

    /** Sessions currently present in the store, oldest first. */
    public CompletableFuture<List<SessionSummary>> listActiveSessions() {
        return documents
                .read(SESSIONS)
                .thenApply(
                        stored -> {
                            var sessions = new ArrayList<SessionSummary>();
                            if (stored.isPresent()) {
                                Iterator<JsonNode> nodes = stored.get().elements();
                                while (nodes.hasNext()) {
                                    parseSession(nodes.next())
                                            .map(SessionState::summary)
                                            .ifPresent(sessions::add);
                                }
                            }
                            sessions.sort(Comparator.comparingLong(SessionSummary::createdAt));
                            return sessions;
                        });
    }

    /** Delete a session document; leaves it first if this device belongs to it. */
    public CompletableFuture<Void> deleteSession(@NonNull String id) {
        CompletableFuture<Void> left =
                id.equals(sessionId) ? leave() : CompletableFuture.completedFuture(null);
        return left.thenCompose(ignored -> documents.delete(sessionPath(id)));
    }

    @Override
    public void close() {
        leave();
        transport.removeListener(this);
    }

    // Helpers

    private Optional<SessionState> parseSession(JsonNode node) {
        try {
            return Optional.of(mapper.treeToValue(node, SessionState.class));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Ignoring malformed session document: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private SessionException report(SessionException error) {
        log.error(error.getMessage(), error.getCause());
        notify(l -> l.onSessionError(error));
        return error;
    }

    private <T> CompletableFuture<T> fail(SessionException error) {
        return CompletableFuture.failedFuture(report(error));
    }

    private void notify(Consumer<SessionListener> event) {
        for (SessionListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (Exception e) {
                log.warn("Error in session listener", e);
            }
        }
    }

    private static String sessionPath(String id) {
        return DocumentPaths.join(SESSIONS, id);
    }
}

package playback;

import audio.ChannelEngine;
import audio.ChannelFanOut;
import audio.ChannelHandle;
import audio.ChannelStatus;
import audio.FanOutResult;
import content.Song;
import content.Track;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Function;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import mixer.GainResolver;
import mixer.TrackMixState;
import playback.TransportStateMachine.Phase;
import timing.Scheduler;

/**
 * Drives one channel per track of the current song so that all of them move together. Owns the
 * {@link PlaybackContext}, the phase machine and the progress polling loop.
 *
 * <p>Every method must be called on the control thread. Commands fan out to the channels and
 * block that thread until the whole batch settled, so a phase change is only ever observed after
 * every channel received the command. Loading is the exception: it completes asynchronously and a
 * result that arrives for a song that is no longer current is discarded.
 *
 * <p>Channel failures never reach the caller. A channel that fails to load is excluded from every
 * later command until the next song load; a failing command on a loaded channel is logged and
 * skipped for that command only.
 */
@Slf4j
public class PlaybackTransport implements AutoCloseable {

    private final ChannelEngine engine;
    private final Executor control;
    private final Scheduler scheduler;
    private final long progressIntervalMs;
    private final TransportStateMachine stateMachine = new TransportStateMachine();
    private final List<TransportListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong generations = new AtomicLong();

    private Function<Song, CompletableFuture<Map<String, TrackMixState>>> mixSource =
            song -> CompletableFuture.completedFuture(Map.of());

    private PlaybackContext context;
    private float playbackSpeed = 1.0f;

    // Progress polling
    private Scheduler.Cancellable progressTimer;
    private volatile boolean seeking;
    private volatile long seekEpoch;
    private volatile boolean pollInFlight;

    public PlaybackTransport(
            @NonNull ChannelEngine engine,
            @NonNull Executor control,
            @NonNull Scheduler scheduler,
            long progressIntervalMs) {
        if (progressIntervalMs <= 0) {
            throw new IllegalArgumentException("progressIntervalMs must be positive");
        }
        this.engine = engine;
        this.control = control;
        this.scheduler = scheduler;
        this.progressIntervalMs = progressIntervalMs;
    }

    public void addListener(@NonNull TransportListener listener) {
        listeners.add(listener);
    }

    public void removeListener(@NonNull TransportListener listener) {
        listeners.remove(listener);
    }

    /**
     * Supplies the initial mix of a song while its channels load. A failing source falls back to
     * defaults for every track.
     */
    public void setMixSource(
            @NonNull Function<Song, CompletableFuture<Map<String, TrackMixState>>> mixSource) {
        this.mixSource = mixSource;
    }

    // Loading

    /**
     * Switch to {@code song}: fully unload the current channel set, then load one channel per
     * track in parallel. The future completes on the control thread once every load settled; if
     * another song was loaded in the meantime the returned context is already closed.
     */
    public CompletableFuture<PlaybackContext> load(@NonNull Song song) {
        PlaybackContext previous = context;
        var next = new PlaybackContext(song, generations.incrementAndGet(), playbackSpeed);
        context = next;
        stopProgress();
        seeking = false;
        seekEpoch++;

        if (previous != null) {
            teardown(previous);
        }
        if (stateMachine.getCurrentPhase() != Phase.IDLE) {
            stateMachine.transitionTo(Phase.IDLE);
        }
        stateMachine.transitionTo(Phase.LOADING);
        log.debug("Loading song {} with {} tracks", song.id(), song.tracks().size());
        notifyChanged();

        Map<String, Track> tracks = new LinkedHashMap<>();
        song.tracks().forEach(track -> tracks.put(track.id(), track));
        CompletableFuture<FanOutResult<String, ChannelHandle>> channels =
                ChannelFanOut.fanOut(
                        tracks.keySet(), id -> engine.load(tracks.get(id).resourceRef()));
        CompletableFuture<Map<String, TrackMixState>> mix = loadMix(song);

        return channels.thenCombine(mix, LoadOutcome::new)
                .thenApplyAsync(outcome -> completeLoad(next, outcome), control);
    }

    /** Stop and unload every channel of the current song and return to IDLE. */
    public void unload() {
        PlaybackContext current = context;
        context = null;
        stopProgress();
        seeking = false;
        seekEpoch++;
        if (current != null) {
            teardown(current);
        }
        if (stateMachine.getCurrentPhase() != Phase.IDLE) {
            stateMachine.transitionTo(Phase.IDLE);
            notifyChanged();
        }
    }

    private CompletableFuture<Map<String, TrackMixState>> loadMix(Song song) {
        CompletableFuture<Map<String, TrackMixState>> source;
        try {
            source = mixSource.apply(song);
        } catch (RuntimeException e) {
            source = CompletableFuture.failedFuture(e);
        }
        return source.exceptionally(
                error -> {
                    log.warn(
                            "Could not load mix for song {}; using defaults",
                            song.id(),
                            ChannelFanOut.rootCause(error));
                    return Map.of();
                });
    }

    private PlaybackContext completeLoad(PlaybackContext loaded, LoadOutcome outcome) {
        Map<String, ChannelHandle> handles = outcome.channels().successes();
        if (!isCurrent(loaded)) {
            log.debug("Discarding superseded load of {}", loaded);
            settle(ChannelFanOut.fanOut(handles.keySet(), id -> engine.unload(handles.get(id))));
            return loaded;
        }

        handles.forEach(loaded::attach);
        outcome.channels()
                .failures()
                .forEach(
                        (trackId, error) -> {
                            loaded.markUnusable(trackId);
                            log.warn(
                                    "Channel {} of song {} failed to load; excluded until next"
                                            + " load",
                                    trackId,
                                    loaded.getSongId(),
                                    error);
                        });
        outcome.mix().forEach(loaded::putMixState);
        loaded.resetTrackPositions(0);

        applyGains(loaded, loaded.getTrackIds());
        stateMachine.transitionTo(Phase.READY);
        log.info(
                "Song {} ready: {}/{} channels loaded",
                loaded.getSongId(),
                handles.size(),
                loaded.getTrackIds().size());
        notifyChanged();
        notify(l -> l.onContextReady(loaded));
        return loaded;
    }

    private void teardown(PlaybackContext old) {
        old.close();
        notify(l -> l.onContextClosed(old));
        Map<String, ChannelHandle> handles = old.loadedHandles();
        FanOutResult<String, Void> result =
                settle(
                        ChannelFanOut.fanOut(
                                handles.keySet(),
                                id ->
                                        engine.stop(handles.get(id))
                                                .handle((v, e) -> null)
                                                .thenCompose(
                                                        v -> engine.unload(handles.get(id)))));
        result.failures()
                .forEach(
                        (trackId, error) ->
                                log.warn(
                                        "Failed to unload channel {} of song {}",
                                        trackId,
                                        old.getSongId(),
                                        error));
        log.debug("Unloaded {} channels of {}", result.size(), old);
    }

    // Commands

    /** Start every active channel at the current position and speed. */
    public void play() {
        PlaybackContext ctx = context;
        if (ctx == null || !stateMachine.isAny(Phase.READY, Phase.PAUSED, Phase.FINISHED)) {
            log.warn("Play requested in invalid phase: {}", stateMachine.getCurrentPhase());
            return;
        }
        if (ctx.isFinished()) {
            ctx.setFinished(false);
            ctx.setSeekPositionSeconds(0);
            ctx.resetTrackPositions(0);
        }
        double position = ctx.getSeekPositionSeconds();
        float speed = ctx.getPlaybackSpeed();
        Map<String, ChannelHandle> active = activeHandles(ctx);
        var result =
                settle(
                        ChannelFanOut.fanOut(
                                active.keySet(),
                                id -> startChannel(active.get(id), position, speed)));
        logFailures("play", ctx, result);

        ctx.setPlaying(true);
        stateMachine.transitionTo(Phase.PLAYING);
        startProgress();
        log.debug("Playing {} from {}s on {} channels", ctx, position, active.size());
        notifyChanged();
        notifyCommand(TransportCommand.PLAY);
    }

    /** Pause every loaded channel. */
    public void pause() {
        PlaybackContext ctx = context;
        if (ctx == null || stateMachine.getCurrentPhase() != Phase.PLAYING) {
            log.warn("Pause requested in invalid phase: {}", stateMachine.getCurrentPhase());
            return;
        }
        stopProgress();
        Map<String, ChannelHandle> usable = ctx.usableHandles();
        var result =
                settle(ChannelFanOut.fanOut(usable.keySet(), id -> engine.pause(usable.get(id))));
        logFailures("pause", ctx, result);

        ctx.setPlaying(false);
        stateMachine.transitionTo(Phase.PAUSED);
        log.debug("Paused {}", ctx);
        notifyChanged();
        notifyCommand(TransportCommand.PAUSE);
    }

    public void togglePlayPause() {
        if (stateMachine.getCurrentPhase() == Phase.PLAYING) {
            pause();
        } else {
            play();
        }
    }

    /**
     * Move every loaded channel to {@code seconds}. Progress ticks are suppressed until all
     * channels settled so a tick can never overwrite the new position.
     */
    public void seek(double seconds) {
        PlaybackContext ctx = context;
        if (ctx == null
                || !stateMachine.isAny(
                        Phase.READY, Phase.PLAYING, Phase.PAUSED, Phase.FINISHED)) {
            log.warn("Seek requested in invalid phase: {}", stateMachine.getCurrentPhase());
            return;
        }
        double target = Math.max(0, seconds);
        Phase from = stateMachine.transitionTo(Phase.SEEKING);
        Phase resumeTo = from == Phase.FINISHED ? Phase.PAUSED : from;

        seeking = true;
        seekEpoch++;
        ctx.setSeekPositionSeconds(target);
        try {
            Map<String, ChannelHandle> usable = ctx.usableHandles();
            var result =
                    settle(
                            ChannelFanOut.fanOut(
                                    usable.keySet(),
                                    id -> engine.setPosition(usable.get(id), target)));
            result.failures()
                    .forEach(
                            (trackId, error) ->
                                    log.debug(
                                            "Channel {} not available for seeking: {}",
                                            trackId,
                                            error.getMessage()));
        } finally {
            seeking = false;
        }

        ctx.setFinished(false);
        ctx.resetTrackPositions(target);
        stateMachine.transitionTo(resumeTo);
        log.debug("Seeked {} to {}s", ctx, target);
        notifyChanged();
        notifyCommand(TransportCommand.SEEK);
    }

    /** Change the playback rate of every loaded channel; kept across song switches. */
    public void setSpeed(float multiplier) {
        if (!(multiplier > 0) || Float.isInfinite(multiplier)) {
            throw new IllegalArgumentException("Playback speed must be positive: " + multiplier);
        }
        playbackSpeed = multiplier;
        PlaybackContext ctx = context;
        if (ctx != null) {
            ctx.setPlaybackSpeed(multiplier);
            if (stateMachine.isLoaded()) {
                Map<String, ChannelHandle> usable = ctx.usableHandles();
                var result =
                        settle(
                                ChannelFanOut.fanOut(
                                        usable.keySet(),
                                        id -> engine.setRate(usable.get(id), multiplier)));
                logFailures("set rate", ctx, result);
            }
        }
        log.debug("Playback speed set to {}", multiplier);
        notifyChanged();
        notifyCommand(TransportCommand.SET_SPEED);
    }

    /** Stop every channel, rewind to zero and play again. */
    public void restart() {
        PlaybackContext ctx = context;
        if (ctx == null || !stateMachine.isLoaded()) {
            log.warn("Restart requested in invalid phase: {}", stateMachine.getCurrentPhase());
            return;
        }
        rewind(ctx);
        play();
        notifyCommand(TransportCommand.RESTART);
    }

    /** Stop every channel and rewind to zero, leaving the song loaded. */
    public void stop() {
        PlaybackContext ctx = context;
        if (ctx == null || !stateMachine.isLoaded()) {
            log.warn("Stop requested in invalid phase: {}", stateMachine.getCurrentPhase());
            return;
        }
        rewind(ctx);
        notifyChanged();
        notifyCommand(TransportCommand.STOP);
    }

    private void rewind(PlaybackContext ctx) {
        stopProgress();
        Map<String, ChannelHandle> usable = ctx.usableHandles();
        var result =
                settle(ChannelFanOut.fanOut(usable.keySet(), id -> engine.stop(usable.get(id))));
        logFailures("stop", ctx, result);
        ctx.setPlaying(false);
        ctx.setFinished(false);
        ctx.setSeekPositionSeconds(0);
        ctx.resetTrackPositions(0);
        seekEpoch++;
        if (stateMachine.getCurrentPhase() != Phase.READY) {
            stateMachine.transitionTo(Phase.READY);
        }
    }

    // Mixer support

    /**
     * Push the effective gain of {@code trackIds} to their channels. Gains are resolved against
     * the whole mix of the current song. Channel errors are ignored: the mix state stays
     * authoritative and is re-applied on the next change.
     */
    public FanOutResult<String, Void> applyGains(@NonNull Collection<String> trackIds) {
        PlaybackContext ctx = context;
        if (ctx == null) {
            return new FanOutResult<>();
        }
        return applyGains(ctx, trackIds);
    }

    private FanOutResult<String, Void> applyGains(
            PlaybackContext ctx, Collection<String> trackIds) {
        Map<String, Float> gains = GainResolver.resolve(ctx.getMix());
        Map<String, ChannelHandle> usable = ctx.usableHandles();
        var targets = trackIds.stream().filter(usable::containsKey).toList();
        var result =
                settle(
                        ChannelFanOut.fanOut(
                                targets, id -> engine.setGain(usable.get(id), gains.get(id))));
        result.failures()
                .forEach(
                        (trackId, error) ->
                                log.debug(
                                        "Ignoring gain failure on channel {}: {}",
                                        trackId,
                                        error.getMessage()));
        return result;
    }

    /**
     * Bring a channel that just became active in line with the others while playing, so that it
     * is heard and counts towards the end of the song.
     */
    public void activateChannel(@NonNull String trackId) {
        PlaybackContext ctx = context;
        if (ctx == null || stateMachine.getCurrentPhase() != Phase.PLAYING) {
            return;
        }
        Optional<ChannelHandle> handle = ctx.handle(trackId);
        if (handle.isEmpty() || !ctx.getActiveTrackIds().contains(trackId)) {
            return;
        }
        var result =
                settle(
                        ChannelFanOut.fanOut(
                                List.of(trackId),
                                id ->
                                        startChannel(
                                                handle.get(),
                                                ctx.getSeekPositionSeconds(),
                                                ctx.getPlaybackSpeed())));
        logFailures("activate", ctx, result);
    }

    /** Notify listeners that the mix of the current song changed outside a transport command. */
    public void mixChanged() {
        notifyChanged();
    }

    // Progress polling

    private void startProgress() {
        stopProgress();
        progressTimer = scheduler.scheduleAtFixedRate(this::pollProgress, progressIntervalMs);
    }

    private void stopProgress() {
        Scheduler.Cancellable timer = progressTimer;
        if (timer != null) {
            progressTimer = null;
            timer.cancel();
        }
    }

    /**
     * Poll position and duration of every active channel. Results are applied on the control
     * thread and dropped if a seek started in the meantime or the song changed.
     *
     * <p>Package-private for testing.
     */
    void pollProgress() {
        PlaybackContext ctx = context;
        if (ctx == null
                || seeking
                || pollInFlight
                || stateMachine.getCurrentPhase() != Phase.PLAYING) {
            return;
        }
        long epoch = seekEpoch;
        Map<String, ChannelHandle> active = activeHandles(ctx);
        pollInFlight = true;
        ChannelFanOut.fanOut(active.keySet(), id -> engine.getStatus(active.get(id)))
                .thenAcceptAsync(
                        result -> {
                            pollInFlight = false;
                            applyProgress(ctx, epoch, active.keySet(), result);
                        },
                        control);
    }

    private void applyProgress(
            PlaybackContext ctx,
            long epoch,
            Set<String> polled,
            FanOutResult<String, ChannelStatus> result) {
        if (!isCurrent(ctx)
                || seeking
                || epoch != seekEpoch
                || stateMachine.getCurrentPhase() != Phase.PLAYING) {
            log.trace("Dropping stale progress for {}", ctx);
            return;
        }
        boolean counted = false;
        boolean allAtEnd = true;
        boolean first = true;
        for (String trackId : polled) {
            ChannelStatus status = result.successes().get(trackId);
            if (status == null || !status.loaded()) {
                // Unknown position: this tick cannot decide the song has finished
                allAtEnd = false;
                continue;
            }
            if (status.durationSeconds() <= 0) {
                continue;
            }
            counted = true;
            ctx.setTrackPosition(trackId, status.positionSeconds());
            if (first) {
                ctx.setSeekPositionSeconds(status.positionSeconds());
                first = false;
            }
            if (!status.isAtEnd()) {
                allAtEnd = false;
            }
        }
        TransportState state = getState();
        notify(l -> l.onPositionTick(state));
        if (counted && allAtEnd) {
            finish(ctx);
        }
    }

    private void finish(PlaybackContext ctx) {
        stopProgress();
        ctx.setPlaying(false);
        ctx.setFinished(true);
        stateMachine.transitionTo(Phase.FINISHED);
        log.info("Song {} finished", ctx.getSongId());
        notifyChanged();
        notify(l -> l.onFinished(ctx.getSong()));
    }

    // Queries

    public TransportState getState() {
        PlaybackContext ctx = context;
        if (ctx == null) {
            return TransportState.idle(playbackSpeed);
        }
        return TransportState.of(ctx, stateMachine.getCurrentPhase());
    }

    public Phase getPhase() {
        return stateMachine.getCurrentPhase();
    }

    public Optional<PlaybackContext> getContext() {
        return Optional.ofNullable(context);
    }

    /** Identity guard for asynchronous results: true only for the live context. */
    public boolean isCurrent(PlaybackContext candidate) {
        return candidate != null && candidate == context && !candidate.isClosed();
    }

    public float getPlaybackSpeed() {
        return playbackSpeed;
    }

    boolean isSeeking() {
        return seeking;
    }

    @Override
    public void close() {
        unload();
        listeners.clear();
    }

    // Helpers

    private Map<String, ChannelHandle> activeHandles(PlaybackContext ctx) {
        Map<String, ChannelHandle> usable = ctx.usableHandles();
        var active = new LinkedHashMap<String, ChannelHandle>();
        for (String trackId : ctx.getActiveTrackIds()) {
            active.put(trackId, usable.get(trackId));
        }
        return active;
    }

    private CompletableFuture<Void> startChannel(
            ChannelHandle handle, double position, float speed) {
        return tolerate(engine.setPosition(handle, position), "set position", handle)
                .thenCompose(v -> tolerate(engine.setRate(handle, speed), "set rate", handle))
                .thenCompose(v -> engine.play(handle));
    }

    private CompletableFuture<Void> tolerate(
            CompletableFuture<Void> step, String what, ChannelHandle handle) {
        return step.exceptionally(
                error -> {
                    log.debug(
                            "Could not {} on {}: {}",
                            what,
                            handle,
                            ChannelFanOut.rootCause(error).getMessage());
                    return null;
                });
    }

    private static <K, R> FanOutResult<K, R> settle(CompletableFuture<FanOutResult<K, R>> batch) {
        return batch.join();
    }

    private void logFailures(String command, PlaybackContext ctx, FanOutResult<String, ?> result) {
        result.failures()
                .forEach(
                        (trackId, error) ->
                                log.warn(
                                        "Channel {} of song {} failed to {}: {}",
                                        trackId,
                                        ctx.getSongId(),
                                        command,
                                        error.getMessage()));
    }

    private void notifyChanged() {
        TransportState state = getState();
        notify(l -> l.onTransportChanged(state));
    }

    private void notifyCommand(TransportCommand command) {
        TransportState state = getState();
        notify(l -> l.onCommandApplied(command, state));
    }

    private void notify(Consumer<TransportListener> event) {
        for (TransportListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (Exception e) {
                log.warn("Error in transport listener", e);
            }
        }
    }

    private record LoadOutcome(
            FanOutResult<String, ChannelHandle> channels, Map<String, TrackMixState> mix) {}
}

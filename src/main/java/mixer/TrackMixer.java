package mixer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.UnaryOperator;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import playback.PlaybackContext;
import playback.PlaybackTransport;
import playback.TransportListener;
import store.Subscription;
import timing.Scheduler;
import trackstate.TrackStateStore;

/**
 * Volume, mute and solo for the tracks of the current song.
 *
 * <p>The mix lives in the {@link PlaybackContext}; every change recomputes the effective gain and
 * pushes it to the channels through the transport, then writes the changed track to the {@link
 * TrackStateStore}. Channel and persistence errors are logged and otherwise ignored: the mix
 * state stays authoritative. Once a song is ready the stored mix is followed live, so a change
 * made by the same user on another device overrides the local one.
 *
 * <p>Must be used from the control thread.
 */
@Slf4j
public class TrackMixer implements TransportListener, AutoCloseable {

    private final PlaybackTransport transport;
    private final TrackStateStore store;
    private final Executor control;
    private final ClickClassifier clicks;
    private final List<MixListener> listeners = new CopyOnWriteArrayList<>();

    private Subscription remote = Subscription.NONE;

    public TrackMixer(
            @NonNull PlaybackTransport transport,
            @NonNull TrackStateStore store,
            @NonNull Executor control,
            @NonNull Scheduler scheduler,
            long clickWindowMillis) {
        this.transport = transport;
        this.store = store;
        this.control = control;
        this.clicks = new ClickClassifier(scheduler, clickWindowMillis, this::onGesture);
        transport.setMixSource(store::load);
        transport.addListener(this);
    }

    public void addListener(@NonNull MixListener listener) {
        listeners.add(listener);
    }

    public void removeListener(@NonNull MixListener listener) {
        listeners.remove(listener);
    }

    /** Set one track's volume; only that channel's gain changes. */
    public void setVolume(@NonNull String trackId, float volume) {
        if (Float.isNaN(volume) || volume < 0f || volume > 1f) {
            throw new IllegalArgumentException("Volume must be in [0, 1]: " + volume);
        }
        update(trackId, state -> state.withVolume(volume), false);
    }

    /** Mute affects which tracks are active, so every channel's gain is recomputed. */
    public void toggleMute(@NonNull String trackId) {
        update(trackId, TrackMixState::toggleMute, true);
    }

    /** Solo changes the gain of every other track, so every channel's gain is recomputed. */
    public void toggleSolo(@NonNull String trackId) {
        update(trackId, TrackMixState::toggleSolo, true);
    }

    /** Single tap toggles solo; a second tap within the click window toggles mute instead. */
    public void classifyClick(@NonNull String trackId) {
        clicks.click(trackId);
    }

    /** Mix of the current song, empty when nothing is loaded. */
    public Map<String, TrackMixState> getMix() {
        return transport
                .getContext()
                .<Map<String, TrackMixState>>map(ctx -> new LinkedHashMap<>(ctx.getMix()))
                .orElse(Map.of());
    }

    public Map<String, Float> getEffectiveGains() {
        return GainResolver.resolve(getMix());
    }

    private void onGesture(String trackId, ClickClassifier.Gesture gesture) {
        if (gesture == ClickClassifier.Gesture.DOUBLE) {
            toggleMute(trackId);
        } else {
            toggleSolo(trackId);
        }
    }

    private void update(String trackId, UnaryOperator<TrackMixState> change, boolean allTracks) {
        PlaybackContext ctx = transport.getContext().orElse(null);
        if (ctx == null || !ctx.hasTrack(trackId)) {
            log.warn("Ignoring mix change for unknown track {}", trackId);
            return;
        }
        boolean wasActive = ctx.getActiveTrackIds().contains(trackId);
        TrackMixState updated = change.apply(ctx.mixState(trackId));
        ctx.putMixState(trackId, updated);
        log.debug("Track {} of song {} now {}", trackId, ctx.getSongId(), updated);

        transport.applyGains(allTracks ? ctx.getTrackIds() : List.of(trackId));
        if (!wasActive && ctx.getActiveTrackIds().contains(trackId)) {
            transport.activateChannel(trackId);
        }
        store.save(ctx.getSongId(), trackId, updated)
                .whenComplete(
                        (ignored, error) -> {
                            if (error != null) {
                                log.warn(
                                        "Could not persist state of track {}",
                                        trackId,
                                        error);
                            }
                        });
        mixChanged(ctx);
    }

    // Remote changes

    @Override
    public void onContextReady(PlaybackContext ctx) {
        remote.unsubscribe();
        remote =
                store.subscribe(
                        ctx.getSongId(),
                        states -> control.execute(() -> applyRemote(ctx, states)));
    }

    @Override
    public void onContextClosed(PlaybackContext ctx) {
        remote.unsubscribe();
        remote = Subscription.NONE;
        clicks.reset();
    }

    private void applyRemote(PlaybackContext ctx, Map<String, TrackMixState> states) {
        if (!transport.isCurrent(ctx)) {
            log.trace("Dropping remote mix for superseded {}", ctx);
            return;
        }
        var activated = new ArrayList<String>();
        boolean changed = false;
        for (Map.Entry<String, TrackMixState> entry : states.entrySet()) {
            String trackId = entry.getKey();
            if (!ctx.hasTrack(trackId) || ctx.mixState(trackId).equals(entry.getValue())) {
                continue;
            }
            boolean wasActive = ctx.getActiveTrackIds().contains(trackId);
            ctx.putMixState(trackId, entry.getValue());
            if (!wasActive && ctx.getActiveTrackIds().contains(trackId)) {
                activated.add(trackId);
            }
            changed = true;
        }
        if (!changed) {
            return;
        }
        log.debug("Applying remote mix change for song {}", ctx.getSongId());
        transport.applyGains(ctx.getTrackIds());
        activated.forEach(transport::activateChannel);
        mixChanged(ctx);
    }

    private void mixChanged(PlaybackContext ctx) {
        Map<String, TrackMixState> mix =
                Collections.unmodifiableMap(new LinkedHashMap<>(ctx.getMix()));
        for (MixListener listener : listeners) {
            try {
                listener.onMixChanged(ctx.getSongId(), mix);
            } catch (Exception e) {
                log.warn("Error in mix listener", e);
            }
        }
        transport.mixChanged();
    }

    @Override
    public void close() {
        remote.unsubscribe();
        clicks.reset();
        transport.removeListener(this);
    }
}

package playback;

import audio.ChannelHandle;
import content.Song;
import content.Track;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.NonNull;
import mixer.TrackMixState;

/**
 * Everything that belongs to the song currently loaded on this device: its channels, the mix
 * applied to them and the transport position. Created by {@link PlaybackTransport#load} and
 * closed on the next song switch; a closed context is never mutated again.
 *
 * <p>Only touched from the control thread.
 */
public final class PlaybackContext {

    @Getter private final Song song;
    @Getter private final long generation;

    private final Map<String, ChannelSlot> channels = new LinkedHashMap<>();
    private final Map<String, TrackMixState> mix = new LinkedHashMap<>();
    private final Map<String, Double> trackPositions = new LinkedHashMap<>();

    @Getter private double seekPositionSeconds;
    @Getter private boolean playing;
    @Getter private float playbackSpeed;
    @Getter private boolean finished;
    @Getter private boolean closed;

    PlaybackContext(@NonNull Song song, long generation, float playbackSpeed) {
        this.song = song;
        this.generation = generation;
        this.playbackSpeed = playbackSpeed;
        for (Track track : song.tracks()) {
            channels.put(track.id(), new ChannelSlot(track));
            mix.put(track.id(), TrackMixState.defaults());
        }
    }

    public String getSongId() {
        return song.id();
    }

    /** Track ids whose channel loaded and is still usable. */
    public Set<String> getLoadedTrackIds() {
        return channels.values().stream()
                .filter(ChannelSlot::isUsable)
                .map(slot -> slot.getTrack().id())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /** Loaded tracks that are not muted; these are the channels play and progress fan out to. */
    public Set<String> getActiveTrackIds() {
        return channels.values().stream()
                .filter(ChannelSlot::isUsable)
                .map(slot -> slot.getTrack().id())
                .filter(id -> !mixState(id).mute())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public Set<String> getSoloedTrackIds() {
        return mix.entrySet().stream()
                .filter(e -> e.getValue().solo())
                .map(Map.Entry::getKey)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public List<String> getTrackIds() {
        return List.copyOf(channels.keySet());
    }

    public boolean hasTrack(String trackId) {
        return channels.containsKey(trackId);
    }

    public TrackMixState mixState(@NonNull String trackId) {
        return mix.getOrDefault(trackId, TrackMixState.defaults());
    }

    /** Mix state of every track, in track order. */
    public Map<String, TrackMixState> getMix() {
        return Collections.unmodifiableMap(mix);
    }

    public Map<String, Double> getTrackPositions() {
        return Collections.unmodifiableMap(trackPositions);
    }

    public Optional<ChannelHandle> handle(@NonNull String trackId) {
        ChannelSlot slot = channels.get(trackId);
        if (slot == null || !slot.isUsable()) {
            return Optional.empty();
        }
        return Optional.of(slot.getHandle());
    }

    /** Handles of every usable channel keyed by track id. */
    Map<String, ChannelHandle> usableHandles() {
        var handles = new LinkedHashMap<String, ChannelHandle>();
        channels.forEach(
                (id, slot) -> {
                    if (slot.isUsable()) {
                        handles.put(id, slot.getHandle());
                    }
                });
        return handles;
    }

    /** Every handle that was loaded, usable or not, for teardown. */
    Map<String, ChannelHandle> loadedHandles() {
        var handles = new LinkedHashMap<String, ChannelHandle>();
        channels.forEach(
                (id, slot) -> {
                    if (slot.getHandle() != null) {
                        handles.put(id, slot.getHandle());
                    }
                });
        return handles;
    }

    void attach(String trackId, ChannelHandle handle) {
        ChannelSlot slot = channels.get(trackId);
        if (slot != null) {
            slot.handle = handle;
            slot.usable = true;
        }
    }

    void markUnusable(String trackId) {
        ChannelSlot slot = channels.get(trackId);
        if (slot != null) {
            slot.usable = false;
        }
    }

    /** Replaces the mix state of tracks belonging to this song; unknown track ids are ignored. */
    public void putMixState(@NonNull String trackId, @NonNull TrackMixState state) {
        if (closed || !channels.containsKey(trackId)) {
            return;
        }
        mix.put(trackId, state);
    }

    void setSeekPositionSeconds(double seconds) {
        this.seekPositionSeconds = seconds;
    }

    void setTrackPosition(String trackId, double seconds) {
        trackPositions.put(trackId, seconds);
    }

    void resetTrackPositions(double seconds) {
        channels.keySet().forEach(id -> trackPositions.put(id, seconds));
    }

    void setPlaying(boolean playing) {
        this.playing = playing;
    }

    void setPlaybackSpeed(float playbackSpeed) {
        this.playbackSpeed = playbackSpeed;
    }

    void setFinished(boolean finished) {
        this.finished = finished;
    }

    void close() {
        this.closed = true;
        this.playing = false;
    }

    @Override
    public String toString() {
        return "PlaybackContext[" + song.id() + "#" + generation + (closed ? ", closed]" : "]");
    }

    /** One track's channel. A slot without a handle never loaded. */
    static final class ChannelSlot {
        @Getter private final Track track;
        @Getter private ChannelHandle handle;
        @Getter private boolean usable;

        private ChannelSlot(Track track) {
            this.track = track;
        }
    }
}

package session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.NonNull;
import mixer.TrackMixState;
import playback.TransportState;

/** Transport state of the admin device as published to followers. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TransportSnapshot(
        String songId,
        @JsonProperty("isPlaying") boolean playing,
        double seekPosition,
        List<String> activeTracks,
        List<String> soloedTracks,
        Map<String, Float> trackVolumes,
        float playbackSpeed) {

    public TransportSnapshot {
        activeTracks = activeTracks == null ? List.of() : List.copyOf(activeTracks);
        soloedTracks = soloedTracks == null ? List.of() : List.copyOf(soloedTracks);
        trackVolumes = trackVolumes == null ? Map.of() : Map.copyOf(trackVolumes);
        if (!(playbackSpeed > 0)) {
            playbackSpeed = 1.0f;
        }
    }

    /** Nothing playing, position zero. */
    public static TransportSnapshot stopped(String songId, float playbackSpeed) {
        return new TransportSnapshot(
                songId, false, 0, List.of(), List.of(), Map.of(), playbackSpeed);
    }

    public static TransportSnapshot of(
            @NonNull TransportState state, @NonNull Map<String, TrackMixState> mix) {
        var volumes = new LinkedHashMap<String, Float>();
        mix.forEach((trackId, track) -> volumes.put(trackId, track.volume()));
        return new TransportSnapshot(
                state.songId(),
                state.playing(),
                state.seekPositionSeconds(),
                List.copyOf(state.activeTrackIds()),
                List.copyOf(state.soloedTrackIds()),
                volumes,
                state.playbackSpeed());
    }
}

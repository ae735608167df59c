package playback;

import java.util.Map;
import java.util.Set;
import lombok.NonNull;

/** Immutable view of the transport for listeners and the client. */
public record TransportState(
        String songId,
        TransportStateMachine.Phase phase,
        Set<String> loadedTrackIds,
        Set<String> activeTrackIds,
        Set<String> soloedTrackIds,
        double seekPositionSeconds,
        boolean playing,
        float playbackSpeed,
        boolean finished,
        Map<String, Double> trackPositions) {

    public static TransportState idle(float playbackSpeed) {
        return new TransportState(
                null,
                TransportStateMachine.Phase.IDLE,
                Set.of(),
                Set.of(),
                Set.of(),
                0,
                false,
                playbackSpeed,
                false,
                Map.of());
    }

    static TransportState of(
            @NonNull PlaybackContext context, @NonNull TransportStateMachine.Phase phase) {
        return new TransportState(
                context.getSongId(),
                phase,
                Set.copyOf(context.getLoadedTrackIds()),
                Set.copyOf(context.getActiveTrackIds()),
                Set.copyOf(context.getSoloedTrackIds()),
                context.getSeekPositionSeconds(),
                context.isPlaying(),
                context.getPlaybackSpeed(),
                context.isFinished(),
                Map.copyOf(context.getTrackPositions()));
    }
}

package server.rpc.dto;

import java.util.Map;
import mixer.TrackMixState;

/** Mix of a song together with the gains it resolves to. */
public record MixChanged(
        String songId, Map<String, TrackMixState> mix, Map<String, Float> effectiveGains) {}

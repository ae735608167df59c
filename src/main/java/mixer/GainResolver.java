package mixer;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.NonNull;
import lombok.experimental.UtilityClass;

/**
 * Resolves volume, mute and solo into the gain each channel actually plays at.
 *
 * <p>Mute wins over everything. Otherwise, as soon as any track is soloed only soloed tracks are
 * heard; with no solo anywhere every track plays at its own volume.
 */
@UtilityClass
public class GainResolver {

    public float effectiveGain(@NonNull TrackMixState track, boolean anySoloed) {
        if (track.mute()) {
            return 0f;
        }
        if (anySoloed) {
            return track.solo() ? track.volume() : 0f;
        }
        return track.volume();
    }

    public boolean anySoloed(@NonNull Collection<TrackMixState> tracks) {
        return tracks.stream().anyMatch(TrackMixState::solo);
    }

    /** Effective gain for every track, in the iteration order of {@code tracks}. */
    public Map<String, Float> resolve(@NonNull Map<String, TrackMixState> tracks) {
        boolean anySoloed = anySoloed(tracks.values());
        var gains = new LinkedHashMap<String, Float>();
        tracks.forEach((trackId, state) -> gains.put(trackId, effectiveGain(state, anySoloed)));
        return gains;
    }
}

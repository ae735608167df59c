package mixer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** One user's mix preference for one track of one song. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrackMixState(float volume, boolean mute, boolean solo) {

    public static final float DEFAULT_VOLUME = 1.0f;

    public TrackMixState {
        if (Float.isNaN(volume) || volume < 0f || volume > 1f) {
            throw new IllegalArgumentException("Volume must be in [0, 1]: " + volume);
        }
    }

    public static TrackMixState defaults() {
        return new TrackMixState(DEFAULT_VOLUME, false, false);
    }

    public TrackMixState withVolume(float newVolume) {
        return new TrackMixState(newVolume, mute, solo);
    }

    public TrackMixState toggleMute() {
        return new TrackMixState(volume, !mute, solo);
    }

    public TrackMixState toggleSolo() {
        return new TrackMixState(volume, mute, !solo);
    }
}

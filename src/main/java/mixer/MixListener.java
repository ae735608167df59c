package mixer;

import java.util.Map;

/** Receives the full mix of the current song after every change, local or remote. */
@FunctionalInterface
public interface MixListener {

    void onMixChanged(String songId, Map<String, TrackMixState> mix);
}

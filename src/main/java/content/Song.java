package content;

import java.util.List;
import java.util.Optional;
import lombok.NonNull;

/** A song as served by the content store: metadata plus its ordered tracks. */
public record Song(@NonNull String id, String title, String artist, List<Track> tracks) {

    public Song {
        tracks = tracks == null ? List.of() : List.copyOf(tracks);
    }

    public List<String> trackIds() {
        return tracks.stream().map(Track::id).toList();
    }

    public Optional<Track> track(String trackId) {
        return tracks.stream().filter(t -> t.id().equals(trackId)).findFirst();
    }
}

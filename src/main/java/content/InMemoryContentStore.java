package content;

import com.google.errorprone.annotations.ThreadSafe;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/** Content store holding songs in memory, registered by the hosting application. */
@ThreadSafe
@Slf4j
public class InMemoryContentStore implements ContentStore {

    private final Map<String, Song> songs = new ConcurrentHashMap<>();

    public void put(@NonNull Song song) {
        songs.put(song.id(), song);
        log.debug("Registered song {} with {} tracks", song.id(), song.tracks().size());
    }

    public void remove(@NonNull String songId) {
        songs.remove(songId);
    }

    @Override
    public Optional<Song> getSong(@NonNull String songId) {
        return Optional.ofNullable(songs.get(songId));
    }
}

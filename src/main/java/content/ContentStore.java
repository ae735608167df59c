package content;

import java.util.Optional;
import lombok.NonNull;

/** Read-only access to songs. Song mutation happens elsewhere. */
public interface ContentStore {

    Optional<Song> getSong(@NonNull String songId);
}

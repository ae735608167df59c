package queue;

import content.Song;
import lombok.NonNull;

/** Queue events. All callbacks arrive on the control thread. */
public interface QueueListener {

    default void onSongChanged(@NonNull Song song, int index) {}

    /** The last song finished and nothing repeats. Fired once per queue run. */
    default void onQueueComplete() {}
}

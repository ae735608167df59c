package queue;

/** Where a queue came from; decides whether manual navigation starts playback by itself. */
public enum QueueMode {
    /** A saved playlist: every song switch starts playing. */
    PLAYLIST,
    /** An ad hoc filtered view: only advancing after a finished song starts playing. */
    FILTERED_LIST
}

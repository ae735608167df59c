package queue;

import java.util.List;

/** Immutable view of the queue for the client. */
public record QueueStatus(
        QueueController.State state,
        QueueMode mode,
        List<String> songIds,
        int currentIndex,
        boolean repeatSingle,
        boolean repeatQueue,
        boolean shuffle) {}

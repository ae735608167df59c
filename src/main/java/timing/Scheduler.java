package timing;

import lombok.NonNull;

/**
 * Clock and timer source for everything time-driven in the core: click classification, sync
 * debouncing and progress polling. Tasks run on the control thread of the implementation.
 */
public interface Scheduler {

    long currentTimeMillis();

    /** Runs {@code task} once after {@code delayMillis}. */
    Cancellable schedule(@NonNull Runnable task, long delayMillis);

    /** Runs {@code task} every {@code periodMillis}, first run after one period. */
    Cancellable scheduleAtFixedRate(@NonNull Runnable task, long periodMillis);

    /** Handle to a pending timer. Cancelling twice, or after the task ran, is a no-op. */
    interface Cancellable {
        void cancel();
    }
}

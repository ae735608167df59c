package timing;

import com.google.errorprone.annotations.ThreadSafe;
import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Scheduler backed by a daemon timer thread. Timers only fire on the timer thread; the task itself
 * is handed to the control executor so all state mutation stays on one thread.
 */
@ThreadSafe
@Slf4j
public class ExecutorScheduler implements Scheduler, AutoCloseable {

    private final Clock clock;
    private final Executor control;
    private final ScheduledExecutorService timer;

    public ExecutorScheduler(@NonNull Clock clock, @NonNull Executor control) {
        this.clock = clock;
        this.control = control;
        this.timer =
                Executors.newSingleThreadScheduledExecutor(
                        r -> {
                            Thread t = new Thread(r, "StemdeckTimer");
                            t.setDaemon(true);
                            return t;
                        });
    }

    @Override
    public long currentTimeMillis() {
        return clock.millis();
    }

    @Override
    public Cancellable schedule(@NonNull Runnable task, long delayMillis) {
        var cancelled = new AtomicBoolean();
        ScheduledFuture<?> future =
                timer.schedule(
                        () -> dispatch(task, cancelled),
                        Math.max(0, delayMillis),
                        TimeUnit.MILLISECONDS);
        return cancelOnBothThreads(future, cancelled);
    }

    @Override
    public Cancellable scheduleAtFixedRate(@NonNull Runnable task, long periodMillis) {
        var cancelled = new AtomicBoolean();
        ScheduledFuture<?> future =
                timer.scheduleAtFixedRate(
                        () -> dispatch(task, cancelled),
                        periodMillis,
                        periodMillis,
                        TimeUnit.MILLISECONDS);
        return cancelOnBothThreads(future, cancelled);
    }

    // A tick may already be queued on the control executor when the timer is cancelled
    private static Cancellable cancelOnBothThreads(
            ScheduledFuture<?> future, AtomicBoolean cancelled) {
        return () -> {
            cancelled.set(true);
            future.cancel(false);
        };
    }

    @Override
    public void close() {
        timer.shutdown();
        try {
            if (!timer.awaitTermination(100, TimeUnit.MILLISECONDS)) {
                timer.shutdownNow();
            }
        } catch (InterruptedException e) {
            timer.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void dispatch(Runnable task, AtomicBoolean cancelled) {
        try {
            control.execute(
                    () -> {
                        if (!cancelled.get()) {
                            task.run();
                        }
                    });
        } catch (RuntimeException e) {
            log.warn("Dropping timer task; control executor rejected it", e);
        }
    }
}

package mixer;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import timing.Scheduler;

/**
 * Tells a single tap from a double tap on a track's only tap target.
 *
 * <p>The first click arms a timer for the click window. A second click inside the window cancels
 * it and reports {@link Gesture#DOUBLE}; if the timer fires first it reports {@link
 * Gesture#SINGLE}. Each track is classified independently. Not thread-safe: clicks and timer
 * callbacks must arrive on the control thread.
 */
@Slf4j
public class ClickClassifier {

    public enum Gesture {
        SINGLE,
        DOUBLE
    }

    private final Scheduler scheduler;
    private final long windowMillis;
    private final BiConsumer<String, Gesture> onGesture;
    private final Map<String, PendingClick> pending = new HashMap<>();

    public ClickClassifier(
            @NonNull Scheduler scheduler,
            long windowMillis,
            @NonNull BiConsumer<String, Gesture> onGesture) {
        if (windowMillis <= 0) {
            throw new IllegalArgumentException("Click window must be positive: " + windowMillis);
        }
        this.scheduler = scheduler;
        this.windowMillis = windowMillis;
        this.onGesture = onGesture;
    }

    public void click(@NonNull String trackId) {
        PendingClick first = pending.remove(trackId);
        if (first != null) {
            first.timer.cancel();
            log.trace("Double click on {} after {}ms", trackId, elapsed(first));
            onGesture.accept(trackId, Gesture.DOUBLE);
            return;
        }
        var click = new PendingClick(scheduler.currentTimeMillis());
        pending.put(trackId, click);
        click.timer = scheduler.schedule(() -> expire(trackId, click), windowMillis);
    }

    private void expire(String trackId, PendingClick click) {
        if (pending.remove(trackId, click)) {
            onGesture.accept(trackId, Gesture.SINGLE);
        }
    }

    public boolean isPending(@NonNull String trackId) {
        return pending.containsKey(trackId);
    }

    /** Drops every half-classified click without reporting it. */
    public void reset() {
        for (PendingClick click : List.copyOf(pending.values())) {
            click.timer.cancel();
        }
        pending.clear();
    }

    private long elapsed(PendingClick click) {
        return scheduler.currentTimeMillis() - click.pressedAt;
    }

    private static final class PendingClick {
        final long pressedAt;
        Scheduler.Cancellable timer = () -> {};

        PendingClick(long pressedAt) {
            this.pressedAt = pressedAt;
        }
    }
}

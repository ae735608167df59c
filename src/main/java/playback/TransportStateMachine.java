package playback;

import com.google.errorprone.annotations.ThreadSafe;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * State machine for transport phases. All phase changes of {@link PlaybackTransport} go through
 * here so that an illegal transition fails loudly instead of leaving the transport half-updated.
 *
 * <p>State machine transitions:
 *
 * <pre>
 * IDLE -> LOADING (load song)
 * LOADING -> READY (all channel loads settled)
 * LOADING -> IDLE (superseded or unloaded)
 *
 * READY -> PLAYING (play)
 * READY -> SEEKING (seek)
 *
 * PLAYING -> PAUSED (pause)
 * PLAYING -> SEEKING (seek)
 * PLAYING -> FINISHED (every active channel reached its end)
 * PLAYING -> READY (stop)
 *
 * PAUSED -> PLAYING (resume)
 * PAUSED -> SEEKING (seek)
 * PAUSED -> READY (stop)
 *
 * SEEKING -> PLAYING | PAUSED | READY (seek settled, back to where it came from)
 *
 * FINISHED -> PLAYING (play from the top)
 * FINISHED -> READY (restart, stop)
 * FINISHED -> SEEKING (scrub back)
 *
 * any -> IDLE (unload / song switch)
 * </pre>
 */
@Slf4j
@ThreadSafe
public class TransportStateMachine {

    public enum Phase {
        IDLE, // No song loaded
        LOADING, // Channels loading
        READY, // Loaded, stopped
        PLAYING,
        PAUSED,
        SEEKING, // Repositioning all channels
        FINISHED // Every active channel reached its end
    }

    private final ReentrantLock stateLock = new ReentrantLock();
    private volatile Phase currentPhase = Phase.IDLE;

    public Phase getCurrentPhase() {
        return currentPhase;
    }

    /**
     * Check if a song is loaded (any phase after loading completed).
     *
     * @return true if channels are loaded and commands can be issued
     */
    public boolean isLoaded() {
        Phase phase = currentPhase;
        return phase != Phase.IDLE && phase != Phase.LOADING;
    }

    /**
     * Move to {@code target}, validating the transition.
     *
     * @return the phase that was left
     * @throws IllegalStateException if the transition is invalid
     */
    public Phase transitionTo(Phase target) {
        stateLock.lock();
        try {
            Phase from = currentPhase;
            if (!isValidTransition(from, target)) {
                throw new IllegalStateException(
                        String.format("Cannot transition from %s to %s", from, target));
            }
            log.debug("Phase transition: {} -> {}", from, target);
            currentPhase = target;
            return from;
        } finally {
            stateLock.unlock();
        }
    }

    public boolean isAny(Phase... expected) {
        Phase phase = currentPhase;
        for (Phase candidate : expected) {
            if (phase == candidate) {
                return true;
            }
        }
        return false;
    }

    static boolean isValidTransition(Phase from, Phase to) {
        if (to == Phase.IDLE) {
            return true;
        }
        return switch (from) {
            case IDLE -> to == Phase.LOADING;
            case LOADING -> to == Phase.READY;
            case READY -> to == Phase.PLAYING || to == Phase.SEEKING;
            case PLAYING -> to == Phase.PAUSED
                    || to == Phase.SEEKING
                    || to == Phase.FINISHED
                    || to == Phase.READY;
            case PAUSED -> to == Phase.PLAYING || to == Phase.SEEKING || to == Phase.READY;
            case SEEKING -> to == Phase.PLAYING || to == Phase.PAUSED || to == Phase.READY;
            case FINISHED -> to == Phase.PLAYING || to == Phase.READY || to == Phase.SEEKING;
        };
    }
}

package session;

/**
 * Follower reconciliation thresholds.
 *
 * @param debounceMs minimum time between two applied snapshots
 * @param seekToleranceSeconds position difference below which a follower does not seek
 * @param deleteOnAdminLeave whether the session document is deleted when its admin leaves
 */
public record SyncSettings(
        long debounceMs, double seekToleranceSeconds, boolean deleteOnAdminLeave) {

    public SyncSettings {
        if (debounceMs < 0) {
            throw new IllegalArgumentException("debounceMs must not be negative: " + debounceMs);
        }
        if (seekToleranceSeconds < 0) {
            throw new IllegalArgumentException(
                    "seekToleranceSeconds must not be negative: " + seekToleranceSeconds);
        }
    }

    public static SyncSettings defaults() {
        return new SyncSettings(100, 0.1, true);
    }
}

package session;

import lombok.NonNull;

/** Session lifecycle events. All callbacks arrive on the control thread. */
public interface SessionListener {

    default void onSessionStarted(@NonNull SessionState session, boolean admin) {}

    /** The admin deleted the session this device follows. No further updates will arrive. */
    default void onSessionEnded(@NonNull String sessionId) {}

    default void onSnapshotApplied(@NonNull TransportSnapshot snapshot) {}

    /** Delivered once per failure; nothing is retried. */
    default void onSessionError(@NonNull SessionException error) {}
}

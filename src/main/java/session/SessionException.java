package session;

import lombok.NonNull;

/** Creating, joining or leaving a session failed. Never retried automatically. */
public class SessionException extends RuntimeException {

    public SessionException(@NonNull String message) {
        super(message);
    }

    public SessionException(@NonNull String message, Throwable cause) {
        super(message, cause);
    }
}

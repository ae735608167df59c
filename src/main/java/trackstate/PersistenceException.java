package trackstate;

import lombok.NonNull;

/** A mix preference could not be read from or written to the document store. */
public class PersistenceException extends RuntimeException {

    public PersistenceException(@NonNull String message) {
        super(message);
    }

    public PersistenceException(@NonNull String message, Throwable cause) {
        super(message, cause);
    }
}

package audio.exceptions;

import lombok.NonNull;

/** Base exception for all per-channel audio errors. */
public class ChannelException extends RuntimeException {

    public ChannelException(@NonNull String message) {
        super(message);
    }

    public ChannelException(@NonNull String message, @NonNull Throwable cause) {
        super(message, cause);
    }

    public ChannelException(@NonNull Throwable cause) {
        super(cause);
    }
}

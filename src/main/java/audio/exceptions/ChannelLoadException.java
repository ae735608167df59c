package audio.exceptions;

import lombok.NonNull;

/** Exception thrown when a channel cannot be loaded from its resource. */
public class ChannelLoadException extends ChannelException {

    public ChannelLoadException(@NonNull String message) {
        super(message);
    }

    public ChannelLoadException(@NonNull String message, @NonNull Throwable cause) {
        super(message, cause);
    }

    public ChannelLoadException(@NonNull Throwable cause) {
        super(cause);
    }
}

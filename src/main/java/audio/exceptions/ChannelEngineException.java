package audio.exceptions;

import lombok.NonNull;

/** Exception for channel engine initialization and state errors. */
public class ChannelEngineException extends ChannelException {

    public ChannelEngineException(@NonNull String message) {
        super(message);
    }

    public ChannelEngineException(@NonNull String message, @NonNull Throwable cause) {
        super(message, cause);
    }

    public ChannelEngineException(@NonNull Throwable cause) {
        super(cause);
    }
}

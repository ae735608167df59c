package audio.exceptions;

import lombok.NonNull;

/** Exception thrown by play, pause, seek, rate and gain commands on a channel. */
public class ChannelPlaybackException extends ChannelException {

    public ChannelPlaybackException(@NonNull String message) {
        super(message);
    }

    public ChannelPlaybackException(@NonNull String message, @NonNull Throwable cause) {
        super(message, cause);
    }

    public ChannelPlaybackException(@NonNull Throwable cause) {
        super(cause);
    }
}

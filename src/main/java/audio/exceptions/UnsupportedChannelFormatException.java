package audio.exceptions;

import lombok.NonNull;

/** Thrown when a resource decodes to a format the output line cannot play. */
public class UnsupportedChannelFormatException extends ChannelLoadException {

    public UnsupportedChannelFormatException(@NonNull String message) {
        super(message);
    }

    public UnsupportedChannelFormatException(@NonNull String message, @NonNull Throwable cause) {
        super(message, cause);
    }
}

package content;

import lombok.NonNull;

/** One stem of a song. Immutable for the duration of playback. */
public record Track(@NonNull String id, @NonNull String name, @NonNull String resourceRef) {}

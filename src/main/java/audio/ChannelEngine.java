package audio;

import com.google.errorprone.annotations.ThreadSafe;
import java.util.concurrent.CompletableFuture;
import lombok.NonNull;

/**
 * Handle-based engine behind every independently controllable audio channel. Each operation is
 * asynchronous and may suspend; failures are reported by completing the returned future
 * exceptionally with a {@link audio.exceptions.ChannelException}.
 */
@ThreadSafe
public interface ChannelEngine extends AutoCloseable {

    /** Decodes the resource and prepares one channel for it. */
    CompletableFuture<ChannelHandle> load(@NonNull String resourceRef);

    CompletableFuture<Void> unload(@NonNull ChannelHandle channel);

    CompletableFuture<Void> play(@NonNull ChannelHandle channel);

    CompletableFuture<Void> pause(@NonNull ChannelHandle channel);

    /** Halts playback and rewinds to the start. */
    CompletableFuture<Void> stop(@NonNull ChannelHandle channel);

    CompletableFuture<Void> setPosition(@NonNull ChannelHandle channel, double seconds);

    CompletableFuture<Void> setRate(@NonNull ChannelHandle channel, float multiplier);

    /** Gain in [0, 1]. */
    CompletableFuture<Void> setGain(@NonNull ChannelHandle channel, float gain);

    CompletableFuture<ChannelStatus> getStatus(@NonNull ChannelHandle channel);

    @Override
    void close();
}

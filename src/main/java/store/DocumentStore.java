package store;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import lombok.NonNull;

/**
 * Shared mutable document addressed by slash-separated paths ({@code sessions/abc/state}), with
 * push notification on change. Values are JSON trees; writes replace the subtree at the path.
 */
public interface DocumentStore {

    CompletableFuture<Void> write(@NonNull String path, @NonNull JsonNode value);

    CompletableFuture<Optional<JsonNode>> read(@NonNull String path);

    /**
     * Delivers the current value at {@code path} once, then again every time it changes. An empty
     * optional means nothing is stored there (never written, or deleted).
     */
    Subscription subscribe(@NonNull String path, @NonNull Consumer<Optional<JsonNode>> callback);

    CompletableFuture<Void> delete(@NonNull String path);
}

package store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.errorprone.annotations.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Process-local DocumentStore. Holds one JSON tree and notifies subscribers of the paths a write
 * or delete touched, on a dedicated notifier executor so callbacks never run inside the caller.
 *
 * <p>Subscribers see values in write order. A change that leaves the value at a subscribed path
 * unchanged is not delivered.
 */
@ThreadSafe
@Slf4j
public class InMemoryDocumentStore implements DocumentStore {

    private final ReentrantLock lock = new ReentrantLock();
    private final ObjectNode root = JsonNodeFactory.instance.objectNode();
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();
    private final Executor notifier;

    public InMemoryDocumentStore() {
        this(
                Executors.newSingleThreadExecutor(
                        r -> {
                            Thread t = new Thread(r, "DocumentStoreNotifier");
                            t.setDaemon(true);
                            return t;
                        }));
    }

    public InMemoryDocumentStore(@NonNull Executor notifier) {
        this.notifier = notifier;
    }

    @Override
    public CompletableFuture<Void> write(@NonNull String path, @NonNull JsonNode value) {
        List<String> segments = DocumentPaths.split(path);
        mutate(
                segments,
                () -> {
                    ObjectNode parent = root;
                    for (String segment : segments.subList(0, segments.size() - 1)) {
                        JsonNode child = parent.get(segment);
                        if (!(child instanceof ObjectNode)) {
                            child = parent.putObject(segment);
                        }
                        parent = (ObjectNode) child;
                    }
                    parent.set(segments.get(segments.size() - 1), value.deepCopy());
                });
        log.trace("Wrote {}", path);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Optional<JsonNode>> read(@NonNull String path) {
        List<String> segments = DocumentPaths.split(path);
        lock.lock();
        try {
            return CompletableFuture.completedFuture(valueAt(segments));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Subscription subscribe(
            @NonNull String path, @NonNull Consumer<Optional<JsonNode>> callback) {
        var listener = new Listener(DocumentPaths.split(path), callback);
        Optional<JsonNode> initial;
        lock.lock();
        try {
            listeners.add(listener);
            initial = valueAt(listener.segments);
            listener.lastDelivered = initial;
        } finally {
            lock.unlock();
        }
        deliver(listener, initial);
        log.trace("Subscribed to {}", path);
        return () -> {
            listener.active = false;
            listeners.remove(listener);
        };
    }

    @Override
    public CompletableFuture<Void> delete(@NonNull String path) {
        List<String> segments = DocumentPaths.split(path);
        mutate(segments, () -> remove(root, segments, 0));
        log.trace("Deleted {}", path);
        return CompletableFuture.completedFuture(null);
    }

    int listenerCount() {
        return listeners.size();
    }

    private void mutate(List<String> segments, Runnable change) {
        var pending = new ArrayList<Delivery>();
        lock.lock();
        try {
            change.run();
            for (Listener listener : listeners) {
                if (!DocumentPaths.overlaps(listener.segments, segments)) {
                    continue;
                }
                Optional<JsonNode> current = valueAt(listener.segments);
                if (!Objects.equals(current, listener.lastDelivered)) {
                    listener.lastDelivered = current;
                    pending.add(new Delivery(listener, current));
                }
            }
        } finally {
            lock.unlock();
        }
        for (Delivery delivery : pending) {
            deliver(delivery.listener(), delivery.value());
        }
    }

    private void deliver(Listener listener, Optional<JsonNode> value) {
        notifier.execute(
                () -> {
                    if (!listener.active) {
                        return;
                    }
                    try {
                        listener.callback.accept(value);
                    } catch (Exception e) {
                        log.warn("Error in document subscriber for {}", listener.segments, e);
                    }
                });
    }

    private Optional<JsonNode> valueAt(List<String> segments) {
        JsonNode node = root;
        for (String segment : segments) {
            node = node.get(segment);
            if (node == null || node.isNull()) {
                return Optional.empty();
            }
        }
        return Optional.of(node.deepCopy());
    }

    /** Removes the leaf and prunes parents left empty, so deleted subtrees read as absent. */
    private static boolean remove(ObjectNode parent, List<String> segments, int depth) {
        String segment = segments.get(depth);
        if (depth == segments.size() - 1) {
            parent.remove(segment);
        } else {
            JsonNode child = parent.get(segment);
            if (child instanceof ObjectNode && remove((ObjectNode) child, segments, depth + 1)) {
                parent.remove(segment);
            }
        }
        return parent.isEmpty();
    }

    private static final class Listener {
        private final List<String> segments;
        private final Consumer<Optional<JsonNode>> callback;
        private volatile boolean active = true;
        private Optional<JsonNode> lastDelivered = Optional.empty();

        private Listener(List<String> segments, Consumer<Optional<JsonNode>> callback) {
            this.segments = List.copyOf(segments);
            this.callback = callback;
        }
    }

    private record Delivery(Listener listener, Optional<JsonNode> value) {}
}

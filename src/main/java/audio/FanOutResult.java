package audio;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Per-channel outcome of a {@link ChannelFanOut} batch, in dispatch order. */
public final class FanOutResult<K, R> {

    private final Map<K, R> successes = new LinkedHashMap<>();
    private final Map<K, Throwable> failures = new LinkedHashMap<>();

    void addSuccess(K key, R value) {
        successes.put(key, value);
    }

    void addFailure(K key, Throwable error) {
        failures.put(key, error);
    }

    /** Values keyed by channel. A {@code null} value is kept for operations returning nothing. */
    public Map<K, R> successes() {
        return Collections.unmodifiableMap(successes);
    }

    public Map<K, Throwable> failures() {
        return Collections.unmodifiableMap(failures);
    }

    public boolean allSucceeded() {
        return failures.isEmpty();
    }

    public int size() {
        return successes.size() + failures.size();
    }

    @Override
    public String toString() {
        return "FanOutResult[ok=" + successes.keySet() + ", failed=" + failures.keySet() + "]";
    }
}

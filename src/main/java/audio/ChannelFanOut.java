package audio;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;
import lombok.NonNull;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/**
 * Issues one operation to many channels at once and waits for every one of them to settle.
 *
 * <p>The returned future never completes exceptionally: each key ends up either in {@link
 * FanOutResult#successes()} or in {@link FanOutResult#failures()}, so a single failing channel can
 * neither abort nor block the batch.
 */
@Slf4j
@UtilityClass
public class ChannelFanOut {

    public <K, R> CompletableFuture<FanOutResult<K, R>> fanOut(
            @NonNull Collection<K> keys, @NonNull Function<K, CompletableFuture<R>> operation) {
        List<K> order = new ArrayList<>(keys);
        List<CompletableFuture<Outcome<R>>> settled = new ArrayList<>(order.size());
        for (K key : order) {
            settled.add(settle(key, operation));
        }
        return CompletableFuture.allOf(settled.toArray(new CompletableFuture<?>[0]))
                .thenApply(
                        ignored -> {
                            var result = new FanOutResult<K, R>();
                            for (int i = 0; i < order.size(); i++) {
                                Outcome<R> outcome = settled.get(i).join();
                                if (outcome.error() == null) {
                                    result.addSuccess(order.get(i), outcome.value());
                                } else {
                                    result.addFailure(order.get(i), outcome.error());
                                }
                            }
                            return result;
                        });
    }

    /** Unwraps the completion wrappers that {@link CompletableFuture} adds around a cause. */
    public Throwable rootCause(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private <K, R> CompletableFuture<Outcome<R>> settle(
            K key, Function<K, CompletableFuture<R>> operation) {
        CompletableFuture<R> future;
        try {
            future = operation.apply(key);
        } catch (RuntimeException e) {
            log.trace("Channel operation for {} failed before dispatch", key, e);
            return CompletableFuture.completedFuture(new Outcome<>(null, e));
        }
        if (future == null) {
            return CompletableFuture.completedFuture(new Outcome<>(null, null));
        }
        return future.handle(
                (value, error) -> new Outcome<>(value, error == null ? null : rootCause(error)));
    }

    private record Outcome<R>(R value, Throwable error) {}
}

package store;

/** Live registration for change notifications. */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    Subscription NONE = () -> {};

    /** Stops further deliveries. Idempotent. */
    void unsubscribe();

    @Override
    default void close() {
        unsubscribe();
    }
}

package audio;

import audio.exceptions.ChannelLoadException;
import audio.exceptions.ChannelPlaybackException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-memory channel engine for tests. Channels are keyed by resource ref; every operation is
 * recorded as {@code "op:ref"} and completes immediately unless loads or status reads are held.
 */
public class FakeChannelEngine implements ChannelEngine {

    private final AtomicLong ids = new AtomicLong();
    private final Map<String, FakeChannel> channels = new HashMap<>();
    private final Map<String, Double> durations = new HashMap<>();
    private final Set<String> failingLoads = new HashSet<>();
    private final Set<String> failingCommands = new HashSet<>();
    private final Set<String> failingStatusReads = new HashSet<>();
    private final List<String> operations = new CopyOnWriteArrayList<>();

    private boolean holdLoads;
    private final List<Runnable> heldLoads = new ArrayList<>();
    private boolean holdStatus;
    private final List<Runnable> heldStatus = new ArrayList<>();

    // Configuration

    public FakeChannelEngine withDuration(String resourceRef, double seconds) {
        durations.put(resourceRef, seconds);
        return this;
    }

    public FakeChannelEngine failLoad(String resourceRef) {
        failingLoads.add(resourceRef);
        return this;
    }

    public FakeChannelEngine failCommands(String resourceRef) {
        failingCommands.add(resourceRef);
        return this;
    }

    /** The next status read of this channel fails; later reads succeed again. */
    public FakeChannelEngine failNextStatus(String resourceRef) {
        failingStatusReads.add(resourceRef);
        return this;
    }

    public void holdLoads(boolean hold) {
        this.holdLoads = hold;
    }

    /** Completes every held load in the order it was requested. */
    public void releaseLoads() {
        var pending = new ArrayList<>(heldLoads);
        heldLoads.clear();
        pending.forEach(Runnable::run);
    }

    public void holdStatus(boolean hold) {
        this.holdStatus = hold;
    }

    public void releaseStatus() {
        var pending = new ArrayList<>(heldStatus);
        heldStatus.clear();
        pending.forEach(Runnable::run);
    }

    // Inspection

    public List<String> operations() {
        return List.copyOf(operations);
    }

    public long count(String operation) {
        return operations.stream().filter(op -> op.startsWith(operation + ":")).count();
    }

    public void clearOperations() {
        operations.clear();
    }

    public FakeChannel channel(String resourceRef) {
        return channels.get(resourceRef);
    }

    public boolean isLoaded(String resourceRef) {
        FakeChannel channel = channels.get(resourceRef);
        return channel != null && channel.loaded;
    }

    public int loadedCount() {
        return (int) channels.values().stream().filter(c -> c.loaded).count();
    }

    /** Moves a channel's playhead, e.g. to its end. */
    public void setPosition(String resourceRef, double seconds) {
        channels.get(resourceRef).position = seconds;
    }

    public void moveToEnd(String resourceRef) {
        FakeChannel channel = channels.get(resourceRef);
        channel.position = channel.duration;
    }

    // ChannelEngine

    @Override
    public CompletableFuture<ChannelHandle> load(String resourceRef) {
        operations.add("load:" + resourceRef);
        var future = new CompletableFuture<ChannelHandle>();
        Runnable complete =
                () -> {
                    if (failingLoads.contains(resourceRef)) {
                        future.completeExceptionally(
                                new ChannelLoadException("Cannot load " + resourceRef));
                        return;
                    }
                    var channel =
                            new FakeChannel(
                                    ids.incrementAndGet(),
                                    resourceRef,
                                    durations.getOrDefault(resourceRef, 10.0));
                    channels.put(resourceRef, channel);
                    future.complete(channel);
                };
        if (holdLoads) {
            heldLoads.add(complete);
        } else {
            complete.run();
        }
        return future;
    }

    @Override
    public CompletableFuture<Void> unload(ChannelHandle handle) {
        return command(
                "unload",
                handle,
                c -> {
                    c.loaded = false;
                    c.playing = false;
                });
    }

    @Override
    public CompletableFuture<Void> play(ChannelHandle handle) {
        return command("play", handle, c -> c.playing = true);
    }

    @Override
    public CompletableFuture<Void> pause(ChannelHandle handle) {
        return command("pause", handle, c -> c.playing = false);
    }

    @Override
    public CompletableFuture<Void> stop(ChannelHandle handle) {
        return command(
                "stop",
                handle,
                c -> {
                    c.playing = false;
                    c.position = 0;
                });
    }

    @Override
    public CompletableFuture<Void> setPosition(ChannelHandle handle, double seconds) {
        return command("setPosition", handle, c -> c.position = seconds);
    }

    @Override
    public CompletableFuture<Void> setRate(ChannelHandle handle, float rate) {
        return command("setRate", handle, c -> c.rate = rate);
    }

    @Override
    public CompletableFuture<Void> setGain(ChannelHandle handle, float gain) {
        return command("setGain", handle, c -> c.gain = gain);
    }

    @Override
    public CompletableFuture<ChannelStatus> getStatus(ChannelHandle handle) {
        operations.add("getStatus:" + handle.getResourceRef());
        FakeChannel channel = (FakeChannel) handle;
        if (failingStatusReads.remove(handle.getResourceRef())) {
            return CompletableFuture.failedFuture(
                    new ChannelPlaybackException("Status unavailable for " + handle));
        }
        // Captured now; a held read delivers what the channel reported when asked
        ChannelStatus status =
                channel.loaded
                        ? new ChannelStatus(true, channel.position, channel.duration)
                        : ChannelStatus.unloaded();
        var future = new CompletableFuture<ChannelStatus>();
        Runnable complete = () -> future.complete(status);
        if (holdStatus) {
            heldStatus.add(complete);
        } else {
            complete.run();
        }
        return future;
    }

    @Override
    public void close() {
        channels.values().forEach(c -> c.loaded = false);
    }

    private CompletableFuture<Void> command(
            String name, ChannelHandle handle, Consumer<FakeChannel> effect) {
        operations.add(name + ":" + handle.getResourceRef());
        if (failingCommands.contains(handle.getResourceRef()) && !"unload".equals(name)) {
            return CompletableFuture.failedFuture(
                    new ChannelPlaybackException(name + " failed on " + handle.getResourceRef()));
        }
        effect.accept((FakeChannel) handle);
        return CompletableFuture.completedFuture(null);
    }

    /** Recorded state of one fake channel. */
    public static final class FakeChannel implements ChannelHandle {
        private final long id;
        private final String resourceRef;
        private final double duration;
        volatile boolean loaded = true;
        volatile boolean playing;
        volatile double position;
        volatile float rate = 1.0f;
        volatile float gain = 1.0f;

        FakeChannel(long id, String resourceRef, double duration) {
            this.id = id;
            this.resourceRef = resourceRef;
            this.duration = duration;
        }

        @Override
        public String getResourceRef() {
            return resourceRef;
        }

        @Override
        public boolean isValid() {
            return loaded;
        }

        @Override
        public long getId() {
            return id;
        }

        public boolean isPlaying() {
            return playing;
        }

        public double getPosition() {
            return position;
        }

        public float getRate() {
            return rate;
        }

        public float getGain() {
            return gain;
        }
    }
}

package queue;

import content.ContentStore;
import content.Song;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import playback.PlaybackTransport;
import playback.TransportListener;

/**
 * Ordered list of songs played one after another through the transport.
 *
 * <p>When the transport reports a finished song the queue restarts it (repeat single), advances
 * to the next song, wraps to the first one (repeat queue) or completes. Every switch goes through
 * {@link PlaybackTransport#load}, which unloads the previous channel set before loading the next.
 *
 * <p>Must be used from the control thread.
 */
@Slf4j
public class QueueController implements TransportListener, AutoCloseable {

    public enum State {
        IDLE,
        PLAYING,
        COMPLETE
    }

    private final PlaybackTransport transport;
    private final ContentStore content;
    private final Random random;
    private final List<QueueListener> listeners = new CopyOnWriteArrayList<>();

    private List<Song> songs = List.of();
    private int currentIndex = -1;
    private QueueMode mode = QueueMode.PLAYLIST;
    private State state = State.IDLE;
    private boolean repeatSingle;
    private boolean repeatQueue;
    private boolean shuffle;
    private final Set<Integer> played = new HashSet<>();

    // Set only when a finished song advances the queue; consumed by the next switch.
    private boolean autoStart;

    public QueueController(@NonNull PlaybackTransport transport, @NonNull ContentStore content) {
        this(transport, content, new Random());
    }

    public QueueController(
            @NonNull PlaybackTransport transport,
            @NonNull ContentStore content,
            @NonNull Random random) {
        this.transport = transport;
        this.content = content;
        this.random = random;
        transport.addListener(this);
    }

    public void addListener(@NonNull QueueListener listener) {
        listeners.add(listener);
    }

    public void removeListener(@NonNull QueueListener listener) {
        listeners.remove(listener);
    }

    /** Start a queue over songs looked up in the content store. */
    public void startByIds(@NonNull List<String> songIds, @NonNull QueueMode mode, int startIndex) {
        var resolved = new ArrayList<Song>(songIds.size());
        for (String songId : songIds) {
            resolved.add(
                    content.getSong(songId)
                            .orElseThrow(
                                    () -> new IllegalArgumentException("Unknown song: " + songId)));
        }
        start(resolved, mode, startIndex);
    }

    /** Replace any current queue and load the song at {@code startIndex}. */
    public void start(@NonNull List<Song> queue, @NonNull QueueMode mode, int startIndex) {
        if (queue.isEmpty()) {
            throw new IllegalArgumentException("Queue must contain at least one song");
        }
        checkIndex(startIndex, queue.size());
        this.songs = List.copyOf(queue);
        this.mode = mode;
        this.played.clear();
        this.autoStart = false;
        log.info("Starting {} queue of {} songs at {}", mode, songs.size(), startIndex);
        switchTo(startIndex);
    }

    public void next() {
        if (!hasQueue()) {
            log.warn("Next requested without a queue");
            return;
        }
        int target = shuffle ? randomOtherIndex() : currentIndex + 1;
        if (target >= songs.size()) {
            if (!repeatQueue) {
                log.debug("Already at the last song");
                return;
            }
            target = 0;
        }
        switchTo(target);
    }

    public void previous() {
        if (!hasQueue()) {
            log.warn("Previous requested without a queue");
            return;
        }
        int target = shuffle ? randomOtherIndex() : currentIndex - 1;
        if (target < 0) {
            if (!repeatQueue) {
                log.debug("Already at the first song");
                return;
            }
            target = songs.size() - 1;
        }
        switchTo(target);
    }

    public void jumpTo(int index) {
        if (!hasQueue()) {
            log.warn("Jump requested without a queue");
            return;
        }
        checkIndex(index, songs.size());
        switchTo(index);
    }

    /** Discard the queue and unload the transport. */
    public void exit() {
        if (!hasQueue()) {
            return;
        }
        log.info("Leaving queue");
        songs = List.of();
        currentIndex = -1;
        state = State.IDLE;
        played.clear();
        autoStart = false;
        transport.unload();
    }

    private void switchTo(int index) {
        boolean play = mode == QueueMode.PLAYLIST || consumeAutoStart();
        state = State.PLAYING;
        currentIndex = index;
        played.add(index);
        Song song = songs.get(index);
        log.debug("Switching to song {} ({}/{})", song.id(), index + 1, songs.size());
        notify(l -> l.onSongChanged(song, index));
        transport
                .load(song)
                .thenAccept(
                        ctx -> {
                            if (play && transport.isCurrent(ctx)) {
                                transport.play();
                            }
                        })
                .exceptionally(
                        error -> {
                            log.error("Failed to start song {}", song.id(), error);
                            return null;
                        });
    }

    private boolean consumeAutoStart() {
        boolean start = autoStart;
        autoStart = false;
        return start;
    }

    @Override
    public void onFinished(Song song) {
        if (state != State.PLAYING || !song.id().equals(songs.get(currentIndex).id())) {
            return;
        }
        if (repeatSingle) {
            log.debug("Repeating song {}", song.id());
            transport.restart();
            return;
        }
        int target = nextAfterFinished();
        if (target < 0) {
            state = State.COMPLETE;
            log.info("Queue complete after {} songs", songs.size());
            notify(QueueListener::onQueueComplete);
            return;
        }
        autoStart = true;
        switchTo(target);
    }

    private int nextAfterFinished() {
        if (shuffle) {
            if (played.size() >= songs.size()) {
                if (!repeatQueue) {
                    return -1;
                }
                played.clear();
            }
            var unplayed = new ArrayList<Integer>();
            for (int i = 0; i < songs.size(); i++) {
                if (!played.contains(i)) {
                    unplayed.add(i);
                }
            }
            return unplayed.get(random.nextInt(unplayed.size()));
        }
        if (currentIndex + 1 < songs.size()) {
            return currentIndex + 1;
        }
        return repeatQueue ? 0 : -1;
    }

    private int randomOtherIndex() {
        if (songs.size() == 1) {
            return 0;
        }
        int pick = random.nextInt(songs.size() - 1);
        return pick >= currentIndex ? pick + 1 : pick;
    }

    // Modes

    public void setRepeatSingle(boolean repeatSingle) {
        this.repeatSingle = repeatSingle;
    }

    public void setRepeatQueue(boolean repeatQueue) {
        this.repeatQueue = repeatQueue;
    }

    public void setShuffle(boolean shuffle) {
        this.shuffle = shuffle;
        played.clear();
        if (currentIndex >= 0) {
            played.add(currentIndex);
        }
    }

    public boolean toggleRepeatSingle() {
        setRepeatSingle(!repeatSingle);
        return repeatSingle;
    }

    public boolean toggleRepeatQueue() {
        setRepeatQueue(!repeatQueue);
        return repeatQueue;
    }

    public boolean toggleShuffle() {
        setShuffle(!shuffle);
        return shuffle;
    }

    // Queries

    public State getState() {
        return state;
    }

    public int getCurrentIndex() {
        return currentIndex;
    }

    public QueueStatus getStatus() {
        return new QueueStatus(
                state,
                mode,
                songs.stream().map(Song::id).toList(),
                currentIndex,
                repeatSingle,
                repeatQueue,
                shuffle);
    }

    private boolean hasQueue() {
        return !songs.isEmpty();
    }

    private static void checkIndex(int index, int size) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException(
                    "Queue index " + index + " out of range [0, " + size + ")");
        }
    }

    private void notify(Consumer<QueueListener> event) {
        for (QueueListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (Exception e) {
                log.warn("Error in queue listener", e);
            }
        }
    }

    @Override
    public void close() {
        transport.removeListener(this);
    }
}

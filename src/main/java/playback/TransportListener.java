package playback;

import content.Song;
import lombok.NonNull;

/** Listener interface for transport events. All callbacks arrive on the control thread. */
public interface TransportListener {

    /**
     * Called whenever the phase or any transport field changes, except for progress ticks.
     *
     * @param state The state after the change
     */
    default void onTransportChanged(@NonNull TransportState state) {}

    /**
     * Called after each progress poll while playing. Frequency is the configured progress
     * interval, typically 50ms.
     *
     * @param state The state including the freshly polled positions
     */
    default void onPositionTick(@NonNull TransportState state) {}

    /**
     * Called once a user-level command has been applied to every channel.
     *
     * @param command The command that completed
     * @param state The state after the command
     */
    default void onCommandApplied(
            @NonNull TransportCommand command, @NonNull TransportState state) {}

    /**
     * Called when a song finished loading and the transport reached READY.
     *
     * @param context The context of the loaded song
     */
    default void onContextReady(@NonNull PlaybackContext context) {}

    /**
     * Called when a context is torn down by a song switch or unload.
     *
     * @param context The context that was closed
     */
    default void onContextClosed(@NonNull PlaybackContext context) {}

    /**
     * Called when every active channel reached its end.
     *
     * @param song The song that finished
     */
    default void onFinished(@NonNull Song song) {}
}

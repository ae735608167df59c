package playback;

/** User-level transport commands, reported to listeners once their fan-out has settled. */
public enum TransportCommand {
    PLAY,
    PAUSE,
    SEEK,
    SET_SPEED,
    RESTART,
    STOP
}

package audio;

import com.google.errorprone.annotations.ThreadSafe;

@ThreadSafe
public record ChannelStatus(boolean loaded, double positionSeconds, double durationSeconds) {

    public static ChannelStatus unloaded() {
        return new ChannelStatus(false, 0, 0);
    }

    /** True when the channel has a known duration and its position has reached it. */
    public boolean isAtEnd() {
        return loaded && durationSeconds > 0 && positionSeconds >= durationSeconds;
    }
}

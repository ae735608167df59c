package audio.javasound;

import audio.ChannelHandle;
import javax.sound.sampled.Clip;
import lombok.Getter;
import lombok.NonNull;

/** Java Sound implementation of ChannelHandle; one open {@link Clip} per channel. */
class JavaSoundChannelHandle implements ChannelHandle {

    @Getter private final long id;
    @Getter @NonNull private final String resourceRef;
    private final Clip clip;
    private volatile boolean valid = true;

    JavaSoundChannelHandle(long id, @NonNull String resourceRef, @NonNull Clip clip) {
        this.id = id;
        this.resourceRef = resourceRef;
        this.clip = clip;
    }

    Clip getClip() {
        return clip;
    }

    void invalidate() {
        valid = false;
    }

    @Override
    public boolean isValid() {
        return valid && clip.isOpen();
    }

    @Override
    public String toString() {
        return "JavaSoundChannelHandle[" + id + ", " + resourceRef + "]";
    }
}

package audio;

import com.google.errorprone.annotations.ThreadSafe;

/** Immutable handle to one loaded channel managed by the engine. */
@ThreadSafe
public interface ChannelHandle {

    String getResourceRef();

    /** False once unloaded. */
    boolean isValid();

    long getId();
}

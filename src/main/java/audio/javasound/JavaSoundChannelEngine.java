package audio.javasound;

import audio.ChannelEngine;
import audio.ChannelHandle;
import audio.ChannelStatus;
import audio.exceptions.ChannelEngineException;
import audio.exceptions.ChannelLoadException;
import audio.exceptions.ChannelPlaybackException;
import audio.exceptions.UnsupportedChannelFormatException;
import com.google.errorprone.annotations.ThreadSafe;
import java.io.File;
import java.io.IOException;
import java.net.URI;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Function;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.Clip;
import javax.sound.sampled.FloatControl;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.UnsupportedAudioFileException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * ChannelEngine backed by {@code javax.sound.sampled}. Every channel is a fully decoded {@link
 * Clip}; blocking line calls run on a small worker pool so callers only ever see futures.
 *
 * <p>Resource references are file paths, or URIs when they contain a scheme.
 */
@ThreadSafe
@Slf4j
public class JavaSoundChannelEngine implements ChannelEngine {

    private final ExecutorService workers;
    private final AtomicLong nextHandleId = new AtomicLong(1);
    private final Map<Long, JavaSoundChannelHandle> openChannels = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public JavaSoundChannelEngine() {
        this.workers =
                Executors.newCachedThreadPool(
                        r -> {
                            Thread t = new Thread(r, "ChannelWorker");
                            t.setDaemon(true);
                            return t;
                        });
    }

    @Override
    public CompletableFuture<ChannelHandle> load(@NonNull String resourceRef) {
        return CompletableFuture.supplyAsync(() -> open(resourceRef), workers);
    }

    @Override
    public CompletableFuture<Void> unload(@NonNull ChannelHandle channel) {
        return run(
                channel,
                handle -> {
                    openChannels.remove(handle.getId());
                    handle.invalidate();
                    handle.getClip().close();
                    log.debug("Unloaded channel {}", handle);
                });
    }

    @Override
    public CompletableFuture<Void> play(@NonNull ChannelHandle channel) {
        return run(channel, handle -> handle.getClip().start());
    }

    @Override
    public CompletableFuture<Void> pause(@NonNull ChannelHandle channel) {
        return run(channel, handle -> handle.getClip().stop());
    }

    @Override
    public CompletableFuture<Void> stop(@NonNull ChannelHandle channel) {
        return run(
                channel,
                handle -> {
                    handle.getClip().stop();
                    handle.getClip().setFramePosition(0);
                });
    }

    @Override
    public CompletableFuture<Void> setPosition(@NonNull ChannelHandle channel, double seconds) {
        return run(
                channel,
                handle -> {
                    long micros = (long) (Math.max(0, seconds) * 1_000_000L);
                    handle.getClip()
                            .setMicrosecondPosition(
                                    Math.min(micros, handle.getClip().getMicrosecondLength()));
                });
    }

    @Override
    public CompletableFuture<Void> setRate(@NonNull ChannelHandle channel, float multiplier) {
        return run(
                channel,
                handle -> {
                    Clip clip = handle.getClip();
                    if (!clip.isControlSupported(FloatControl.Type.SAMPLE_RATE)) {
                        throw new ChannelPlaybackException(
                                "Rate control not supported by line for " + handle);
                    }
                    var control = (FloatControl) clip.getControl(FloatControl.Type.SAMPLE_RATE);
                    float target = clip.getFormat().getSampleRate() * multiplier;
                    control.setValue(clamp(target, control.getMinimum(), control.getMaximum()));
                });
    }

    @Override
    public CompletableFuture<Void> setGain(@NonNull ChannelHandle channel, float gain) {
        return run(
                channel,
                handle -> {
                    Clip clip = handle.getClip();
                    if (clip.isControlSupported(FloatControl.Type.MASTER_GAIN)) {
                        var control = (FloatControl) clip.getControl(FloatControl.Type.MASTER_GAIN);
                        control.setValue(
                                clamp(
                                        gainToDecibels(gain),
                                        control.getMinimum(),
                                        control.getMaximum()));
                    } else if (clip.isControlSupported(FloatControl.Type.VOLUME)) {
                        var control = (FloatControl) clip.getControl(FloatControl.Type.VOLUME);
                        control.setValue(clamp(gain, control.getMinimum(), control.getMaximum()));
                    } else {
                        throw new ChannelPlaybackException(
                                "Gain control not supported by line for " + handle);
                    }
                });
    }

    @Override
    public CompletableFuture<ChannelStatus> getStatus(@NonNull ChannelHandle channel) {
        return call(
                channel,
                handle -> {
                    Clip clip = handle.getClip();
                    if (!handle.isValid()) {
                        return ChannelStatus.unloaded();
                    }
                    return new ChannelStatus(
                            true,
                            clip.getMicrosecondPosition() / 1_000_000.0,
                            clip.getMicrosecondLength() / 1_000_000.0);
                });
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            for (JavaSoundChannelHandle handle : openChannels.values()) {
                handle.invalidate();
                handle.getClip().close();
            }
            openChannels.clear();
            workers.shutdown();
            log.debug("Java Sound channel engine closed");
        }
    }

    /** Linear gain to decibels; zero and below map to negative infinity. */
    static float gainToDecibels(float gain) {
        if (gain <= 0f) {
            return Float.NEGATIVE_INFINITY;
        }
        return (float) (20.0 * Math.log10(Math.min(gain, 1f)));
    }

    private static float clamp(float value, float min, float max) {
        return Math.max(min, Math.min(max, value));
    }

    private JavaSoundChannelHandle open(String resourceRef) {
        if (closed.get()) {
            throw new ChannelEngineException("Engine is closed");
        }
        try (AudioInputStream source = openStream(resourceRef)) {
            AudioInputStream pcm = toPcm(source);
            Clip clip = AudioSystem.getClip();
            clip.open(pcm);
            var handle =
                    new JavaSoundChannelHandle(nextHandleId.getAndIncrement(), resourceRef, clip);
            openChannels.put(handle.getId(), handle);
            log.debug("Loaded channel {} ({} s)", handle, clip.getMicrosecondLength() / 1e6);
            return handle;
        } catch (UnsupportedAudioFileException e) {
            throw new UnsupportedChannelFormatException(
                    "Unsupported audio format: " + resourceRef, e);
        } catch (IOException | LineUnavailableException | IllegalArgumentException e) {
            throw new ChannelLoadException("Failed to load channel: " + resourceRef, e);
        }
    }

    private static AudioInputStream openStream(String resourceRef)
            throws UnsupportedAudioFileException, IOException {
        if (resourceRef.contains("://")) {
            return AudioSystem.getAudioInputStream(URI.create(resourceRef).toURL());
        }
        return AudioSystem.getAudioInputStream(new File(resourceRef));
    }

    private static AudioInputStream toPcm(AudioInputStream source) {
        AudioFormat format = source.getFormat();
        if (format.getEncoding() == AudioFormat.Encoding.PCM_SIGNED) {
            return source;
        }
        var pcmFormat =
                new AudioFormat(
                        AudioFormat.Encoding.PCM_SIGNED,
                        format.getSampleRate(),
                        16,
                        format.getChannels(),
                        format.getChannels() * 2,
                        format.getSampleRate(),
                        false);
        return AudioSystem.getAudioInputStream(pcmFormat, source);
    }

    private CompletableFuture<Void> run(
            ChannelHandle channel, Consumer<JavaSoundChannelHandle> action) {
        return call(
                channel,
                handle -> {
                    action.accept(handle);
                    return null;
                });
    }

    private <T> CompletableFuture<T> call(
            ChannelHandle channel, Function<JavaSoundChannelHandle, T> action) {
        if (!(channel instanceof JavaSoundChannelHandle)) {
            return CompletableFuture.failedFuture(
                    new ChannelPlaybackException("Foreign channel handle: " + channel));
        }
        JavaSoundChannelHandle handle = (JavaSoundChannelHandle) channel;
        if (!handle.getClip().isOpen()) {
            return CompletableFuture.failedFuture(
                    new ChannelPlaybackException("Channel not loaded: " + handle));
        }
        return CompletableFuture.supplyAsync(() -> action.apply(handle), workers);
    }
}

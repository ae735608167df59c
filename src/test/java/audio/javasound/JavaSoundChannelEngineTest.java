package audio.javasound;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import annotations.Audio;
import audio.ChannelHandle;
import audio.ChannelStatus;
import audio.exceptions.ChannelEngineException;
import audio.exceptions.ChannelLoadException;
import audio.exceptions.ChannelPlaybackException;
import audio.exceptions.UnsupportedChannelFormatException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.LineUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

@Slf4j
class JavaSoundChannelEngineTest {

    @TempDir Path tempDir;

    private JavaSoundChannelEngine engine;

    @BeforeEach
    void setUp() {
        engine = new JavaSoundChannelEngine();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void testGainToDecibels() {
        assertEquals(0f, JavaSoundChannelEngine.gainToDecibels(1f), 1e-6);
        assertEquals(-6.0206f, JavaSoundChannelEngine.gainToDecibels(0.5f), 1e-3);
        assertEquals(-20f, JavaSoundChannelEngine.gainToDecibels(0.1f), 1e-3);
        assertEquals(Float.NEGATIVE_INFINITY, JavaSoundChannelEngine.gainToDecibels(0f));
        assertEquals(0f, JavaSoundChannelEngine.gainToDecibels(1.5f), 1e-6);
    }

    @Test
    @Timeout(5)
    void testMissingFileFailsToLoad() {
        String missing = tempDir.resolve("missing.wav").toString();

        var error =
                assertThrows(
                        ExecutionException.class,
                        () -> engine.load(missing).get(2, TimeUnit.SECONDS));

        assertInstanceOf(ChannelLoadException.class, error.getCause());
        assertTrue(error.getCause().getMessage().contains("missing.wav"));
    }

    @Test
    @Timeout(5)
    void testNonAudioFileIsUnsupported() throws IOException {
        Path text = Files.writeString(tempDir.resolve("notes.wav"), "not a wave file at all");

        var error =
                assertThrows(
                        ExecutionException.class,
                        () -> engine.load(text.toString()).get(2, TimeUnit.SECONDS));

        assertInstanceOf(UnsupportedChannelFormatException.class, error.getCause());
    }

    @Test
    void testForeignHandleIsRejected() {
        ChannelHandle foreign =
                new ChannelHandle() {
                    @Override
                    public String getResourceRef() {
                        return "elsewhere.wav";
                    }

                    @Override
                    public boolean isValid() {
                        return true;
                    }

                    @Override
                    public long getId() {
                        return 99;
                    }
                };

        var error = assertThrows(ExecutionException.class, () -> engine.play(foreign).get());
        assertInstanceOf(ChannelPlaybackException.class, error.getCause());
    }

    @Test
    @Timeout(5)
    void testClosedEngineRejectsLoads() {
        engine.close();

        var error =
                assertThrows(
                        ExecutionException.class,
                        () -> engine.load("any.wav").get(2, TimeUnit.SECONDS));
        assertInstanceOf(ChannelEngineException.class, error.getCause());
    }

    @Test
    @Audio
    @Timeout(10)
    void testLoadSeekAndUnloadClip() throws Exception {
        assumeTrue(clipAvailable(), "No Java Sound clip line on this host");
        Path wav = writeSilence(tempDir.resolve("silence.wav"), 1.0f);

        ChannelHandle handle = engine.load(wav.toString()).get(5, TimeUnit.SECONDS);
        assertTrue(handle.isValid());
        assertEquals(wav.toString(), handle.getResourceRef());

        ChannelStatus status = engine.getStatus(handle).get(2, TimeUnit.SECONDS);
        assertTrue(status.loaded());
        assertEquals(1.0, status.durationSeconds(), 0.01);
        assertEquals(0.0, status.positionSeconds(), 0.01);

        engine.setPosition(handle, 0.5).get(2, TimeUnit.SECONDS);
        assertEquals(0.5, engine.getStatus(handle).get().positionSeconds(), 0.01);

        engine.setPosition(handle, 5.0).get(2, TimeUnit.SECONDS);
        assertTrue(engine.getStatus(handle).get().isAtEnd());

        engine.unload(handle).get(2, TimeUnit.SECONDS);
        assertFalse(handle.isValid());
        var error = assertThrows(ExecutionException.class, () -> engine.play(handle).get());
        assertInstanceOf(ChannelPlaybackException.class, error.getCause());
    }

    private static boolean clipAvailable() {
        try {
            AudioSystem.getClip().close();
            return true;
        } catch (LineUnavailableException | IllegalArgumentException | SecurityException e) {
            log.info("Skipping Java Sound test: {}", e.getMessage());
            return false;
        }
    }

    private static Path writeSilence(Path target, float seconds) throws IOException {
        var format = new AudioFormat(44_100f, 16, 1, true, false);
        int frames = (int) (format.getFrameRate() * seconds);
        byte[] pcm = new byte[frames * format.getFrameSize()];
        try (var stream =
                new AudioInputStream(new ByteArrayInputStream(pcm), format, frames)) {
            AudioSystem.write(stream, AudioFileFormat.Type.WAVE, target.toFile());
        }
        return target;
    }
}

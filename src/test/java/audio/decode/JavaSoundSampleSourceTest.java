package audio.decode;

import static org.junit.jupiter.api.Assertions.*;

import audio.DecodedStream;
import audio.WavFixtures;
import audio.exceptions.AudioLoadException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JavaSoundSampleSourceTest {

    @TempDir Path dir;

    private final JavaSoundSampleSource source = new JavaSoundSampleSource();

    @Test
    void testSupportsByExtension() {
        assertTrue(source.supports(Path.of("a.wav")));
        assertTrue(source.supports(Path.of("a.AIFF")));
        assertFalse(source.supports(Path.of("a.mp3")));
        assertFalse(source.supports(Path.of("a.m4a")));
    }

    @Test
    void testReadsFormatAndDuration() throws IOException {
        Path wav = WavFixtures.writeTone(dir.resolve("tone.wav"), 22050, 2, 2.0);

        try (DecodedStream stream = source.open(wav)) {
            assertEquals(22050, stream.sampleRate());
            assertEquals(2, stream.channelCount());
            assertEquals(2.0, stream.totalDuration().orElseThrow(), 1e-6);
        }
    }

    @Test
    void testDecodesEverySampleAsFloat() throws IOException {
        Path wav = WavFixtures.writeTone(dir.resolve("tone.wav"), 8000, 1, 0.5, 0.5f);

        int total = 0;
        float peak = 0f;
        try (DecodedStream stream = source.open(wav)) {
            float[] buffer = new float[1000];
            int n;
            while ((n = stream.read(buffer, 0, buffer.length)) >= 0) {
                for (int i = 0; i < n; i++) {
                    peak = Math.max(peak, Math.abs(buffer[i]));
                }
                total += n;
            }
        }

        assertEquals(4000, total);
        assertEquals(0.5f, peak, 1e-3);
    }

    @Test
    void testSeekSkipsAhead() throws IOException {
        Path wav = WavFixtures.writeTone(dir.resolve("tone.wav"), 8000, 2, 1.0);

        int remaining = 0;
        try (DecodedStream stream = source.open(wav)) {
            stream.seek(0.75);
            float[] buffer = new float[512];
            int n;
            while ((n = stream.read(buffer, 0, buffer.length)) >= 0) {
                remaining += n;
            }
        }

        assertEquals(4000, remaining);
    }

    @Test
    void testMissingFile() {
        assertThrows(AudioLoadException.class, () -> source.open(dir.resolve("nope.wav")));
    }

    @Test
    void testGarbageFailsToLoad() throws IOException {
        Path bogus = Files.write(dir.resolve("bogus.wav"), "not a riff header at all".getBytes());

        assertThrows(AudioLoadException.class, () -> source.open(bogus));
    }
}

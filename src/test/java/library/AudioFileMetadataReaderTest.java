package library;

import static org.junit.jupiter.api.Assertions.*;

import audio.AudioReadException;
import audio.WavFixtures;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AudioFileMetadataReaderTest {

    @TempDir Path dir;

    private final AudioFileMetadataReader reader = new AudioFileMetadataReader();

    @Test
    void testReadsWavProperties() throws IOException {
        Path wav = WavFixtures.writeTone(dir.resolve("tone.wav"), 22050, 2, 1.5);

        TrackMetadata metadata = reader.read(wav);

        assertEquals(1.5, metadata.durationSeconds(), 1e-6);
        assertEquals(22050, metadata.sampleRate());
        assertEquals(2, metadata.channels());
        assertEquals(705, metadata.bitrate());
        assertNull(metadata.title());
        assertFalse(metadata.hasAlbumArt());
    }

    @Test
    void testMissingFile() {
        AudioReadException e =
                assertThrows(AudioReadException.class, () -> reader.read(dir.resolve("gone.wav")));
        assertEquals(dir.resolve("gone.wav"), e.getAudioFile());
    }

    @Test
    void testMp3WithoutFrames() throws IOException {
        Path mp3 = Files.write(dir.resolve("silent.mp3"), new byte[512]);

        assertThrows(AudioReadException.class, () -> reader.read(mp3));
    }

    @Test
    void testUnsupportedFormat() throws IOException {
        Path m4a = Files.write(dir.resolve("song.m4a"), "ftypM4A garbage".getBytes());

        assertThrows(AudioReadException.class, () -> reader.read(m4a));
    }
}

package audio.decode;

import audio.AudioFiles;
import audio.DecodedStream;
import audio.SampleSource;
import audio.exceptions.AudioLoadException;
import audio.exceptions.AudioSeekException;
import audio.exceptions.UnsupportedAudioFormatException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.OptionalDouble;
import java.util.Set;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Decodes anything the installed Java Sound providers can convert to signed 16-bit PCM. The JDK
 * covers WAV, AIFF and AU; FLAC and Ogg work when a provider for them is on the classpath.
 */
@Slf4j
public class JavaSoundSampleSource implements SampleSource {

    private static final Set<String> EXTENSIONS = Set.of("wav", "aif", "aiff", "au", "flac", "ogg");

    @Override
    public boolean supports(@NonNull Path track) {
        return EXTENSIONS.contains(AudioFiles.extension(track));
    }

    @Override
    public DecodedStream open(@NonNull Path track) {
        if (!Files.isRegularFile(track)) {
            throw new AudioLoadException("File not found: " + track);
        }
        return new JavaSoundStream(track);
    }

    private static final class JavaSoundStream implements DecodedStream {

        private final Path track;
        private final int sampleRate;
        private final int channels;
        private final OptionalDouble duration;
        private AudioInputStream pcm;
        private byte[] bytes = new byte[0];

        JavaSoundStream(Path track) {
            this.track = track;
            AudioInputStream raw = openRaw(track);
            AudioFormat base = raw.getFormat();
            this.sampleRate = Math.round(base.getSampleRate());
            this.channels = base.getChannels();
            long frames = raw.getFrameLength();
            float frameRate = base.getFrameRate();
            this.duration =
                    frames != AudioSystem.NOT_SPECIFIED && frameRate > 0
                            ? OptionalDouble.of(frames / (double) frameRate)
                            : OptionalDouble.empty();
            this.pcm = toPcm(raw, track);
        }

        private static AudioInputStream openRaw(Path track) {
            try {
                return AudioSystem.getAudioInputStream(track.toFile());
            } catch (UnsupportedAudioFileException e) {
                throw new UnsupportedAudioFormatException(
                        "Unsupported audio format: " + track.getFileName(), e);
            } catch (IOException e) {
                throw new AudioLoadException("Cannot read " + track.getFileName(), e);
            }
        }

        private static AudioInputStream toPcm(AudioInputStream raw, Path track) {
            AudioFormat base = raw.getFormat();
            AudioFormat target =
                    new AudioFormat(
                            AudioFormat.Encoding.PCM_SIGNED,
                            base.getSampleRate(),
                            16,
                            base.getChannels(),
                            base.getChannels() * 2,
                            base.getSampleRate(),
                            false);
            if (base.matches(target)) {
                return raw;
            }
            if (!AudioSystem.isConversionSupported(target, base)) {
                closeQuietly(raw);
                throw new UnsupportedAudioFormatException(
                        "No PCM conversion for " + base + " in " + track.getFileName());
            }
            return AudioSystem.getAudioInputStream(target, raw);
        }

        @Override
        public int sampleRate() {
            return sampleRate;
        }

        @Override
        public int channelCount() {
            return channels;
        }

        @Override
        public OptionalDouble totalDuration() {
            return duration;
        }

        @Override
        public int read(float[] buffer, int offset, int length) throws IOException {
            int wantedSamples = (length / channels) * channels;
            if (wantedSamples == 0) {
                return 0;
            }
            int wantedBytes = wantedSamples * 2;
            if (bytes.length < wantedBytes) {
                bytes = new byte[wantedBytes];
            }
            int filled = 0;
            while (filled < wantedBytes) {
                int n = pcm.read(bytes, filled, wantedBytes - filled);
                if (n < 0) {
                    break;
                }
                filled += n;
            }
            int samples = filled / 2;
            if (samples == 0) {
                return -1;
            }
            for (int i = 0; i < samples; i++) {
                int lo = bytes[2 * i] & 0xff;
                int hi = bytes[2 * i + 1];
                buffer[offset + i] = (short) ((hi << 8) | lo) / 32768f;
            }
            return samples;
        }

        @Override
        public void seek(double positionSeconds) {
            AudioInputStream reopened = null;
            try {
                reopened = toPcm(openRaw(track), track);
                long skipBytes = (long) (Math.max(0, positionSeconds) * sampleRate) * channels * 2;
                while (skipBytes > 0) {
                    long skipped = reopened.skip(skipBytes);
                    if (skipped <= 0) {
                        break;
                    }
                    skipBytes -= skipped;
                }
            } catch (IOException | AudioLoadException e) {
                if (reopened != null) {
                    closeQuietly(reopened);
                }
                throw new AudioSeekException("Cannot seek " + track.getFileName(), e);
            }
            closeQuietly(pcm);
            pcm = reopened;
        }

        @Override
        public void close() {
            closeQuietly(pcm);
        }

        private static void closeQuietly(AudioInputStream stream) {
            try {
                stream.close();
            } catch (IOException e) {
                log.debug("Error closing audio stream", e);
            }
        }
    }
}

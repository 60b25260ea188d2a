package audio.decode;

import audio.AudioFiles;
import audio.DecodedStream;
import audio.SampleSource;
import audio.exceptions.AudioLoadException;
import audio.exceptions.AudioSeekException;
import audio.exceptions.CorruptedAudioFileException;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.OptionalDouble;
import javazoom.jl.decoder.Bitstream;
import javazoom.jl.decoder.BitstreamException;
import javazoom.jl.decoder.Decoder;
import javazoom.jl.decoder.DecoderException;
import javazoom.jl.decoder.Header;
import javazoom.jl.decoder.SampleBuffer;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * MPEG audio decoding with JLayer. Duration is estimated from the first frame header and the file
 * size, so it is exact only for constant bitrate files. Seeking skips whole frames from the start
 * of the file.
 */
@Slf4j
public class Mp3SampleSource implements SampleSource {

    @Override
    public boolean supports(@NonNull Path track) {
        return "mp3".equals(AudioFiles.extension(track));
    }

    @Override
    public DecodedStream open(@NonNull Path track) {
        if (!Files.isRegularFile(track)) {
            throw new AudioLoadException("File not found: " + track);
        }
        return new Mp3Stream(track);
    }

    private static final class Mp3Stream implements DecodedStream {

        private final Path track;
        private final int sampleRate;
        private final int channels;
        private final float msPerFrame;
        private final OptionalDouble duration;
        private Bitstream bitstream;
        private Decoder decoder = new Decoder();
        private Header pendingHeader;
        private short[] frame = new short[0];
        private int frameLength;
        private int framePosition;

        Mp3Stream(Path track) {
            this.track = track;
            long fileSize;
            try {
                fileSize = Files.size(track);
            } catch (IOException e) {
                throw new AudioLoadException("Cannot read " + track.getFileName(), e);
            }
            this.bitstream = openBitstream(track);
            Header first;
            try {
                first = bitstream.readFrame();
            } catch (BitstreamException e) {
                closeQuietly(bitstream);
                throw new CorruptedAudioFileException(
                        "Invalid MPEG stream in " + track.getFileName(), e);
            }
            if (first == null) {
                closeQuietly(bitstream);
                throw new CorruptedAudioFileException(
                        "No MPEG frames in " + track.getFileName());
            }
            this.sampleRate = first.frequency();
            this.channels = first.mode() == Header.SINGLE_CHANNEL ? 1 : 2;
            this.msPerFrame = first.ms_per_frame();
            float totalMs = first.total_ms((int) Math.min(Integer.MAX_VALUE, fileSize));
            this.duration =
                    totalMs > 0 ? OptionalDouble.of(totalMs / 1000.0) : OptionalDouble.empty();
            this.pendingHeader = first;
        }

        private static Bitstream openBitstream(Path track) {
            try {
                return new Bitstream(new BufferedInputStream(Files.newInputStream(track)));
            } catch (IOException e) {
                throw new AudioLoadException("Cannot read " + track.getFileName(), e);
            }
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
            if (framePosition >= frameLength && !decodeNextFrame()) {
                return -1;
            }
            int count = Math.min(length, frameLength - framePosition);
            for (int i = 0; i < count; i++) {
                buffer[offset + i] = frame[framePosition + i] / 32768f;
            }
            framePosition += count;
            return count;
        }

        private boolean decodeNextFrame() throws IOException {
            try {
                Header header = pendingHeader != null ? pendingHeader : bitstream.readFrame();
                pendingHeader = null;
                if (header == null) {
                    return false;
                }
                SampleBuffer output = (SampleBuffer) decoder.decodeFrame(header, bitstream);
                int length = output.getBufferLength();
                if (frame.length < length) {
                    frame = new short[length];
                }
                System.arraycopy(output.getBuffer(), 0, frame, 0, length);
                frameLength = length;
                framePosition = 0;
                bitstream.closeFrame();
                return true;
            } catch (BitstreamException | DecoderException e) {
                throw new IOException("MPEG decode failed in " + track.getFileName(), e);
            }
        }

        @Override
        public void seek(double positionSeconds) {
            Bitstream reopened;
            try {
                reopened = openBitstream(track);
            } catch (AudioLoadException e) {
                throw new AudioSeekException("Cannot seek " + track.getFileName(), e);
            }
            long framesToSkip = msPerFrame > 0 ? (long) (positionSeconds * 1000 / msPerFrame) : 0;
            try {
                for (long i = 0; i < framesToSkip; i++) {
                    if (reopened.readFrame() == null) {
                        break;
                    }
                    reopened.closeFrame();
                }
            } catch (BitstreamException e) {
                closeQuietly(reopened);
                throw new AudioSeekException("Cannot seek " + track.getFileName(), e);
            }
            closeQuietly(bitstream);
            bitstream = reopened;
            decoder = new Decoder();
            pendingHeader = null;
            frameLength = 0;
            framePosition = 0;
        }

        @Override
        public void close() {
            closeQuietly(bitstream);
        }

        private static void closeQuietly(Bitstream stream) {
            try {
                stream.close();
            } catch (BitstreamException e) {
                log.debug("Error closing MPEG stream", e);
            }
        }
    }
}

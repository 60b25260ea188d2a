package audio;

import audio.exceptions.AudioSeekException;
import java.io.IOException;
import java.util.OptionalDouble;

/**
 * A lazy, finite, non-restartable sequence of interleaved float samples in [-1.0, 1.0] at a fixed
 * sample rate and channel count. Not thread-safe: one reader at a time.
 */
public interface DecodedStream extends AutoCloseable {

    int sampleRate();

    int channelCount();

    /** Empty when the container does not declare a length. */
    OptionalDouble totalDuration();

    /**
     * Reads up to {@code length} samples. Implementations return whole frames where they can.
     *
     * @return Number of samples read, or -1 once the stream is exhausted
     */
    int read(float[] buffer, int offset, int length) throws IOException;

    /**
     * Repositions the stream. The landing point may be approximate for compressed formats.
     *
     * @throws AudioSeekException if the stream cannot be repositioned
     */
    void seek(double positionSeconds);

    @Override
    void close();
}

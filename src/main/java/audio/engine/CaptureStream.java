package audio.engine;

import audio.DecodedStream;
import java.io.IOException;
import java.util.OptionalDouble;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Pass-through stream that counts every sample pulled by the output, taps roughly 1/30 s of audio
 * at a time for the visualizer, and raises the finished flag when the decoder runs dry.
 *
 * <p>Runs on the output's pump thread. Visualizer chunks are mono: multi-channel frames are
 * averaged. Sending a chunk never blocks; a full channel loses its oldest chunk.
 */
@Slf4j
final class CaptureStream implements DecodedStream {

    private static final int CHUNKS_PER_SECOND = 30;

    private final DecodedStream inner;
    private final PlaybackCounters counters;
    private final LatestWinsChannel<float[]> visualizerChannel;
    private final int channels;
    private final float[] buffer;
    private int buffered;
    private volatile boolean detached;

    CaptureStream(
            @NonNull DecodedStream inner,
            @NonNull PlaybackCounters counters,
            @NonNull LatestWinsChannel<float[]> visualizerChannel) {
        this.inner = inner;
        this.counters = counters;
        this.visualizerChannel = visualizerChannel;
        this.channels = inner.channelCount();
        int capacity = (inner.sampleRate() * channels) / CHUNKS_PER_SECOND;
        // keep whole frames so the mono downmix never splits one
        capacity = Math.max(channels, capacity - capacity % channels);
        this.buffer = new float[capacity];
    }

    @Override
    public int sampleRate() {
        return inner.sampleRate();
    }

    @Override
    public int channelCount() {
        return channels;
    }

    @Override
    public OptionalDouble totalDuration() {
        return inner.totalDuration();
    }

    @Override
    public int read(float[] target, int offset, int length) {
        int read;
        try {
            read = inner.read(target, offset, length);
        } catch (IOException e) {
            log.warn("Decoder failed mid-stream, treating as end of track", e);
            read = -1;
        }
        if (detached) {
            return read;
        }
        if (read < 0) {
            counters.markFinished();
            return read;
        }
        counters.advance(read);
        capture(target, offset, read);
        return read;
    }

    private void capture(float[] samples, int offset, int count) {
        int index = offset;
        int end = offset + count;
        while (index < end) {
            int room = buffer.length - buffered;
            int take = Math.min(room, end - index);
            System.arraycopy(samples, index, buffer, buffered, take);
            buffered += take;
            index += take;
            if (buffered == buffer.length) {
                visualizerChannel.offer(downmix(buffer, buffered, channels));
                buffered = 0;
            }
        }
    }

    /** Averages interleaved frames to mono. Mono input is copied unchanged. */
    static float[] downmix(float[] interleaved, int length, int channels) {
        if (channels == 1) {
            float[] copy = new float[length];
            System.arraycopy(interleaved, 0, copy, 0, length);
            return copy;
        }
        int frames = length / channels;
        float[] mono = new float[frames];
        for (int frame = 0; frame < frames; frame++) {
            float sum = 0f;
            int base = frame * channels;
            for (int ch = 0; ch < channels; ch++) {
                sum += interleaved[base + ch];
            }
            mono[frame] = sum / channels;
        }
        return mono;
    }

    @Override
    public void seek(double positionSeconds) {
        inner.seek(positionSeconds);
        buffered = 0;
        if (!detached) {
            counters.seekTo(positionSeconds);
            counters.clearFinished();
        }
    }

    /** Stops all counter and visualizer writes. Used when the track is replaced or stopped. */
    void detach() {
        detached = true;
    }

    @Override
    public void close() {
        detach();
        inner.close();
    }
}

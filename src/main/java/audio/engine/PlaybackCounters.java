package audio.engine;

import com.google.errorprone.annotations.ThreadSafe;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Position counter and finished flag for one track. The decode path is the only writer of the
 * counter between seeks; the engine worker reads both to report progress and detect the end of the
 * track.
 *
 * <p>The counter counts samples, not frames: elapsed seconds = samples / (sampleRate * channels).
 * A track change installs a fresh instance, so writes from a cancelled stream never reach the
 * counters of its successor.
 */
@ThreadSafe
final class PlaybackCounters {

    private final AtomicLong samples = new AtomicLong();
    private final AtomicBoolean finished = new AtomicBoolean();
    private final int sampleRate;
    private final int channels;

    PlaybackCounters(int sampleRate, int channels) {
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("Sample rate must be positive: " + sampleRate);
        }
        if (channels <= 0) {
            throw new IllegalArgumentException("Channel count must be positive: " + channels);
        }
        this.sampleRate = sampleRate;
        this.channels = channels;
    }

    void advance(long count) {
        samples.addAndGet(count);
    }

    long samples() {
        return samples.get();
    }

    void restore(long value) {
        samples.set(value);
    }

    /** Rewrites the counter to the sample index of the given position. */
    void seekTo(double positionSeconds) {
        samples.set(toSamples(positionSeconds));
    }

    long toSamples(double positionSeconds) {
        return (long) (positionSeconds * sampleRate * channels);
    }

    double positionSeconds() {
        return samples.get() / ((double) sampleRate * channels);
    }

    void markFinished() {
        finished.set(true);
    }

    boolean isFinished() {
        return finished.get();
    }

    /** Clears the flag and reports whether it was set, so a finish is observed once. */
    boolean consumeFinished() {
        return finished.compareAndSet(true, false);
    }

    void clearFinished() {
        finished.set(false);
    }
}

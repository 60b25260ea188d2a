package audio.output;

import audio.DecodedStream;
import audio.exceptions.AudioEngineException;
import com.google.errorprone.annotations.ThreadSafe;
import java.io.IOException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Output that feeds its device from a dedicated daemon pump thread. Subclasses supply the device
 * through the {@code *Device} hooks; this class owns the stream, pause state, volume, speed and the
 * end-of-stream drain.
 *
 * <p>The stream is only read with {@link #lock} held, so {@link #seek} and {@link #stop} never race
 * a read. Device writes happen outside the lock and may block. A play session is identified by a
 * generation number; a writer whose generation is stale abandons its block. The lock is fair so an
 * unpaced pump cannot starve the controlling thread.
 */
@ThreadSafe
@Slf4j
public abstract class PumpedAudioOutput implements AudioOutput {

    private static final int FRAMES_PER_READ = 1024;

    private final ReentrantLock lock = new ReentrantLock(true);
    private final Condition changed = lock.newCondition();
    private final String pumpName;

    private Thread pump;
    private DecodedStream stream;
    private SpeedResampler resampler;
    private long generation;
    private boolean paused;
    private boolean exhausted;
    private boolean pumping;
    private boolean closed;
    private volatile boolean drained = true;
    private volatile float volume = 1f;
    private volatile float speed = 1f;

    protected PumpedAudioOutput(@NonNull String pumpName) {
        this.pumpName = pumpName;
    }

    @Override
    public void open() {
        openDevice();
        lock.lock();
        try {
            if (pump != null) {
                throw new AudioEngineException("Output already open");
            }
            pump = new Thread(this::pumpLoop, pumpName);
            pump.setDaemon(true);
            pump.start();
        } finally {
            lock.unlock();
        }
        log.debug("Output {} opened", pumpName);
    }

    @Override
    public void play(@NonNull DecodedStream newStream) {
        stop();
        prepareDevice(newStream.sampleRate(), newStream.channelCount());
        lock.lock();
        try {
            generation++;
            stream = newStream;
            resampler = new SpeedResampler(newStream.channelCount());
            paused = false;
            exhausted = false;
            drained = false;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        resumeDevice();
    }

    @Override
    public void pause() {
        lock.lock();
        try {
            if (stream == null || paused) {
                return;
            }
            paused = true;
        } finally {
            lock.unlock();
        }
        pauseDevice();
    }

    @Override
    public void resume() {
        lock.lock();
        try {
            if (stream == null || !paused) {
                return;
            }
            paused = false;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        resumeDevice();
    }

    @Override
    public void stop() {
        lock.lock();
        try {
            if (stream == null) {
                return;
            }
            generation++;
            stream = null;
            resampler = null;
            paused = false;
            exhausted = false;
            drained = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        haltDevice();
        awaitPumpIdle();
        // a block that raced the first halt may have reached the device
        haltDevice();
    }

    @Override
    public void seek(double positionSeconds) {
        lock.lock();
        try {
            if (stream == null) {
                return;
            }
            stream.seek(positionSeconds);
            resampler = new SpeedResampler(stream.channelCount());
            exhausted = false;
            drained = false;
            generation++;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        flushDevice();
    }

    @Override
    public void setVolume(float volume) {
        this.volume = volume;
    }

    @Override
    public void setSpeed(float speed) {
        if (speed <= 0f || Float.isNaN(speed)) {
            log.warn("Ignoring non-positive speed {}", speed);
            return;
        }
        this.speed = speed;
    }

    @Override
    public float getVolume() {
        return volume;
    }

    @Override
    public float getSpeed() {
        return speed;
    }

    @Override
    public boolean isDrained() {
        return drained;
    }

    @Override
    public void close() {
        Thread pumpThread;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            stream = null;
            drained = true;
            generation++;
            changed.signalAll();
            pumpThread = pump;
        } finally {
            lock.unlock();
        }
        haltDevice();
        if (pumpThread != null) {
            try {
                pumpThread.join(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        closeDevice();
        log.debug("Output {} closed", pumpName);
    }

    private void pumpLoop() {
        float[] readBuffer = new float[0];
        while (true) {
            DecodedStream current;
            SpeedResampler currentResampler;
            long session;
            int read;
            lock.lock();
            try {
                while (!closed && (stream == null || paused || exhausted)) {
                    changed.awaitUninterruptibly();
                }
                if (closed) {
                    return;
                }
                current = stream;
                currentResampler = resampler;
                session = generation;
                int wanted = FRAMES_PER_READ * current.channelCount();
                if (readBuffer.length != wanted) {
                    readBuffer = new float[wanted];
                }
                read = readQuietly(current, readBuffer);
                if (read < 0) {
                    exhausted = true;
                }
                pumping = true;
            } finally {
                lock.unlock();
            }

            try {
                if (read < 0) {
                    drainDevice(session);
                    markDrained(session);
                } else if (read > 0) {
                    SpeedResampler.Block block = currentResampler.process(readBuffer, read, speed);
                    writeBlock(applyVolume(block), block.length(), session);
                }
            } catch (RuntimeException e) {
                log.error("Output pump failed, abandoning current stream", e);
                abandon(session);
            } finally {
                lock.lock();
                try {
                    pumping = false;
                    changed.signalAll();
                } finally {
                    lock.unlock();
                }
            }
        }
    }

    private static int readQuietly(DecodedStream current, float[] buffer) {
        try {
            return current.read(buffer, 0, buffer.length);
        } catch (IOException e) {
            log.warn("Stream read failed, ending stream", e);
            return -1;
        }
    }

    private float[] applyVolume(SpeedResampler.Block block) {
        float gain = volume;
        float[] samples = block.samples();
        if (gain == 1f) {
            return samples;
        }
        float[] scaled = new float[block.length()];
        for (int i = 0; i < scaled.length; i++) {
            scaled[i] = samples[i] * gain;
        }
        return scaled;
    }

    private void markDrained(long session) {
        lock.lock();
        try {
            if (session == generation) {
                drained = true;
            }
        } finally {
            lock.unlock();
        }
    }

    private void abandon(long session) {
        lock.lock();
        try {
            if (session == generation) {
                exhausted = true;
                drained = true;
            }
        } finally {
            lock.unlock();
        }
    }

    private void awaitPumpIdle() {
        lock.lock();
        try {
            while (pumping) {
                changed.awaitUninterruptibly();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks while the session is paused. Device writers call this between partial writes.
     *
     * @return false once the session has been replaced, stopped or closed
     */
    protected final boolean awaitWritable(long session) {
        lock.lock();
        try {
            while (paused && session == generation && !closed) {
                changed.awaitUninterruptibly();
            }
            return session == generation && !closed;
        } finally {
            lock.unlock();
        }
    }

    protected final boolean isCurrent(long session) {
        lock.lock();
        try {
            return session == generation && !closed;
        } finally {
            lock.unlock();
        }
    }

    /** Probes the device. Called once from {@link #open()}. */
    protected abstract void openDevice();

    /** Readies the device for a stream of the given format. Called with the pump idle. */
    protected abstract void prepareDevice(int sampleRate, int channels);

    /** Writes interleaved float samples, returning early if the session stops being current. */
    protected abstract void writeBlock(float[] samples, int length, long session);

    /** Waits until everything written for the session has been played. */
    protected abstract void drainDevice(long session);

    /** Stops the device immediately and discards queued audio. Unblocks a pending write. */
    protected abstract void haltDevice();

    /** Discards queued audio and keeps playing. */
    protected abstract void flushDevice();

    protected abstract void pauseDevice();

    protected abstract void resumeDevice();

    protected abstract void closeDevice();
}

package audio.output;

import com.google.errorprone.annotations.ThreadSafe;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * Output without hardware. Unpaced, it consumes samples as fast as the stream yields them; paced,
 * it sleeps for the real-time length of each block.
 */
@ThreadSafe
@Slf4j
public class NullAudioOutput extends PumpedAudioOutput {

    private final boolean paced;
    private final AtomicLong samplesWritten = new AtomicLong();
    private volatile int sampleRate = 44100;
    private volatile int channels = 2;

    public NullAudioOutput(boolean paced) {
        super("tunebox-null-pump");
        this.paced = paced;
    }

    /** Samples accepted since the output was opened, after speed change. */
    public long samplesWritten() {
        return samplesWritten.get();
    }

    @Override
    protected void openDevice() {
        log.info("Using null audio output (paced={})", paced);
    }

    @Override
    protected void prepareDevice(int sampleRate, int channels) {
        this.sampleRate = sampleRate;
        this.channels = channels;
    }

    @Override
    protected void writeBlock(float[] samples, int length, long session) {
        if (!awaitWritable(session)) {
            return;
        }
        samplesWritten.addAndGet(length);
        if (paced && length > 0) {
            long micros = TimeUnit.SECONDS.toMicros(length) / ((long) sampleRate * channels);
            try {
                TimeUnit.MICROSECONDS.sleep(micros);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    protected void drainDevice(long session) {}

    @Override
    protected void haltDevice() {}

    @Override
    protected void flushDevice() {}

    @Override
    protected void pauseDevice() {}

    @Override
    protected void resumeDevice() {}

    @Override
    protected void closeDevice() {}
}

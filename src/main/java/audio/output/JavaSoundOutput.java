package audio.output;

import audio.exceptions.AudioOutputException;
import com.google.errorprone.annotations.ThreadSafe;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.SourceDataLine;
import lombok.extern.slf4j.Slf4j;

/**
 * Plays through the default Java Sound mixer as signed 16-bit little-endian PCM. The line is
 * reopened whenever a stream arrives with a different rate or channel count.
 */
@ThreadSafe
@Slf4j
public class JavaSoundOutput extends PumpedAudioOutput {

    private static final int PROBE_RATE = 44100;
    private static final int PROBE_CHANNELS = 2;
    private static final int BUFFER_MILLIS = 200;
    private static final long DRAIN_POLL_MILLIS = 5;

    private volatile SourceDataLine line;
    private volatile AudioFormat lineFormat;

    public JavaSoundOutput() {
        super("tunebox-javasound-pump");
    }

    static AudioFormat pcmFormat(int sampleRate, int channels) {
        return new AudioFormat(
                AudioFormat.Encoding.PCM_SIGNED, sampleRate, 16, channels, channels * 2, sampleRate, false);
    }

    @Override
    protected void openDevice() {
        AudioFormat probe = pcmFormat(PROBE_RATE, PROBE_CHANNELS);
        DataLine.Info info = new DataLine.Info(SourceDataLine.class, probe);
        if (!AudioSystem.isLineSupported(info)) {
            throw new AudioOutputException("No output line supports " + probe);
        }
        openLine(probe);
    }

    @Override
    protected void prepareDevice(int sampleRate, int channels) {
        AudioFormat wanted = pcmFormat(sampleRate, channels);
        SourceDataLine current = line;
        if (current != null && current.isOpen() && wanted.matches(lineFormat)) {
            current.flush();
            return;
        }
        if (current != null) {
            current.close();
        }
        openLine(wanted);
    }

    private void openLine(AudioFormat format) {
        try {
            SourceDataLine opened = AudioSystem.getSourceDataLine(format);
            int bytesPerSecond = (int) format.getSampleRate() * format.getFrameSize();
            opened.open(format, bytesPerSecond * BUFFER_MILLIS / 1000);
            lineFormat = format;
            line = opened;
            log.debug("Opened output line: {}", format);
        } catch (LineUnavailableException | IllegalArgumentException | SecurityException e) {
            throw new AudioOutputException("Cannot open output line for " + format, e);
        }
    }

    @Override
    protected void writeBlock(float[] samples, int length, long session) {
        SourceDataLine target = line;
        if (target == null) {
            return;
        }
        byte[] bytes = toPcm16(samples, length);
        int offset = 0;
        while (offset < bytes.length) {
            if (!awaitWritable(session)) {
                return;
            }
            offset += target.write(bytes, offset, bytes.length - offset);
        }
    }

    /** Clamps to [-1, 1] and scales to signed 16-bit little-endian. */
    static byte[] toPcm16(float[] samples, int length) {
        byte[] bytes = new byte[length * 2];
        for (int i = 0; i < length; i++) {
            float clamped = Math.max(-1f, Math.min(1f, samples[i]));
            short value = (short) (clamped * 32767f);
            bytes[2 * i] = (byte) value;
            bytes[2 * i + 1] = (byte) (value >> 8);
        }
        return bytes;
    }

    @Override
    protected void drainDevice(long session) {
        SourceDataLine target = line;
        if (target == null) {
            return;
        }
        while (target.available() < target.getBufferSize()) {
            if (!awaitWritable(session)) {
                return;
            }
            try {
                Thread.sleep(DRAIN_POLL_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    @Override
    protected void haltDevice() {
        SourceDataLine target = line;
        if (target != null) {
            target.stop();
            target.flush();
        }
    }

    @Override
    protected void flushDevice() {
        SourceDataLine target = line;
        if (target != null) {
            target.flush();
        }
    }

    @Override
    protected void pauseDevice() {
        SourceDataLine target = line;
        if (target != null) {
            target.stop();
        }
    }

    @Override
    protected void resumeDevice() {
        SourceDataLine target = line;
        if (target != null) {
            target.start();
        }
    }

    @Override
    protected void closeDevice() {
        SourceDataLine target = line;
        line = null;
        if (target != null) {
            target.close();
        }
    }
}

package audio.output;

import audio.DecodedStream;
import audio.exceptions.AudioOutputException;
import audio.exceptions.AudioSeekException;
import lombok.NonNull;

/**
 * Sink that pulls samples from one {@link DecodedStream} at a time and sends them to a device.
 * Owned by a single controlling thread; the device is fed from a pump thread of its own.
 */
public interface AudioOutput extends AutoCloseable {

    /**
     * Acquires the device and starts the pump.
     *
     * @throws AudioOutputException if no usable device is available
     */
    void open();

    /** Replaces whatever is playing with {@code stream}, starting unpaused. */
    void play(@NonNull DecodedStream stream);

    void pause();

    void resume();

    /**
     * Halts output and forgets the current stream. Returns only after the pump has stopped reading
     * from it.
     */
    void stop();

    /**
     * Repositions the current stream and discards audio already queued on the device.
     *
     * @throws AudioSeekException if the stream cannot be repositioned
     */
    void seek(double positionSeconds);

    void setVolume(float volume);

    void setSpeed(float speed);

    float getVolume();

    float getSpeed();

    /** True when there is no stream, or the stream ended and its last samples have been played. */
    boolean isDrained();

    @Override
    void close();
}

package audio;

import com.google.errorprone.annotations.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.NonNull;

/**
 * Command/event front of the playback worker. The worker owns the output device exclusively;
 * callers interact with it only through bounded queues.
 */
@ThreadSafe
public interface PlaybackEngine extends AutoCloseable {

    /** Starts the worker. The output device is acquired on the worker thread. */
    void start();

    /**
     * Enqueues a command without blocking.
     *
     * @return false if the queue is full or the engine has terminated; the command is dropped
     */
    boolean send(@NonNull PlaybackCommand command);

    /** Next pending event, if any. */
    Optional<PlaybackEvent> pollEvent();

    /** Most recent mono sample chunk for visualization. Older pending chunks are discarded. */
    Optional<float[]> pollLatestSamples();

    /** Elapsed seconds of the current track as counted by the decode path. */
    double positionSeconds();

    PlaybackState state();

    boolean isRunning();

    default List<PlaybackEvent> drainEvents() {
        List<PlaybackEvent> drained = new ArrayList<>();
        Optional<PlaybackEvent> event;
        while ((event = pollEvent()).isPresent()) {
            drained.add(event.get());
        }
        return drained;
    }

    @Override
    void close();
}

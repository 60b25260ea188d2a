package audio;

import java.nio.file.Path;
import lombok.NonNull;

/**
 * Intents accepted by a {@link PlaybackEngine}. Commands are delivered in send order to a single
 * consumer; a command rejected by a full queue is not retried.
 *
 * <p>Volume and speed values are passed to the output unchanged. Range checks belong to the
 * caller.
 */
public sealed interface PlaybackCommand {

    /** Stop whatever is playing and start the given track from the beginning. */
    record Play(@NonNull Path track) implements PlaybackCommand {}

    record Pause() implements PlaybackCommand {}

    record Resume() implements PlaybackCommand {}

    /** Halt output and reset the position to zero. */
    record Stop() implements PlaybackCommand {}

    /** Reposition the current track. Clamped by the engine to the track's duration. */
    record Seek(double positionSeconds) implements PlaybackCommand {}

    record SetVolume(float volume) implements PlaybackCommand {}

    record SetSpeed(float speed) implements PlaybackCommand {}
}

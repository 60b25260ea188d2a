package audio;

import lombok.NonNull;

/**
 * Notifications emitted by a {@link PlaybackEngine}. Consumers may coalesce {@link Progress}
 * events: only the most recent one is authoritative.
 */
public sealed interface PlaybackEvent {

    /**
     * A track was opened and output started.
     *
     * @param durationSeconds Total duration, or 0 when the decoder cannot determine it
     */
    record Playing(double durationSeconds) implements PlaybackEvent {}

    record Progress(double positionSeconds) implements PlaybackEvent {}

    /** The stream was exhausted and the output has played every buffered sample. */
    record TrackFinished() implements PlaybackEvent {}

    /**
     * @param loadFailure Whether the failure answers a {@code Play} command, in which case the
     *     engine is idle and no {@link Playing} follows for that track
     */
    record Error(@NonNull String message, boolean loadFailure) implements PlaybackEvent {

        public Error(@NonNull String message) {
            this(message, false);
        }
    }
}

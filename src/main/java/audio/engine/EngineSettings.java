package audio.engine;

import java.time.Duration;
import lombok.NonNull;

/**
 * Queue capacities and loop timings of the playback worker.
 *
 * @param commandCapacity Inbound command queue size; a full queue rejects new commands
 * @param eventCapacity Outbound event queue size; events that do not fit are dropped
 * @param visualizerCapacity Sample chunk channel size; overflow evicts the oldest chunk
 * @param pollTimeout How long the worker waits for a command before running its periodic checks
 * @param progressInterval Cadence of {@code Progress} events
 */
public record EngineSettings(
        int commandCapacity,
        int eventCapacity,
        int visualizerCapacity,
        @NonNull Duration pollTimeout,
        @NonNull Duration progressInterval) {

    public EngineSettings {
        if (commandCapacity <= 0 || eventCapacity <= 0 || visualizerCapacity <= 0) {
            throw new IllegalArgumentException("Queue capacities must be positive");
        }
        if (pollTimeout.isNegative() || pollTimeout.isZero()) {
            throw new IllegalArgumentException("Poll timeout must be positive: " + pollTimeout);
        }
    }

    public static EngineSettings defaults() {
        return new EngineSettings(32, 64, 4, Duration.ofMillis(16), Duration.ofMillis(33));
    }
}

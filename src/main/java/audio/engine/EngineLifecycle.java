package audio.engine;

import audio.exceptions.AudioEngineException;
import com.google.errorprone.annotations.ThreadSafe;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * Lifecycle of the playback worker. Transitions are validated and applied under a lock; reads are
 * lock-free.
 *
 * <pre>
 * NEW -> STARTING (start)
 * STARTING -> RUNNING (output acquired)
 * STARTING -> TERMINATED (output unavailable)
 * RUNNING -> CLOSING (close)
 * STARTING -> CLOSING (close before the worker came up)
 * CLOSING -> TERMINATED
 * NEW -> TERMINATED (closed without starting)
 * </pre>
 */
@ThreadSafe
@Slf4j
final class EngineLifecycle {

    enum State {
        NEW,
        STARTING,
        RUNNING,
        CLOSING,
        TERMINATED
    }

    private final ReentrantLock stateLock = new ReentrantLock();
    private volatile State currentState = State.NEW;

    State getCurrentState() {
        return currentState;
    }

    boolean isRunning() {
        return currentState == State.RUNNING;
    }

    /** Commands are queued while the worker starts up and while it runs. */
    boolean acceptsCommands() {
        State state = currentState;
        return state == State.STARTING || state == State.RUNNING;
    }

    boolean isTerminated() {
        return currentState == State.TERMINATED;
    }

    /**
     * @throws AudioEngineException if the engine is not in the expected state
     */
    void transition(State expected, State newState) {
        if (!compareAndSetState(expected, newState)) {
            throw new AudioEngineException(
                    String.format(
                            "Cannot move engine from %s to %s, current state is %s",
                            expected, newState, currentState));
        }
    }

    boolean compareAndSetState(State expected, State newState) {
        stateLock.lock();
        try {
            if (currentState != expected || !isValidTransition(expected, newState)) {
                return false;
            }
            log.debug("Engine state: {} -> {}", expected, newState);
            currentState = newState;
            return true;
        } finally {
            stateLock.unlock();
        }
    }

    private static boolean isValidTransition(State from, State to) {
        return switch (from) {
            case NEW -> to == State.STARTING || to == State.TERMINATED;
            case STARTING -> to == State.RUNNING || to == State.TERMINATED || to == State.CLOSING;
            case RUNNING -> to == State.CLOSING;
            case CLOSING -> to == State.TERMINATED;
            case TERMINATED -> false;
        };
    }
}

package audio.engine;

import com.google.errorprone.annotations.ThreadSafe;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded hand-off where the producer never waits. When the queue is full the oldest element is
 * evicted to make room, and the consumer only ever cares about the newest element.
 */
@ThreadSafe
@Slf4j
public final class LatestWinsChannel<T> {

    private final BlockingQueue<T> queue;

    public LatestWinsChannel(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /** Offers without blocking, evicting the oldest element on overflow. */
    public void offer(T value) {
        while (!queue.offer(value)) {
            T dropped = queue.poll();
            if (dropped != null) {
                log.trace("Channel full, dropped oldest element");
            }
        }
    }

    /** Drains everything pending and returns the newest element. */
    public Optional<T> pollLatest() {
        T latest = null;
        T next;
        while ((next = queue.poll()) != null) {
            latest = next;
        }
        return Optional.ofNullable(latest);
    }

    public int size() {
        return queue.size();
    }

    public void clear() {
        queue.clear();
    }
}

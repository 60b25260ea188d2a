package audio.engine;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class LatestWinsChannelTest {

    @Test
    void testEmptyChannel() {
        assertEquals(Optional.empty(), new LatestWinsChannel<String>(2).pollLatest());
    }

    @Test
    void testPollReturnsNewestAndDrains() {
        LatestWinsChannel<String> channel = new LatestWinsChannel<>(4);
        channel.offer("a");
        channel.offer("b");
        channel.offer("c");

        assertEquals(Optional.of("c"), channel.pollLatest());
        assertEquals(0, channel.size());
        assertEquals(Optional.empty(), channel.pollLatest());
    }

    @Test
    void testOverflowEvictsOldest() {
        LatestWinsChannel<Integer> channel = new LatestWinsChannel<>(2);
        for (int i = 0; i < 10; i++) {
            channel.offer(i);
        }

        assertEquals(2, channel.size());
        assertEquals(Optional.of(9), channel.pollLatest());
    }

    @Test
    void testClear() {
        LatestWinsChannel<Integer> channel = new LatestWinsChannel<>(2);
        channel.offer(1);
        channel.clear();
        assertEquals(Optional.empty(), channel.pollLatest());
    }

    @Test
    void testRejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new LatestWinsChannel<>(0));
    }
}

package audio.engine;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class PlaybackCountersTest {

    @Test
    void testPositionCountsSamplesAcrossChannels() {
        PlaybackCounters counters = new PlaybackCounters(44100, 2);
        counters.advance(88200);
        assertEquals(1.0, counters.positionSeconds(), 1e-9);
    }

    @Test
    void testSeekToRewritesCounter() {
        PlaybackCounters counters = new PlaybackCounters(1000, 1);
        counters.advance(12345);
        counters.seekTo(3.0);
        assertEquals(3000, counters.samples());
        assertEquals(3.0, counters.positionSeconds(), 1e-9);
    }

    @Test
    void testFinishedIsConsumedOnce() {
        PlaybackCounters counters = new PlaybackCounters(1000, 1);
        assertFalse(counters.consumeFinished());

        counters.markFinished();
        assertTrue(counters.consumeFinished());
        assertFalse(counters.consumeFinished());
        assertFalse(counters.isFinished());
    }

    @Test
    void testRejectsInvalidFormat() {
        assertThrows(IllegalArgumentException.class, () -> new PlaybackCounters(0, 2));
        assertThrows(IllegalArgumentException.class, () -> new PlaybackCounters(44100, 0));
    }
}

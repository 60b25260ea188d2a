package playback;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class PlaybackSpeedTest {

    @Test
    void testLadderClampsAtEnds() {
        assertEquals(PlaybackSpeed.SLOW_50, PlaybackSpeed.SLOW_50.down());
        assertEquals(PlaybackSpeed.FAST_200, PlaybackSpeed.FAST_200.up());
        assertEquals(PlaybackSpeed.FAST_125, PlaybackSpeed.NORMAL.up());
        assertEquals(PlaybackSpeed.SLOW_75, PlaybackSpeed.NORMAL.down());
    }

    @Test
    void testMultipliersAscend() {
        float last = 0f;
        for (PlaybackSpeed speed : PlaybackSpeed.values()) {
            assertTrue(speed.multiplier() > last);
            last = speed.multiplier();
        }
        assertEquals("1x", PlaybackSpeed.NORMAL.label());
    }

    @Test
    void testRepeatAndThemeCycleBackToStart() {
        RepeatMode repeat = RepeatMode.OFF;
        for (int i = 0; i < RepeatMode.values().length; i++) {
            repeat = repeat.cycle();
        }
        assertEquals(RepeatMode.OFF, repeat);

        Theme theme = Theme.DEFAULT;
        for (int i = 0; i < Theme.values().length; i++) {
            theme = theme.cycle();
        }
        assertEquals(Theme.DEFAULT, theme);
    }
}

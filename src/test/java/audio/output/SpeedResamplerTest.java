package audio.output;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class SpeedResamplerTest {

    private static float[] ramp(int from, int count) {
        float[] samples = new float[count];
        for (int i = 0; i < count; i++) {
            samples[i] = from + i;
        }
        return samples;
    }

    @Test
    void testNormalSpeedPassesThrough() {
        SpeedResampler resampler = new SpeedResampler(2);
        float[] input = ramp(0, 64);

        SpeedResampler.Block block = resampler.process(input, 64, 1f);

        assertSame(input, block.samples());
        assertEquals(64, block.length());
    }

    @Test
    void testDoubleSpeedSkipsEveryOtherFrame() {
        SpeedResampler resampler = new SpeedResampler(1);

        SpeedResampler.Block block = resampler.process(ramp(0, 100), 100, 2f);

        assertEquals(50, block.length());
        for (int i = 0; i < block.length(); i++) {
            assertEquals(2f * i, block.samples()[i], 1e-4);
        }
    }

    @Test
    void testHalfSpeedInterpolatesAcrossBlocks() {
        SpeedResampler resampler = new SpeedResampler(1);
        float[] joined = new float[400];
        int length = 0;

        for (int start = 0; start < 200; start += 100) {
            SpeedResampler.Block block = resampler.process(ramp(start, 100), 100, 0.5f);
            System.arraycopy(block.samples(), 0, joined, length, block.length());
            length += block.length();
        }

        assertEquals(398, length);
        for (int i = 0; i < length; i++) {
            assertEquals(0.5f * i, joined[i], 1e-3, "sample " + i);
        }
    }

    @Test
    void testChannelsStayInterleaved() {
        SpeedResampler resampler = new SpeedResampler(2);
        float[] stereo = new float[40];
        for (int frame = 0; frame < 20; frame++) {
            stereo[2 * frame] = frame;
            stereo[2 * frame + 1] = -frame;
        }

        SpeedResampler.Block block = resampler.process(stereo, 40, 1.5f);

        assertEquals(0, block.length() % 2);
        for (int i = 0; i < block.length(); i += 2) {
            assertEquals(-block.samples()[i], block.samples()[i + 1], 1e-4);
        }
    }

    @Test
    void testRejectsNonPositiveSpeed() {
        SpeedResampler resampler = new SpeedResampler(1);
        assertThrows(IllegalArgumentException.class, () -> resampler.process(new float[4], 4, 0f));
    }
}

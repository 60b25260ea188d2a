package visualizer;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class FftTest {

    @Test
    void testImpulseHasFlatSpectrum() {
        Fft fft = new Fft(16);
        double[] re = new double[16];
        double[] im = new double[16];
        re[0] = 1;

        fft.forward(re, im);

        for (int k = 0; k < 16; k++) {
            assertEquals(1.0, Math.hypot(re[k], im[k]), 1e-12);
        }
    }

    @Test
    void testCosineLandsInItsBin() {
        int n = 256;
        Fft fft = new Fft(n);
        double[] re = new double[n];
        double[] im = new double[n];
        for (int i = 0; i < n; i++) {
            re[i] = Math.cos(2 * Math.PI * 10 * i / n);
        }

        fft.forward(re, im);

        assertEquals(n / 2.0, Math.hypot(re[10], im[10]), 1e-9);
        assertEquals(n / 2.0, Math.hypot(re[n - 10], im[n - 10]), 1e-9);
        for (int k = 0; k < n / 2; k++) {
            if (k != 10) {
                assertEquals(0.0, Math.hypot(re[k], im[k]), 1e-9, "bin " + k);
            }
        }
    }

    @Test
    void testRejectsNonPowerOfTwo() {
        assertThrows(IllegalArgumentException.class, () -> new Fft(1000));
        assertThrows(IllegalArgumentException.class, () -> new Fft(8).forward(new double[4], new double[4]));
    }
}

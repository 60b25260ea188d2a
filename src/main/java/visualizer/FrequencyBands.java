package visualizer;

/**
 * Log-spaced partition of FFT bins into display bands. Band {@code b} covers bins
 * {@code [start(b), start(b + 1))}, where {@code start(0) = 1} skips DC and
 * {@code start(b) = floor(exp(ln(numBins) * b / numBands))}. Every band is at least one bin wide
 * and the last band always ends at {@code numBins}.
 */
final class FrequencyBands {

    private final int[] low;
    private final int[] high;

    FrequencyBands(int numBands, int numBins) {
        if (numBands <= 0 || numBins < 2) {
            throw new IllegalArgumentException(
                    "Need at least one band and two bins: " + numBands + ", " + numBins);
        }
        this.low = new int[numBands];
        this.high = new int[numBands];
        for (int band = 0; band < numBands; band++) {
            int lo = Math.min(binStart(band, numBands, numBins), numBins);
            int hi =
                    band == numBands - 1
                            ? numBins
                            : Math.min(binStart(band + 1, numBands, numBins), numBins);
            hi = Math.max(hi, lo + 1);
            low[band] = lo;
            high[band] = hi;
        }
    }

    static int binStart(int band, int numBands, int numBins) {
        if (band == 0) {
            return 1;
        }
        double logMax = Math.log(numBins);
        return (int) Math.exp(logMax * band / numBands);
    }

    int count() {
        return low.length;
    }

    int low(int band) {
        return low[band];
    }

    /** Exclusive. */
    int high(int band) {
        return high[band];
    }

    /** Mean magnitude of each band. {@code magnitudes} must hold {@code numBins} values. */
    void average(double[] magnitudes, float[] target) {
        for (int band = 0; band < low.length; band++) {
            int lo = low[band];
            int hi = Math.min(high[band], magnitudes.length);
            double sum = 0;
            for (int bin = lo; bin < hi; bin++) {
                sum += magnitudes[bin];
            }
            target[band] = (float) (sum / (high[band] - lo));
        }
    }
}

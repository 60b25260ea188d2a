package visualizer;

import java.util.Arrays;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns mono sample chunks into spectrum bars, pseudo-stereo bars and a waveform. Stateful and not
 * thread-safe; confine it to one thread.
 *
 * <p>The spectrum runs over the last {@value #FFT_SIZE} samples received, zero-padded at the front
 * until that many have arrived. Raw band values are smoothed with an exponential moving average
 * and then normalized by the loudest band for display, so a quiet passage still fills the screen.
 * Peaks follow the bars up immediately and only come down in {@link #decay()}.
 */
@Slf4j
public class Visualizer {

    public static final int NUM_BANDS = 64;
    public static final int FFT_SIZE = 2048;
    public static final int WAVEFORM_WIDTH = 200;

    static final float SMOOTHING = 0.35f;
    static final float NORMALIZE_FLOOR = 0.001f;
    static final float BAR_DECAY = 0.85f;
    static final float PEAK_DECAY = 0.92f;
    static final float STEREO_SMOOTHING = 0.7f;

    private final Fft fft = new Fft(FFT_SIZE);
    private final FrequencyBands bands = new FrequencyBands(NUM_BANDS, FFT_SIZE / 2);
    private final float[] window = new float[FFT_SIZE];
    private final float[] history = new float[FFT_SIZE];
    private final double[] re = new double[FFT_SIZE];
    private final double[] im = new double[FFT_SIZE];
    private final double[] magnitudes = new double[FFT_SIZE / 2];
    private final float[] newBars = new float[NUM_BANDS];

    private final float[] bars = new float[NUM_BANDS];
    private final float[] prevBars = new float[NUM_BANDS];
    private final float[] peakBars = new float[NUM_BANDS];
    private final float[] leftBars = new float[NUM_BANDS];
    private final float[] rightBars = new float[NUM_BANDS];
    private final float[] waveform = new float[WAVEFORM_WIDTH];

    @Getter private VisualizerMode mode = VisualizerMode.FREQUENCY_BARS;

    public Visualizer() {
        for (int i = 0; i < FFT_SIZE; i++) {
            window[i] = (float) (0.5 * (1 - Math.cos(2 * Math.PI * i / (FFT_SIZE - 1))));
        }
    }

    public void setMode(@NonNull VisualizerMode mode) {
        this.mode = mode;
    }

    /** Advances to the next mode. Display arrays are left as they are. */
    public VisualizerMode cycle() {
        mode = mode.cycle();
        log.debug("Visualizer mode: {}", mode);
        return mode;
    }

    public String label() {
        return mode.label();
    }

    public void processSamples(@NonNull float[] chunk) {
        switch (mode) {
            case FREQUENCY_BARS -> processSpectrum(chunk);
            case WAVEFORM -> processWaveform(chunk);
            case OFF -> {}
        }
    }

    private void processSpectrum(float[] chunk) {
        appendToHistory(chunk);
        for (int i = 0; i < FFT_SIZE; i++) {
            re[i] = history[i] * window[i];
            im[i] = 0;
        }
        fft.forward(re, im);
        int half = FFT_SIZE / 2;
        for (int k = 0; k < half; k++) {
            magnitudes[k] = Math.hypot(re[k], im[k]) / half;
        }
        bands.average(magnitudes, newBars);

        float max = 0f;
        for (int i = 0; i < NUM_BANDS; i++) {
            float smoothed = prevBars[i] * (1 - SMOOTHING) + newBars[i] * SMOOTHING;
            prevBars[i] = smoothed;
            bars[i] = smoothed;
            max = Math.max(max, smoothed);
        }
        if (max > NORMALIZE_FLOOR) {
            for (int i = 0; i < NUM_BANDS; i++) {
                bars[i] = Math.min(bars[i] / max, 1f);
            }
        }
        for (int i = 0; i < NUM_BANDS; i++) {
            peakBars[i] = Math.max(peakBars[i], bars[i]);
        }
        splitStereo();
    }

    private void appendToHistory(float[] chunk) {
        if (chunk.length >= FFT_SIZE) {
            System.arraycopy(chunk, chunk.length - FFT_SIZE, history, 0, FFT_SIZE);
            return;
        }
        int keep = FFT_SIZE - chunk.length;
        System.arraycopy(history, chunk.length, history, 0, keep);
        System.arraycopy(chunk, 0, history, keep, chunk.length);
    }

    // left leans on the low bands, right on the high ones
    private void splitStereo() {
        for (int i = 0; i < NUM_BANDS; i++) {
            float position = (float) i / NUM_BANDS;
            float left = bars[i] * (1f - position * 0.3f);
            float right = bars[i] * (0.7f + position * 0.3f);
            leftBars[i] = leftBars[i] * STEREO_SMOOTHING + left * (1 - STEREO_SMOOTHING);
            rightBars[i] = rightBars[i] * STEREO_SMOOTHING + right * (1 - STEREO_SMOOTHING);
        }
    }

    private void processWaveform(float[] chunk) {
        if (chunk.length == 0) {
            Arrays.fill(waveform, 0f);
            return;
        }
        float step = (float) chunk.length / WAVEFORM_WIDTH;
        for (int i = 0; i < WAVEFORM_WIDTH; i++) {
            int start = (int) (i * step);
            int end = Math.min((int) ((i + 1) * step), chunk.length);
            if (start >= chunk.length) {
                continue;
            }
            float sum = 0f;
            for (int j = start; j < end; j++) {
                sum += chunk[j];
            }
            waveform[i] = sum / Math.max(end - start, 1);
        }
    }

    /** Fades everything toward zero when no audio arrived. The only place peaks come down. */
    public void decay() {
        for (int i = 0; i < NUM_BANDS; i++) {
            bars[i] *= BAR_DECAY;
            leftBars[i] *= BAR_DECAY;
            rightBars[i] *= BAR_DECAY;
            peakBars[i] *= PEAK_DECAY;
            prevBars[i] = bars[i];
        }
        for (int i = 0; i < WAVEFORM_WIDTH; i++) {
            waveform[i] *= BAR_DECAY;
        }
    }

    public VisualizerState state() {
        return new VisualizerState(mode, bars, peakBars, leftBars, rightBars, waveform);
    }
}

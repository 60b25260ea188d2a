package visualizer;

import lombok.NonNull;

/**
 * Immutable copy of the visualizer's display arrays. Bars are normalized to [0, 1]; waveform
 * values are averaged samples and are not clamped.
 */
public record VisualizerState(
        @NonNull VisualizerMode mode,
        float[] bars,
        float[] peakBars,
        float[] leftBars,
        float[] rightBars,
        float[] waveform) {

    public VisualizerState {
        bars = bars.clone();
        peakBars = peakBars.clone();
        leftBars = leftBars.clone();
        rightBars = rightBars.clone();
        waveform = waveform.clone();
    }

    @Override
    public float[] bars() {
        return bars.clone();
    }

    @Override
    public float[] peakBars() {
        return peakBars.clone();
    }

    @Override
    public float[] leftBars() {
        return leftBars.clone();
    }

    @Override
    public float[] rightBars() {
        return rightBars.clone();
    }

    @Override
    public float[] waveform() {
        return waveform.clone();
    }
}

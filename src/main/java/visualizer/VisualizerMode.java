package visualizer;

/** What the visualizer computes from incoming samples. */
public enum VisualizerMode {
    FREQUENCY_BARS("Spectrum"),
    WAVEFORM("Waveform"),
    OFF("Off");

    private final String label;

    VisualizerMode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** FREQUENCY_BARS, then WAVEFORM, then OFF, then back to FREQUENCY_BARS. */
    public VisualizerMode cycle() {
        return switch (this) {
            case FREQUENCY_BARS -> WAVEFORM;
            case WAVEFORM -> OFF;
            case OFF -> FREQUENCY_BARS;
        };
    }
}

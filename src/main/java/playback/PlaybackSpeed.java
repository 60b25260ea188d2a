package playback;

/** Fixed speed ladder. Stepping past either end stays at that end. */
public enum PlaybackSpeed {
    SLOW_50(0.5f, "0.5x"),
    SLOW_75(0.75f, "0.75x"),
    NORMAL(1.0f, "1x"),
    FAST_125(1.25f, "1.25x"),
    FAST_150(1.5f, "1.5x"),
    FAST_200(2.0f, "2x");

    private final float multiplier;
    private final String label;

    PlaybackSpeed(float multiplier, String label) {
        this.multiplier = multiplier;
        this.label = label;
    }

    public float multiplier() {
        return multiplier;
    }

    public String label() {
        return label;
    }

    public PlaybackSpeed up() {
        PlaybackSpeed[] all = values();
        return all[Math.min(ordinal() + 1, all.length - 1)];
    }

    public PlaybackSpeed down() {
        return values()[Math.max(ordinal() - 1, 0)];
    }
}

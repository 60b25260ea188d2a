package playback;

/** What happens at the end of a track and at the ends of the playlist. */
public enum RepeatMode {
    OFF("Off"),
    ALL("All"),
    ONE("One");

    private final String label;

    RepeatMode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public RepeatMode cycle() {
        return switch (this) {
            case OFF -> ALL;
            case ALL -> ONE;
            case ONE -> OFF;
        };
    }
}

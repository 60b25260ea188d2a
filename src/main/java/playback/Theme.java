package playback;

/** Colour scheme names, cycled in declaration order. */
public enum Theme {
    DEFAULT("Default"),
    DRACULA("Dracula"),
    NORD("Nord"),
    GRUVBOX("Gruvbox"),
    NEON("Neon");

    private final String displayName;

    Theme(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public Theme cycle() {
        Theme[] all = values();
        return all[(ordinal() + 1) % all.length];
    }
}

package audio;

/** Engine-side state of the current track slot. */
public enum PlaybackState {
    IDLE,
    PLAYING,
    PAUSED
}

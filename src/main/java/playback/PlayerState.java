package playback;

/** Derived from whether a track is selected for playback and whether it is paused. */
public enum PlayerState {
    IDLE,
    PLAYING,
    PAUSED
}

package playback;

/**
 * Read model of the player for the remote surface and the renderer. Track fields are null when
 * nothing is playing; {@code sleepTimerRemainingSeconds} and {@code errorMessage} are null when
 * unset. {@code hasAlbumArt} tells whether the playing file carries an embedded picture.
 */
public record PlaybackSnapshot(
        PlayerState state,
        Integer playingIndex,
        String trackTitle,
        String trackArtist,
        String trackAlbum,
        double progress,
        double duration,
        boolean playing,
        float volume,
        boolean shuffle,
        String repeat,
        String theme,
        String visualizerMode,
        float[] visualizerBars,
        String speed,
        Long sleepTimerRemainingSeconds,
        String errorMessage,
        boolean hasAlbumArt) {}

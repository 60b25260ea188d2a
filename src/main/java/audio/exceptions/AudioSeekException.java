package audio.exceptions;

import lombok.NonNull;

/** Repositioning a decoded stream failed. Playback continues from the previous position. */
public class AudioSeekException extends AudioException {

    public AudioSeekException(@NonNull String message) {
        super(message);
    }

    public AudioSeekException(@NonNull String message, @NonNull Throwable cause) {
        super(message, cause);
    }
}

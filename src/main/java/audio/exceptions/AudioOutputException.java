package audio.exceptions;

import lombok.NonNull;

/**
 * The output device could not be acquired or opened. Fatal when raised while the engine starts,
 * recoverable when raised for a single track's line format.
 */
public class AudioOutputException extends AudioException {

    public AudioOutputException(@NonNull String message) {
        super(message);
    }

    public AudioOutputException(@NonNull String message, @NonNull Throwable cause) {
        super(message, cause);
    }
}

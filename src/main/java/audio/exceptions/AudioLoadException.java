package audio.exceptions;

import lombok.NonNull;

/**
 * Thrown when a track cannot be opened for decoding. Recoverable: the engine reports it and stays
 * idle.
 */
public class AudioLoadException extends AudioException {

    public AudioLoadException(@NonNull String message) {
        super(message);
    }

    public AudioLoadException(@NonNull String message, @NonNull Throwable cause) {
        super(message, cause);
    }
}

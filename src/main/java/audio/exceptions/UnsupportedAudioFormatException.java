package audio.exceptions;

import lombok.NonNull;

/** No decoder on the classpath understands the file's container or codec. */
public class UnsupportedAudioFormatException extends AudioLoadException {

    public UnsupportedAudioFormatException(@NonNull String message) {
        super(message);
    }

    public UnsupportedAudioFormatException(@NonNull String message, @NonNull Throwable cause) {
        super(message, cause);
    }
}

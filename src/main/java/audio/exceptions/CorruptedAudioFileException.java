package audio.exceptions;

import lombok.NonNull;

/** The decoder recognised the format but could not find playable frames in the file. */
public class CorruptedAudioFileException extends AudioLoadException {

    public CorruptedAudioFileException(@NonNull String message) {
        super(message);
    }

    public CorruptedAudioFileException(@NonNull String message, @NonNull Throwable cause) {
        super(message, cause);
    }
}

package audio;

import java.io.IOException;
import java.nio.file.Path;
import lombok.Getter;
import lombok.NonNull;

/**
 * Reading headers or tags from an audio file failed. Callers treat this as non-fatal and fall back
 * to values derived from the file name.
 */
@Getter
public class AudioReadException extends IOException {

    /** The file that failed to read. */
    private final Path audioFile;

    public AudioReadException(@NonNull String message, @NonNull Path audioFile) {
        super(message);
        this.audioFile = audioFile;
    }

    public AudioReadException(
            @NonNull String message, @NonNull Path audioFile, @NonNull Throwable cause) {
        super(message, cause);
        this.audioFile = audioFile;
    }

    @Override
    public String getMessage() {
        return String.format(
                "Failed to read audio from %s: %s", audioFile.getFileName(), super.getMessage());
    }
}

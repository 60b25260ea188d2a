package audio;

import audio.exceptions.AudioLoadException;
import java.nio.file.Path;
import lombok.NonNull;

/** Opens tracks for decoding. Each call returns an independent stream. */
public interface SampleSource {

    /**
     * @throws AudioLoadException if the file is missing, unreadable or in an unsupported format
     */
    DecodedStream open(@NonNull Path track);

    /** Whether this source can decode the file, judged by its name. */
    default boolean supports(@NonNull Path track) {
        return true;
    }
}

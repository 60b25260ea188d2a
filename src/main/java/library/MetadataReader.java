package library;

import audio.AudioReadException;
import java.nio.file.Path;
import lombok.NonNull;

/** Reads tags and stream properties without decoding audio. */
public interface MetadataReader {

    /**
     * @throws AudioReadException if the file cannot be read or its format is not recognised
     */
    TrackMetadata read(@NonNull Path file) throws AudioReadException;
}

package library;

import java.nio.file.Path;
import java.util.List;
import lombok.NonNull;

/**
 * The playlist the player was started with.
 *
 * @param source Directory that was scanned, or the single file that was opened
 * @param singleFile Whether {@code source} is a file rather than a directory
 */
public record Library(@NonNull Path source, @NonNull List<Track> tracks, boolean singleFile) {

    public Library {
        tracks = List.copyOf(tracks);
    }

    public static Library empty() {
        return new Library(Path.of(""), List.of(), false);
    }

    public boolean isEmpty() {
        return tracks.isEmpty();
    }

    public int size() {
        return tracks.size();
    }
}

package library;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import lombok.NonNull;

/** Remembers the result of scanning a directory. */
public interface LibraryCache {

    /** Cached tracks for {@code directory}, empty if missing, unreadable or stale. */
    Optional<List<Track>> load(@NonNull Path directory);

    /** Best effort; failures are logged, never thrown. */
    void save(@NonNull Path directory, @NonNull List<Track> tracks);
}

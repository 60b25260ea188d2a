package library;

import audio.AudioFiles;
import audio.AudioReadException;
import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds the playlist from a directory tree or a single file. Files whose metadata cannot be read
 * are still listed, with names taken from the file.
 */
@Slf4j
public class LibraryScanner {

    public static final Set<String> AUDIO_EXTENSIONS =
            Set.of("mp3", "flac", "wav", "ogg", "m4a", "aac", "aif", "aiff", "au");
    static final String UNKNOWN_ARTIST = "Unknown Artist";
    static final String UNKNOWN_ALBUM = "Unknown Album";

    /** Artist, album, track number (unnumbered first), then title; text compared ignoring case. */
    public static final Comparator<Track> LIBRARY_ORDER =
            Comparator.comparing((Track t) -> t.artist().toLowerCase(Locale.ROOT))
                    .thenComparing(t -> t.album().toLowerCase(Locale.ROOT))
                    .thenComparing(Track::trackNumber, Comparator.nullsFirst(Comparator.naturalOrder()))
                    .thenComparing(t -> t.title().toLowerCase(Locale.ROOT));

    private final MetadataReader metadataReader;
    private final LibraryCache cache;

    public LibraryScanner(@NonNull MetadataReader metadataReader, @NonNull LibraryCache cache) {
        this.metadataReader = metadataReader;
        this.cache = cache;
    }

    public static boolean isAudioFile(@NonNull Path file) {
        return AUDIO_EXTENSIONS.contains(AudioFiles.extension(file));
    }

    /**
     * Directory or single file, whichever {@code path} is.
     *
     * @throws IOException if {@code path} does not exist or the directory cannot be walked
     */
    public Library open(@NonNull Path path) throws IOException {
        Path absolute = path.toAbsolutePath().normalize();
        if (Files.isDirectory(absolute)) {
            return new Library(absolute, scanDirectory(absolute), false);
        }
        if (Files.isRegularFile(absolute)) {
            return new Library(absolute, scanFile(absolute), true);
        }
        throw new IOException("No such file or directory: " + path);
    }

    /** Recursive scan, following links. Served from the cache when it is fresh. */
    public List<Track> scanDirectory(@NonNull Path directory) throws IOException {
        Optional<List<Track>> cached = cache.load(directory);
        if (cached.isPresent()) {
            return cached.get();
        }

        List<Track> tracks = new ArrayList<>();
        Files.walkFileTree(
                directory,
                EnumSet.of(FileVisitOption.FOLLOW_LINKS),
                Integer.MAX_VALUE,
                new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                        if (attrs.isRegularFile() && isAudioFile(file)) {
                            tracks.add(toTrack(file, attrs.size()));
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(Path file, IOException e) {
                        log.warn("Skipping unreadable entry {}: {}", file, e.getMessage());
                        return FileVisitResult.CONTINUE;
                    }
                });
        tracks.sort(LIBRARY_ORDER);
        log.info("Scanned {} tracks under {}", tracks.size(), directory);
        cache.save(directory, tracks);
        return List.copyOf(tracks);
    }

    public List<Track> scanFile(@NonNull Path file) throws IOException {
        return List.of(toTrack(file, Files.size(file)));
    }

    Track toTrack(Path file, long fileSize) {
        TrackMetadata metadata;
        try {
            metadata = metadataReader.read(file);
        } catch (AudioReadException e) {
            log.debug("Using file name for {}: {}", file, e.getMessage());
            metadata = TrackMetadata.empty();
        }
        String extension = AudioFiles.extension(file);
        return new Track(
                file,
                metadata.title() != null ? metadata.title() : AudioFiles.baseName(file),
                metadata.artist() != null ? metadata.artist() : UNKNOWN_ARTIST,
                metadata.album() != null ? metadata.album() : UNKNOWN_ALBUM,
                metadata.durationSeconds() != null ? metadata.durationSeconds() : 0.0,
                metadata.trackNumber(),
                metadata.bitrate(),
                metadata.sampleRate(),
                metadata.channels(),
                extension.isEmpty() ? "UNKNOWN" : extension.toUpperCase(Locale.ROOT),
                fileSize);
    }
}

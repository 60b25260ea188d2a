package library;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.deser.std.FromStringDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Single-directory cache stored as JSON. An entry is fresh while the directory's modification time
 * (whole seconds) is not newer than the one recorded at save time.
 */
@Slf4j
public class JsonLibraryCache implements LibraryCache {

    private final ObjectMapper mapper;
    private final Path cacheFile;

    public JsonLibraryCache(@NonNull ObjectMapper baseMapper, @NonNull Path cacheFile) {
        this.mapper =
                baseMapper
                        .copy()
                        .registerModule(pathModule())
                        .enable(SerializationFeature.INDENT_OUTPUT)
                        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.cacheFile = cacheFile;
    }

    record CacheEntry(Path directory, long modifiedTime, List<Track> tracks) {}

    @Override
    public Optional<List<Track>> load(@NonNull Path directory) {
        if (!Files.isRegularFile(cacheFile)) {
            return Optional.empty();
        }
        CacheEntry entry;
        try {
            entry = mapper.readValue(cacheFile.toFile(), CacheEntry.class);
        } catch (IOException e) {
            log.warn("Ignoring unreadable library cache {}: {}", cacheFile, e.getMessage());
            return Optional.empty();
        }
        Path normalized = directory.toAbsolutePath().normalize();
        if (entry.directory() == null || !entry.directory().equals(normalized)) {
            log.debug("Library cache is for {}, not {}", entry.directory(), normalized);
            return Optional.empty();
        }
        Optional<Long> modified = modifiedSeconds(directory);
        if (modified.isEmpty() || modified.get() > entry.modifiedTime()) {
            log.debug("Library cache for {} is stale", normalized);
            return Optional.empty();
        }
        log.info("Loaded {} tracks from library cache", entry.tracks().size());
        return Optional.of(List.copyOf(entry.tracks()));
    }

    @Override
    public void save(@NonNull Path directory, @NonNull List<Track> tracks) {
        CacheEntry entry =
                new CacheEntry(
                        directory.toAbsolutePath().normalize(),
                        modifiedSeconds(directory).orElse(0L),
                        tracks);
        try {
            Path parent = cacheFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(cacheFile.toFile(), entry);
            log.debug("Saved {} tracks to {}", tracks.size(), cacheFile);
        } catch (IOException e) {
            log.warn("Could not write library cache {}: {}", cacheFile, e.getMessage());
        }
    }

    private static Optional<Long> modifiedSeconds(Path directory) {
        try {
            return Optional.of(Files.getLastModifiedTime(directory).toMillis() / 1000);
        } catch (IOException e) {
            log.debug("Cannot read modification time of {}", directory, e);
            return Optional.empty();
        }
    }

    private static SimpleModule pathModule() {
        SimpleModule module = new SimpleModule("tunebox-paths");
        module.addSerializer(Path.class, new ToStringSerializer(Path.class));
        module.addDeserializer(Path.class, new PathDeserializer());
        return module;
    }

    private static final class PathDeserializer extends FromStringDeserializer<Path> {

        PathDeserializer() {
            super(Path.class);
        }

        @Override
        protected Path _deserialize(String value, DeserializationContext context)
                throws JsonProcessingException {
            return Paths.get(value);
        }
    }
}

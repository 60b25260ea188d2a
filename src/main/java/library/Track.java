package library;

import java.nio.file.Path;
import lombok.NonNull;

/**
 * One playable file and what is known about it. Optional technical fields are null when the file
 * did not declare them.
 *
 * @param durationSeconds 0 when unknown
 * @param format Upper-case file extension, e.g. {@code MP3}
 */
public record Track(
        @NonNull Path path,
        @NonNull String title,
        @NonNull String artist,
        @NonNull String album,
        double durationSeconds,
        Integer trackNumber,
        Integer bitrate,
        Integer sampleRate,
        Integer channels,
        @NonNull String format,
        long fileSize) {}

package library;

import audio.AudioFiles;
import audio.AudioReadException;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import javazoom.jl.decoder.Bitstream;
import javazoom.jl.decoder.BitstreamException;
import javazoom.jl.decoder.Header;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads MP3 properties from the first frame header (JLayer) and tags from ID3v2. Everything else
 * goes through {@link AudioSystem#getAudioFileFormat}, whose properties map carries title and
 * author when the provider exposes them.
 */
@Slf4j
public class AudioFileMetadataReader implements MetadataReader {

    @Override
    public TrackMetadata read(@NonNull Path file) throws AudioReadException {
        if (!Files.isRegularFile(file)) {
            throw new AudioReadException("Not a regular file", file);
        }
        if ("mp3".equals(AudioFiles.extension(file))) {
            return readMp3(file);
        }
        return readJavaSound(file);
    }

    private TrackMetadata readMp3(Path file) throws AudioReadException {
        Optional<Id3v2Tag> tag;
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            tag = Id3v2Tag.read(in);
        } catch (IOException e) {
            throw new AudioReadException("Cannot read ID3 tag", file, e);
        }

        Header header;
        long fileSize;
        Bitstream bitstream = null;
        try {
            fileSize = Files.size(file);
            bitstream = new Bitstream(new BufferedInputStream(Files.newInputStream(file)));
            header = bitstream.readFrame();
        } catch (IOException | BitstreamException e) {
            throw new AudioReadException("Cannot read MPEG header", file, e);
        } finally {
            close(bitstream);
        }
        if (header == null) {
            throw new AudioReadException("No MPEG frames", file);
        }

        float totalMs = header.total_ms((int) Math.min(Integer.MAX_VALUE, fileSize));
        Id3v2Tag id3 = tag.orElse(null);
        return new TrackMetadata(
                id3 == null ? null : id3.title,
                id3 == null ? null : id3.artist,
                id3 == null ? null : id3.album,
                id3 == null ? null : id3.trackNumber,
                totalMs > 0 ? totalMs / 1000.0 : null,
                header.bitrate() / 1000,
                header.frequency(),
                header.mode() == Header.SINGLE_CHANNEL ? 1 : 2,
                id3 == null ? null : id3.albumArt);
    }

    private static void close(Bitstream bitstream) {
        if (bitstream == null) {
            return;
        }
        try {
            bitstream.close();
        } catch (BitstreamException e) {
            log.debug("Error closing MPEG stream", e);
        }
    }

    private TrackMetadata readJavaSound(Path file) throws AudioReadException {
        AudioFileFormat fileFormat;
        try {
            fileFormat = AudioSystem.getAudioFileFormat(file.toFile());
        } catch (UnsupportedAudioFileException e) {
            throw new AudioReadException("Unsupported format", file, e);
        } catch (IOException e) {
            throw new AudioReadException("Cannot read header", file, e);
        }
        AudioFormat format = fileFormat.getFormat();
        Map<String, Object> properties = fileFormat.properties();

        Double duration = null;
        if (properties.get("duration") instanceof Long micros && micros > 0) {
            duration = micros / 1_000_000.0;
        } else if (fileFormat.getFrameLength() != AudioSystem.NOT_SPECIFIED
                && format.getFrameRate() > 0) {
            duration = fileFormat.getFrameLength() / (double) format.getFrameRate();
        }

        Integer bitrate = null;
        if (properties.get("bitrate") instanceof Integer bps && bps > 0) {
            bitrate = bps / 1000;
        } else if (format.getSampleSizeInBits() > 0) {
            bitrate =
                    (int) (format.getSampleRate() * format.getSampleSizeInBits() * format.getChannels())
                            / 1000;
        }

        return new TrackMetadata(
                stringProperty(properties, "title"),
                stringProperty(properties, "author"),
                stringProperty(properties, "album"),
                null,
                duration,
                bitrate,
                format.getSampleRate() > 0 ? Math.round(format.getSampleRate()) : null,
                format.getChannels() > 0 ? format.getChannels() : null,
                null);
    }

    private static String stringProperty(Map<String, Object> properties, String key) {
        Object value = properties.get(key);
        if (value instanceof String text && !text.isBlank()) {
            return text.strip();
        }
        return null;
    }
}

package audio.decode;

import audio.AudioFiles;
import audio.DecodedStream;
import audio.SampleSource;
import audio.exceptions.UnsupportedAudioFormatException;
import java.nio.file.Path;
import java.util.List;
import lombok.NonNull;

/** Hands each track to the first delegate that claims its extension. */
public class FormatRoutingSampleSource implements SampleSource {

    private final List<SampleSource> delegates;

    public FormatRoutingSampleSource(@NonNull List<SampleSource> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    public static FormatRoutingSampleSource standard() {
        return new FormatRoutingSampleSource(
                List.of(new Mp3SampleSource(), new JavaSoundSampleSource()));
    }

    @Override
    public boolean supports(@NonNull Path track) {
        return delegates.stream().anyMatch(source -> source.supports(track));
    }

    @Override
    public DecodedStream open(@NonNull Path track) {
        for (SampleSource delegate : delegates) {
            if (delegate.supports(track)) {
                return delegate.open(track);
            }
        }
        String extension = AudioFiles.extension(track);
        throw new UnsupportedAudioFormatException(
                "Unsupported audio format: " + (extension.isEmpty() ? track.getFileName() : extension));
    }
}

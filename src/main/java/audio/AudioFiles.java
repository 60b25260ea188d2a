package audio;

import java.nio.file.Path;
import java.util.Locale;
import lombok.NonNull;

/** File-name helpers shared by the decoders and the library scanner. */
public final class AudioFiles {

    private AudioFiles() {}

    /** Lower-case extension without the dot, or an empty string when there is none. */
    public static String extension(@NonNull Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return "";
        }
        String fileName = name.toString();
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /** File name with its extension removed. */
    public static String baseName(@NonNull Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return file.toString();
        }
        String fileName = name.toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}

package library;

/**
 * Tags and stream properties read from a file. Every field is null when absent.
 *
 * @param bitrate kbps
 * @param albumArt Raw image bytes of the front cover, or the first picture if there is no cover
 */
public record TrackMetadata(
        String title,
        String artist,
        String album,
        Integer trackNumber,
        Double durationSeconds,
        Integer bitrate,
        Integer sampleRate,
        Integer channels,
        byte[] albumArt) {

    public static TrackMetadata empty() {
        return new TrackMetadata(null, null, null, null, null, null, null, null, null);
    }

    public boolean hasAlbumArt() {
        return albumArt != null && albumArt.length > 0;
    }
}

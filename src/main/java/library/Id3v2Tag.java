package library;

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

/**
 * Minimal ID3v2 reader for the frames the library shows: title, artist, album, track number and
 * attached pictures. Handles versions 2.2 to 2.4; unsynchronised tags are read as-is.
 */
final class Id3v2Tag {

    private static final int HEADER_SIZE = 10;
    private static final int PICTURE_TYPE_FRONT_COVER = 3;

    String title;
    String artist;
    String album;
    Integer trackNumber;
    byte[] albumArt;
    private boolean hasFrontCover;

    private Id3v2Tag() {}

    /** Empty when the stream does not start with an ID3v2 header. */
    static Optional<Id3v2Tag> read(InputStream in) throws IOException {
        DataInputStream data = new DataInputStream(in);
        byte[] header = new byte[HEADER_SIZE];
        try {
            data.readFully(header);
        } catch (EOFException e) {
            return Optional.empty();
        }
        if (header[0] != 'I' || header[1] != 'D' || header[2] != '3') {
            return Optional.empty();
        }
        int major = header[3];
        int flags = header[5] & 0xff;
        int size = synchsafe(header, 6);
        byte[] body = new byte[size];
        data.readFully(body);

        int position = 0;
        if ((flags & 0x40) != 0 && major >= 3) {
            int extended = major == 4 ? synchsafe(body, 0) : int32(body, 0);
            position = major == 4 ? extended : extended + 4;
        }

        Id3v2Tag tag = new Id3v2Tag();
        if (major == 2) {
            tag.readFrames22(body, position);
        } else if (major == 3 || major == 4) {
            tag.readFrames(body, position, major);
        } else {
            return Optional.empty();
        }
        return Optional.of(tag);
    }

    private void readFrames(byte[] body, int position, int major) {
        while (position + HEADER_SIZE <= body.length) {
            if (body[position] == 0) {
                break; // padding
            }
            String id = new String(body, position, 4, StandardCharsets.ISO_8859_1);
            int size = major == 4 ? synchsafe(body, position + 4) : int32(body, position + 4);
            int start = position + HEADER_SIZE;
            if (size <= 0 || start + size > body.length) {
                break;
            }
            byte[] frame = Arrays.copyOfRange(body, start, start + size);
            switch (id) {
                case "TIT2" -> title = text(frame);
                case "TPE1" -> artist = text(frame);
                case "TALB" -> album = text(frame);
                case "TRCK" -> trackNumber = parseTrack(text(frame));
                case "APIC" -> picture(frame, false);
                default -> {}
            }
            position = start + size;
        }
    }

    private void readFrames22(byte[] body, int position) {
        while (position + 6 <= body.length) {
            if (body[position] == 0) {
                break;
            }
            String id = new String(body, position, 3, StandardCharsets.ISO_8859_1);
            int size =
                    ((body[position + 3] & 0xff) << 16)
                            | ((body[position + 4] & 0xff) << 8)
                            | (body[position + 5] & 0xff);
            int start = position + 6;
            if (size <= 0 || start + size > body.length) {
                break;
            }
            byte[] frame = Arrays.copyOfRange(body, start, start + size);
            switch (id) {
                case "TT2" -> title = text(frame);
                case "TP1" -> artist = text(frame);
                case "TAL" -> album = text(frame);
                case "TRK" -> trackNumber = parseTrack(text(frame));
                case "PIC" -> picture(frame, true);
                default -> {}
            }
            position = start + size;
        }
    }

    private void picture(byte[] frame, boolean legacy) {
        if (frame.length < 4 || hasFrontCover) {
            return;
        }
        int encoding = frame[0];
        int position;
        if (legacy) {
            position = 4; // encoding + 3-byte image format
        } else {
            position = indexOfTerminator(frame, 1, 0) + 1;
        }
        if (position <= 0 || position >= frame.length) {
            return;
        }
        int pictureType = frame[position] & 0xff;
        position = indexOfTerminator(frame, position + 1, encoding);
        if (position < 0) {
            return;
        }
        position += terminatorWidth(encoding);
        if (position >= frame.length) {
            return;
        }
        if (albumArt == null || pictureType == PICTURE_TYPE_FRONT_COVER) {
            albumArt = Arrays.copyOfRange(frame, position, frame.length);
            hasFrontCover = pictureType == PICTURE_TYPE_FRONT_COVER;
        }
    }

    static String text(byte[] frame) {
        if (frame.length < 2) {
            return null;
        }
        Charset charset = charset(frame[0]);
        String value = new String(frame, 1, frame.length - 1, charset);
        int nul = value.indexOf('\0');
        if (nul >= 0) {
            value = value.substring(0, nul);
        }
        value = value.strip();
        return value.isEmpty() ? null : value;
    }

    static Integer parseTrack(String value) {
        if (value == null) {
            return null;
        }
        int slash = value.indexOf('/');
        String number = slash >= 0 ? value.substring(0, slash) : value;
        try {
            return Integer.parseInt(number.strip());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Charset charset(byte encoding) {
        return switch (encoding) {
            case 1 -> StandardCharsets.UTF_16;
            case 2 -> StandardCharsets.UTF_16BE;
            case 3 -> StandardCharsets.UTF_8;
            default -> StandardCharsets.ISO_8859_1;
        };
    }

    private static int terminatorWidth(int encoding) {
        return encoding == 1 || encoding == 2 ? 2 : 1;
    }

    private static int indexOfTerminator(byte[] frame, int from, int encoding) {
        int width = terminatorWidth(encoding);
        for (int i = from; i + width <= frame.length; i += width) {
            if (frame[i] == 0 && (width == 1 || frame[i + 1] == 0)) {
                return i;
            }
        }
        return -1;
    }

    private static int synchsafe(byte[] bytes, int offset) {
        return ((bytes[offset] & 0x7f) << 21)
                | ((bytes[offset + 1] & 0x7f) << 14)
                | ((bytes[offset + 2] & 0x7f) << 7)
                | (bytes[offset + 3] & 0x7f);
    }

    private static int int32(byte[] bytes, int offset) {
        return ((bytes[offset] & 0xff) << 24)
                | ((bytes[offset + 1] & 0xff) << 16)
                | ((bytes[offset + 2] & 0xff) << 8)
                | (bytes[offset + 3] & 0xff);
    }
}

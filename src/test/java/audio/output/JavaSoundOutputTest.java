package audio.output;

import static org.junit.jupiter.api.Assertions.*;

import javax.sound.sampled.AudioFormat;
import org.junit.jupiter.api.Test;

class JavaSoundOutputTest {

    @Test
    void testPcmFormatIsSigned16BitLittleEndian() {
        AudioFormat format = JavaSoundOutput.pcmFormat(48000, 2);

        assertEquals(AudioFormat.Encoding.PCM_SIGNED, format.getEncoding());
        assertEquals(16, format.getSampleSizeInBits());
        assertEquals(4, format.getFrameSize());
        assertEquals(48000f, format.getSampleRate());
        assertFalse(format.isBigEndian());
    }

    @Test
    void testToPcm16ScalesAndClamps() {
        byte[] bytes = JavaSoundOutput.toPcm16(new float[] {0f, 1f, -1f, 2f, 0.5f, 9f}, 5);

        assertEquals(10, bytes.length);
        assertEquals(0, sample(bytes, 0));
        assertEquals(32767, sample(bytes, 1));
        assertEquals(-32767, sample(bytes, 2));
        assertEquals(32767, sample(bytes, 3));
        assertEquals(16383, sample(bytes, 4));
    }

    private static int sample(byte[] bytes, int index) {
        return (short) ((bytes[2 * index] & 0xff) | (bytes[2 * index + 1] << 8));
    }
}

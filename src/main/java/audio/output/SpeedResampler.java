package audio.output;

/**
 * Changes playback speed by linear interpolation over interleaved frames. Keeps the last frame
 * and the fractional read position between blocks, so consecutive blocks join without clicks.
 * One instance per stream position; a seek starts a fresh one. Not thread-safe.
 */
final class SpeedResampler {

    private final int channels;
    private final float[] previous;
    private boolean hasPrevious;
    private double position;
    private float[] output = new float[0];

    SpeedResampler(int channels) {
        if (channels <= 0) {
            throw new IllegalArgumentException("Channel count must be positive: " + channels);
        }
        this.channels = channels;
        this.previous = new float[channels];
    }

    /**
     * Resamples {@code length} samples of {@code input}.
     *
     * @return The block to play. At speed 1 with no carried state this is {@code input} itself
     */
    Block process(float[] input, int length, float speed) {
        if (speed <= 0f || Float.isNaN(speed)) {
            throw new IllegalArgumentException("Speed must be positive: " + speed);
        }
        int inFrames = length / channels;
        if (speed == 1f && !hasPrevious && position == 0) {
            return new Block(input, inFrames * channels);
        }
        if (inFrames == 0) {
            return new Block(input, 0);
        }

        // the sequence is the carried frame (if any) followed by this block
        int offset = hasPrevious ? 1 : 0;
        int totalFrames = inFrames + offset;
        int maxOut = (int) Math.ceil((totalFrames - position) / speed) + 1;
        if (output.length < maxOut * channels) {
            output = new float[maxOut * channels];
        }

        int outFrames = 0;
        while (position + 1 < totalFrames) {
            int index = (int) position;
            float frac = (float) (position - index);
            for (int ch = 0; ch < channels; ch++) {
                float a = frameSample(input, index - offset, ch);
                float b = frameSample(input, index + 1 - offset, ch);
                output[outFrames * channels + ch] = a + frac * (b - a);
            }
            outFrames++;
            position += speed;
        }

        System.arraycopy(input, (inFrames - 1) * channels, previous, 0, channels);
        hasPrevious = true;
        position -= totalFrames - 1;
        return new Block(output, outFrames * channels);
    }

    private float frameSample(float[] input, int frame, int channel) {
        if (frame < 0) {
            return previous[channel];
        }
        return input[frame * channels + channel];
    }

    record Block(float[] samples, int length) {}
}

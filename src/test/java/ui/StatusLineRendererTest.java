package ui;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import playback.MutableClock;
import playback.PlaybackSnapshot;
import playback.PlayerState;
import visualizer.Visualizer;
import visualizer.VisualizerMode;
import visualizer.VisualizerState;

@ExtendWith(OutputCaptureExtension.class)
class StatusLineRendererTest {

    private static PlaybackSnapshot snapshot(PlayerState state, String title, double progress) {
        return snapshot(state, title, progress, false);
    }

    private static PlaybackSnapshot snapshot(
            PlayerState state, String title, double progress, boolean hasAlbumArt) {
        return new PlaybackSnapshot(
                state,
                title == null ? null : 0,
                title,
                title == null ? null : "Boards of Canada",
                title == null ? null : "Geogaddi",
                progress,
                title == null ? 0 : 245,
                state == PlayerState.PLAYING,
                0.8f,
                true,
                "All",
                "Default",
                "Spectrum",
                new float[64],
                "1x",
                null,
                null,
                hasAlbumArt);
    }

    private static VisualizerState quietSpectrum() {
        return new Visualizer().state();
    }

    @Test
    void testFormatPlaying() {
        String line =
                StatusLineRenderer.format(
                        snapshot(PlayerState.PLAYING, "Music Is Math", 65.4), quietSpectrum());

        assertTrue(line.startsWith("[>] Boards of Canada - Music Is Math  01:05/04:05"), line);
        assertTrue(line.contains("vol 80%"));
        assertTrue(line.contains("repeat All"));
        assertTrue(line.contains("shuffle"));
        assertTrue(line.contains("|                |"));
    }

    @Test
    void testFormatMarksAlbumArt() {
        assertTrue(
                StatusLineRenderer.format(
                                snapshot(PlayerState.PAUSED, "Roygbiv", 10, true), quietSpectrum())
                        .contains("04:05  [art]"));
        assertFalse(
                StatusLineRenderer.format(snapshot(PlayerState.PAUSED, "Roygbiv", 10), quietSpectrum())
                        .contains("[art]"));
    }

    @Test
    void testFormatIdleWithoutSpectrum() {
        float[] zeros = new float[64];
        VisualizerState off =
                new VisualizerState(VisualizerMode.OFF, zeros, zeros, zeros, zeros, new float[200]);

        String line = StatusLineRenderer.format(snapshot(PlayerState.IDLE, null, 0), off);

        assertTrue(line.startsWith("[ ] stopped"), line);
        assertFalse(line.contains("|"));
    }

    @Test
    void testClockTime() {
        assertEquals("00:00", StatusLineRenderer.clockTime(-3));
        assertEquals("03:20", StatusLineRenderer.clockTime(200.9));
        assertEquals("61:01", StatusLineRenderer.clockTime(3661));
    }

    @Test
    void testSpectrumLevels() {
        float[] bars = new float[64];
        for (int i = 60; i < 64; i++) {
            bars[i] = 1f;
        }
        bars[0] = 0.5f;

        String spectrum = StatusLineRenderer.spectrum(bars);

        assertEquals(16, spectrum.length());
        assertEquals('@', spectrum.charAt(15));
        assertEquals(' ', spectrum.charAt(7));
        assertNotEquals(' ', spectrum.charAt(0));
    }

    @Test
    void testRendersAtMostOncePerInterval(CapturedOutput output) {
        MutableClock clock = new MutableClock(Instant.EPOCH);
        StatusLineRenderer renderer = new StatusLineRenderer(clock, Duration.ofSeconds(1));

        renderer.render(snapshot(PlayerState.PLAYING, "Alpha Tone", 1), quietSpectrum());
        clock.advance(Duration.ofMillis(500));
        renderer.render(snapshot(PlayerState.PLAYING, "Alpha Tone", 2), quietSpectrum());
        assertFalse(output.getOut().contains("00:02/"));

        clock.advance(Duration.ofMillis(600));
        renderer.render(snapshot(PlayerState.PLAYING, "Alpha Tone", 3), quietSpectrum());
        assertTrue(output.getOut().contains("00:01/"));
        assertTrue(output.getOut().contains("00:03/"));
    }
}

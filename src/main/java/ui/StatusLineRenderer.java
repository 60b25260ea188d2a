package ui;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import playback.PlaybackSnapshot;
import visualizer.VisualizerMode;
import visualizer.VisualizerState;

/** Logs a one-line status, at most once per interval and only when the text changed. */
@Slf4j
public class StatusLineRenderer implements Renderer {

    private static final String LEVELS = " .:-=+*#%@";
    private static final int SPECTRUM_COLUMNS = 16;

    private final Clock clock;
    private final Duration interval;
    private Instant lastRender;
    private String lastLine = "";

    public StatusLineRenderer(@NonNull Clock clock, @NonNull Duration interval) {
        this.clock = clock;
        this.interval = interval;
    }

    @Override
    public void render(@NonNull PlaybackSnapshot snapshot, @NonNull VisualizerState visualizer) {
        Instant now = clock.instant();
        if (lastRender != null && Duration.between(lastRender, now).compareTo(interval) < 0) {
            return;
        }
        String line = format(snapshot, visualizer);
        if (line.equals(lastLine)) {
            return;
        }
        lastRender = now;
        lastLine = line;
        log.info(line);
    }

    static String format(PlaybackSnapshot snapshot, VisualizerState visualizer) {
        StringBuilder line = new StringBuilder();
        line.append(switch (snapshot.state()) {
            case PLAYING -> "[>]";
            case PAUSED -> "[||]";
            case IDLE -> "[ ]";
        });
        if (snapshot.trackTitle() != null) {
            line.append(' ').append(snapshot.trackArtist()).append(" - ").append(snapshot.trackTitle());
            line.append("  ")
                    .append(clockTime(snapshot.progress()))
                    .append('/')
                    .append(clockTime(snapshot.duration()));
            if (snapshot.hasAlbumArt()) {
                line.append("  [art]");
            }
        } else {
            line.append(" stopped");
        }
        line.append(String.format(Locale.ROOT, "  vol %d%%", Math.round(snapshot.volume() * 100)));
        line.append("  ").append(snapshot.speed());
        line.append("  repeat ").append(snapshot.repeat());
        if (snapshot.shuffle()) {
            line.append("  shuffle");
        }
        if (snapshot.sleepTimerRemainingSeconds() != null) {
            line.append("  sleep ").append(clockTime(snapshot.sleepTimerRemainingSeconds()));
        }
        if (visualizer.mode() == VisualizerMode.FREQUENCY_BARS) {
            line.append("  |").append(spectrum(visualizer.bars())).append('|');
        }
        if (snapshot.errorMessage() != null) {
            line.append("  error: ").append(snapshot.errorMessage());
        }
        return line.toString();
    }

    static String clockTime(double seconds) {
        long total = (long) Math.max(0, seconds);
        return String.format(Locale.ROOT, "%02d:%02d", total / 60, total % 60);
    }

    /** Folds the bars into a few columns of level characters. */
    static String spectrum(float[] bars) {
        StringBuilder out = new StringBuilder(SPECTRUM_COLUMNS);
        int perColumn = Math.max(1, bars.length / SPECTRUM_COLUMNS);
        for (int column = 0; column < SPECTRUM_COLUMNS && column * perColumn < bars.length; column++) {
            float peak = 0f;
            for (int i = column * perColumn; i < Math.min(bars.length, (column + 1) * perColumn); i++) {
                peak = Math.max(peak, bars[i]);
            }
            int level = Math.round(Math.max(0f, Math.min(1f, peak)) * (LEVELS.length() - 1));
            out.append(LEVELS.charAt(level));
        }
        return out.toString();
    }
}

package ui;

import com.google.errorprone.annotations.ThreadSafe;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import playback.PlaybackOrchestrator;

/**
 * Drives the player at a fixed rate on the event dispatch thread: one orchestrator tick, then one
 * rendered frame.
 */
@ThreadSafe
@Slf4j
public class PlayerLoop {

    private final ScheduledExecutorService edt;
    private final PlaybackOrchestrator player;
    private final Renderer renderer;
    private final Duration tickInterval;
    private volatile ScheduledFuture<?> ticking;

    public PlayerLoop(
            @NonNull ScheduledExecutorService edt,
            @NonNull PlaybackOrchestrator player,
            @NonNull Renderer renderer,
            @NonNull Duration tickInterval) {
        this.edt = edt;
        this.player = player;
        this.renderer = renderer;
        this.tickInterval = tickInterval;
    }

    public synchronized void start() {
        if (ticking != null) {
            return;
        }
        long period = tickInterval.toMillis();
        ticking = edt.scheduleAtFixedRate(this::tick, 0, period, TimeUnit.MILLISECONDS);
        log.debug("Player loop started at {}ms", period);
    }

    public synchronized void stop() {
        ScheduledFuture<?> current = ticking;
        ticking = null;
        if (current != null) {
            current.cancel(false);
        }
    }

    public boolean isRunning() {
        return ticking != null;
    }

    // an exception escaping a scheduled task would cancel it
    void tick() {
        try {
            player.tick();
            renderer.render(player.snapshot(), player.getVisualizer().state());
        } catch (RuntimeException e) {
            log.warn("Player tick failed", e);
        }
    }
}

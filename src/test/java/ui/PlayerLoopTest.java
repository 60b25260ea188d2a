package ui;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import playback.PlaybackOrchestrator;
import playback.RecordingEngine;

@Timeout(5)
class PlayerLoopTest {

    private final ScheduledExecutorService edt = Executors.newSingleThreadScheduledExecutor();

    @AfterEach
    void tearDown() {
        edt.shutdownNow();
    }

    @Test
    void testTicksUntilStopped() throws InterruptedException {
        PlaybackOrchestrator player = UiFixtures.player(new RecordingEngine());
        CountDownLatch frames = new CountDownLatch(3);
        PlayerLoop loop =
                new PlayerLoop(edt, player, (snapshot, vis) -> frames.countDown(), Duration.ofMillis(5));

        loop.start();
        assertTrue(loop.isRunning());
        assertTrue(frames.await(2, TimeUnit.SECONDS));

        loop.stop();
        assertFalse(loop.isRunning());
    }

    @Test
    void testFailingRenderDoesNotCancelLoop() throws InterruptedException {
        PlaybackOrchestrator player = UiFixtures.player(new RecordingEngine());
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch survived = new CountDownLatch(1);
        PlayerLoop loop =
                new PlayerLoop(
                        edt,
                        player,
                        (snapshot, vis) -> {
                            if (calls.incrementAndGet() == 1) {
                                throw new IllegalStateException("render failed");
                            }
                            survived.countDown();
                        },
                        Duration.ofMillis(5));

        loop.start();

        assertTrue(survived.await(2, TimeUnit.SECONDS));
        loop.stop();
    }
}

package audio.engine;

import static org.junit.jupiter.api.Assertions.*;

import audio.PlaybackCommand;
import audio.PlaybackEvent;
import audio.PlaybackState;
import audio.SyntheticSampleSource;
import audio.exceptions.AudioOutputException;
import audio.output.NullAudioOutput;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(20)
class StreamingPlaybackEngineTest {

    private static final Path LONG = Path.of("long.wav");
    private static final Path SHORT = Path.of("short.wav");
    private static final Path OVERRUN = Path.of("overrun.wav");
    private static final Path STEREO = Path.of("stereo.wav");
    private static final Path STUCK = Path.of("stuck.wav");

    private SyntheticSampleSource source;
    private StreamingPlaybackEngine engine;
    private final List<PlaybackEvent> events = new ArrayList<>();

    @BeforeEach
    void setUp() {
        source =
                new SyntheticSampleSource()
                        .add("long.wav", 1000, 1, 600)
                        .add("short.wav", 1000, 1, 0.5)
                        .add("stereo.wav", 8000, 2, 600)
                        .add("overrun.wav", new SyntheticSampleSource.Tone(1000, 1, 200, 205, true))
                        .add("stuck.wav", new SyntheticSampleSource.Tone(1000, 1, 600, 600, false));
    }

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.close();
        }
    }

    private StreamingPlaybackEngine start(NullAudioOutput output) {
        engine = new StreamingPlaybackEngine(source, output, EngineSettings.defaults());
        engine.start();
        awaitTrue(engine::isRunning);
        return engine;
    }

    private void drain() {
        events.addAll(engine.drainEvents());
    }

    /** Waits for the first event of the type not seen by an earlier call. */
    private <T extends PlaybackEvent> T awaitEvent(Class<T> type) {
        long wanted = count(type) + 1;
        while (count(type) < wanted) {
            sleep(5);
            drain();
        }
        return events.stream().filter(type::isInstance).map(type::cast).reduce((a, b) -> b).get();
    }

    private long count(Class<? extends PlaybackEvent> type) {
        return events.stream().filter(type::isInstance).count();
    }

    private static void awaitTrue(BooleanSupplier condition) {
        while (!condition.getAsBoolean()) {
            sleep(5);
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError(e);
        }
    }

    @Test
    void testPlayEmitsPlayingWithDuration() {
        start(new NullAudioOutput(true));
        assertTrue(engine.send(new PlaybackCommand.Play(LONG)));

        PlaybackEvent.Playing playing = awaitEvent(PlaybackEvent.Playing.class);
        assertEquals(600.0, playing.durationSeconds(), 1e-9);
        assertEquals(PlaybackState.PLAYING, engine.state());
        assertEquals(1, source.openedCount());
    }

    @Test
    void testUnknownDurationReportsZero() {
        source.add("endless.wav", new SyntheticSampleSource.Tone(1000, 1, 0, 600, true));
        start(new NullAudioOutput(true));
        engine.send(new PlaybackCommand.Play(Path.of("endless.wav")));

        assertEquals(0.0, awaitEvent(PlaybackEvent.Playing.class).durationSeconds());
    }

    @Test
    @DisplayName("position reflects a seek as soon as the engine handles it")
    void testSeekRewritesCounter() {
        start(new NullAudioOutput(true));
        engine.send(new PlaybackCommand.Play(LONG));
        awaitEvent(PlaybackEvent.Playing.class);

        engine.send(new PlaybackCommand.Seek(30.0));
        awaitTrue(() -> engine.positionSeconds() >= 30.0);
        // at most one more block may have been read since
        assertTrue(engine.positionSeconds() < 32.0);
    }

    @Test
    void testNegativeSeekIsClampedToStart() {
        start(new NullAudioOutput(true));
        engine.send(new PlaybackCommand.Play(LONG));
        awaitEvent(PlaybackEvent.Playing.class);
        engine.send(new PlaybackCommand.Seek(100.0));
        awaitTrue(() -> engine.positionSeconds() >= 100.0);

        engine.send(new PlaybackCommand.Seek(-10.0));
        awaitTrue(() -> engine.positionSeconds() < 2.0);
        assertEquals(PlaybackState.PLAYING, engine.state());
    }

    @Test
    void testSeekPastEndFinishesTrack() {
        start(new NullAudioOutput(true));
        engine.send(new PlaybackCommand.Play(LONG));
        awaitEvent(PlaybackEvent.Playing.class);

        engine.send(new PlaybackCommand.Seek(9999.0));
        awaitEvent(PlaybackEvent.TrackFinished.class);

        assertEquals(0, count(PlaybackEvent.Error.class));
        assertEquals(PlaybackState.IDLE, engine.state());
    }

    @Test
    void testShortTrackFinishes() {
        start(new NullAudioOutput(true));
        engine.send(new PlaybackCommand.Play(SHORT));

        awaitEvent(PlaybackEvent.TrackFinished.class);
        assertEquals(1, count(PlaybackEvent.Playing.class));
    }

    @Test
    void testSeekFailureRestoresPosition() {
        start(new NullAudioOutput(true));
        engine.send(new PlaybackCommand.Play(STUCK));
        awaitEvent(PlaybackEvent.Playing.class);
        awaitTrue(() -> engine.positionSeconds() > 0.05);

        engine.send(new PlaybackCommand.Seek(300.0));
        PlaybackEvent.Error error = awaitEvent(PlaybackEvent.Error.class);

        assertEquals("Stream is not seekable", error.message());
        assertFalse(error.loadFailure());
        assertTrue(engine.positionSeconds() < 300.0);
        assertEquals(PlaybackState.PLAYING, engine.state());
    }

    @Test
    void testSeekWhileIdleIsIgnored() {
        start(new NullAudioOutput(true));
        engine.send(new PlaybackCommand.Seek(10.0));
        engine.send(new PlaybackCommand.Play(LONG));
        awaitEvent(PlaybackEvent.Playing.class);

        assertTrue(engine.positionSeconds() < 10.0);
        assertEquals(0, count(PlaybackEvent.Error.class));
    }

    @Test
    @DisplayName("volume above 1.0 reaches the output unclamped")
    void testSetVolumeIsNotClamped() {
        NullAudioOutput output = new NullAudioOutput(true);
        start(output);
        engine.send(new PlaybackCommand.SetVolume(1.5f));

        awaitTrue(() -> output.getVolume() == 1.5f);
        assertEquals(1.5f, output.getVolume());
    }

    @Test
    void testSetSpeedReachesOutput() {
        NullAudioOutput output = new NullAudioOutput(true);
        start(output);
        engine.send(new PlaybackCommand.SetSpeed(1.25f));

        awaitTrue(() -> output.getSpeed() == 1.25f);
    }

    @Test
    void testDecodeFailureIsRecoverable() {
        start(new NullAudioOutput(true));
        engine.send(new PlaybackCommand.Play(Path.of("missing.mp3")));

        PlaybackEvent.Error error = awaitEvent(PlaybackEvent.Error.class);
        assertTrue(error.message().contains("missing.mp3"));
        assertTrue(error.loadFailure());
        assertEquals(PlaybackState.IDLE, engine.state());
        assertTrue(engine.isRunning());

        engine.send(new PlaybackCommand.Play(LONG));
        awaitEvent(PlaybackEvent.Playing.class);
        assertEquals(PlaybackState.PLAYING, engine.state());
    }

    @Test
    void testOutputInitFailureIsFatal() {
        NullAudioOutput broken =
                new NullAudioOutput(true) {
                    @Override
                    protected void openDevice() {
                        throw new AudioOutputException("no device");
                    }
                };
        engine = new StreamingPlaybackEngine(source, broken, EngineSettings.defaults());
        engine.start();

        PlaybackEvent.Error error = awaitEvent(PlaybackEvent.Error.class);
        assertEquals("Audio output unavailable: no device", error.message());
        awaitTrue(engine::isTerminated);
        assertFalse(engine.isRunning());
        assertFalse(engine.send(new PlaybackCommand.Play(LONG)));

        sleep(50);
        drain();
        assertEquals(1, count(PlaybackEvent.Error.class));
    }

    @Test
    @DisplayName("a stream that runs past its declared length finishes exactly once")
    void testSingleTrackFinished() {
        start(new NullAudioOutput(false));
        engine.send(new PlaybackCommand.Play(OVERRUN));

        awaitEvent(PlaybackEvent.TrackFinished.class);
        sleep(200);
        drain();

        assertEquals(1, count(PlaybackEvent.TrackFinished.class));
        assertEquals(PlaybackState.IDLE, engine.state());
        assertEquals(1, source.closedCount());
    }

    @Test
    void testProgressIsMonotoneWhilePlaying() {
        start(new NullAudioOutput(true));
        engine.send(new PlaybackCommand.Play(LONG));
        awaitEvent(PlaybackEvent.Playing.class);
        sleep(300);
        drain();

        int playingAt = -1;
        for (int i = 0; i < events.size(); i++) {
            if (events.get(i) instanceof PlaybackEvent.Playing) {
                playingAt = i;
            }
        }
        double last = -1;
        int progressEvents = 0;
        for (PlaybackEvent event : events.subList(playingAt + 1, events.size())) {
            if (event instanceof PlaybackEvent.Progress progress) {
                assertTrue(progress.positionSeconds() >= last);
                last = progress.positionSeconds();
                progressEvents++;
            }
        }
        assertTrue(progressEvents >= 3, "expected regular progress, got " + progressEvents);
    }

    @Test
    @DisplayName("play while playing cancels the previous track")
    void testPlayCancelsPreviousTrack() {
        start(new NullAudioOutput(true));
        engine.send(new PlaybackCommand.Play(LONG));
        awaitEvent(PlaybackEvent.Playing.class);
        engine.send(new PlaybackCommand.Seek(100.0));
        awaitTrue(() -> engine.positionSeconds() >= 100.0);

        engine.send(new PlaybackCommand.Play(STEREO));
        awaitEvent(PlaybackEvent.Playing.class);

        assertTrue(engine.positionSeconds() < 5.0);
        assertEquals(1, source.closedCount());
        assertEquals(0, count(PlaybackEvent.TrackFinished.class));
    }

    @Test
    void testStopResetsToIdle() {
        start(new NullAudioOutput(true));
        engine.send(new PlaybackCommand.Play(LONG));
        awaitEvent(PlaybackEvent.Playing.class);
        awaitTrue(() -> engine.positionSeconds() > 0.05);

        engine.send(new PlaybackCommand.Stop());
        awaitTrue(() -> engine.state() == PlaybackState.IDLE);

        assertEquals(0.0, engine.positionSeconds());
        sleep(100);
        drain();
        assertEquals(0, count(PlaybackEvent.TrackFinished.class));
    }

    @Test
    void testPauseHoldsPosition() {
        start(new NullAudioOutput(true));
        engine.send(new PlaybackCommand.Play(LONG));
        awaitEvent(PlaybackEvent.Playing.class);

        engine.send(new PlaybackCommand.Pause());
        awaitTrue(() -> engine.state() == PlaybackState.PAUSED);
        sleep(50);
        double paused = engine.positionSeconds();
        sleep(150);
        // one read may already be in flight when the pause lands
        assertEquals(paused, engine.positionSeconds(), 1.1);

        engine.send(new PlaybackCommand.Resume());
        awaitTrue(() -> engine.state() == PlaybackState.PLAYING);
    }

    @Test
    void testVisualizerChunksAreMono() {
        start(new NullAudioOutput(true));
        engine.send(new PlaybackCommand.Play(STEREO));
        awaitEvent(PlaybackEvent.Playing.class);

        Optional<float[]> chunk;
        while ((chunk = engine.pollLatestSamples()).isEmpty()) {
            sleep(5);
        }
        // 8000 Hz stereo: 532 interleaved samples per chunk is 266 frames
        assertEquals(266, chunk.get().length);
    }

    @Test
    void testCloseTerminatesAndRejectsCommands() {
        start(new NullAudioOutput(true));
        engine.send(new PlaybackCommand.Play(LONG));
        awaitEvent(PlaybackEvent.Playing.class);

        engine.close();

        assertTrue(engine.isTerminated());
        assertFalse(engine.send(new PlaybackCommand.Pause()));
        assertEquals(1, source.closedCount());
    }

    @Test
    void testCloseBeforeStart() {
        engine =
                new StreamingPlaybackEngine(
                        source,
                        new NullAudioOutput(true),
                        new EngineSettings(1, 1, 1, Duration.ofMillis(5), Duration.ofMillis(5)));
        engine.close();

        assertTrue(engine.isTerminated());
        assertFalse(engine.send(new PlaybackCommand.Play(LONG)));
    }
}

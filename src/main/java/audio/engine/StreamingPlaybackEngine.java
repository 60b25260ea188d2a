package audio.engine;

import audio.DecodedStream;
import audio.PlaybackCommand;
import audio.PlaybackEngine;
import audio.PlaybackEvent;
import audio.PlaybackState;
import audio.SampleSource;
import audio.exceptions.AudioLoadException;
import audio.exceptions.AudioOutputException;
import audio.exceptions.AudioSeekException;
import audio.output.AudioOutput;
import com.google.errorprone.annotations.ThreadSafe;
import java.nio.file.Path;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Playback engine backed by a single worker thread that owns the {@link AudioOutput}. Commands and
 * events travel through bounded queues; neither side ever blocks on the other.
 *
 * <p>The worker loop is flat: check for a drained finish, emit progress when due, then wait up to
 * the poll timeout for one command. Decode failures are reported as {@link PlaybackEvent.Error}
 * and leave the engine idle. Failing to open the output at startup is reported once and ends the
 * worker.
 */
@ThreadSafe
@Slf4j
public class StreamingPlaybackEngine implements PlaybackEngine {

    private final SampleSource source;
    private final AudioOutput output;
    private final EngineSettings settings;
    private final BlockingQueue<PlaybackCommand> commands;
    private final BlockingQueue<PlaybackEvent> events;
    private final LatestWinsChannel<float[]> visualizerChannel;
    private final EngineLifecycle lifecycle = new EngineLifecycle();

    private volatile Thread worker;
    private volatile PlaybackCounters counters;
    private volatile PlaybackState state = PlaybackState.IDLE;

    // worker-confined
    private CaptureStream capture;
    private OptionalDouble duration = OptionalDouble.empty();

    public StreamingPlaybackEngine(
            @NonNull SampleSource source,
            @NonNull AudioOutput output,
            @NonNull EngineSettings settings) {
        this.source = source;
        this.output = output;
        this.settings = settings;
        this.commands = new ArrayBlockingQueue<>(settings.commandCapacity());
        this.events = new ArrayBlockingQueue<>(settings.eventCapacity());
        this.visualizerChannel = new LatestWinsChannel<>(settings.visualizerCapacity());
    }

    @Override
    public void start() {
        lifecycle.transition(EngineLifecycle.State.NEW, EngineLifecycle.State.STARTING);
        Thread thread = new Thread(this::run, "tunebox-playback-engine");
        thread.setDaemon(true);
        worker = thread;
        thread.start();
    }

    @Override
    public boolean send(@NonNull PlaybackCommand command) {
        if (!lifecycle.acceptsCommands()) {
            log.debug("Engine is {}, discarding {}", lifecycle.getCurrentState(), command);
            return false;
        }
        boolean accepted = commands.offer(command);
        if (!accepted) {
            log.trace("Command queue full, rejected {}", command);
        }
        return accepted;
    }

    @Override
    public Optional<PlaybackEvent> pollEvent() {
        return Optional.ofNullable(events.poll());
    }

    @Override
    public Optional<float[]> pollLatestSamples() {
        return visualizerChannel.pollLatest();
    }

    @Override
    public double positionSeconds() {
        PlaybackCounters current = counters;
        return current == null ? 0.0 : current.positionSeconds();
    }

    @Override
    public PlaybackState state() {
        return state;
    }

    @Override
    public boolean isRunning() {
        return lifecycle.isRunning();
    }

    boolean isTerminated() {
        return lifecycle.isTerminated();
    }

    @Override
    public void close() {
        if (lifecycle.compareAndSetState(
                EngineLifecycle.State.NEW, EngineLifecycle.State.TERMINATED)) {
            return;
        }
        boolean closing =
                lifecycle.compareAndSetState(
                                EngineLifecycle.State.RUNNING, EngineLifecycle.State.CLOSING)
                        || lifecycle.compareAndSetState(
                                EngineLifecycle.State.STARTING, EngineLifecycle.State.CLOSING);
        if (!closing) {
            return;
        }
        Thread thread = worker;
        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(TimeUnit.SECONDS.toMillis(2));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (thread.isAlive()) {
                log.warn("Playback worker did not stop within 2s");
            }
        }
    }

    private void run() {
        try {
            output.open();
        } catch (AudioOutputException e) {
            log.error("Audio output unavailable, engine stopping", e);
            emit(new PlaybackEvent.Error("Audio output unavailable: " + e.getMessage()));
            lifecycle.compareAndSetState(
                    EngineLifecycle.State.STARTING, EngineLifecycle.State.TERMINATED);
            return;
        }
        if (!lifecycle.compareAndSetState(
                EngineLifecycle.State.STARTING, EngineLifecycle.State.RUNNING)) {
            output.close();
            lifecycle.compareAndSetState(
                    EngineLifecycle.State.CLOSING, EngineLifecycle.State.TERMINATED);
            return;
        }
        log.info("Playback engine running");

        long progressNanos = settings.progressInterval().toNanos();
        long pollMillis = settings.pollTimeout().toMillis();
        long nextProgress = System.nanoTime();
        try {
            while (lifecycle.isRunning()) {
                checkFinished();
                long now = System.nanoTime();
                if (now - nextProgress >= 0) {
                    emit(new PlaybackEvent.Progress(positionSeconds()));
                    nextProgress = now + progressNanos;
                }
                PlaybackCommand command;
                try {
                    command = commands.poll(pollMillis, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
                if (command != null) {
                    handleSafely(command);
                }
            }
        } finally {
            endSession();
            output.close();
            lifecycle.compareAndSetState(
                    EngineLifecycle.State.CLOSING, EngineLifecycle.State.TERMINATED);
            log.info("Playback engine stopped");
        }
    }

    private void handleSafely(PlaybackCommand command) {
        try {
            handle(command);
        } catch (RuntimeException e) {
            log.warn("Failed to handle {}", command, e);
            emit(new PlaybackEvent.Error(describe(e), command instanceof PlaybackCommand.Play));
        }
    }

    private void handle(PlaybackCommand command) {
        log.debug("Handling {}", command);
        if (command instanceof PlaybackCommand.Play play) {
            play(play.track());
        } else if (command instanceof PlaybackCommand.Pause) {
            if (capture != null && state == PlaybackState.PLAYING) {
                output.pause();
                state = PlaybackState.PAUSED;
            }
        } else if (command instanceof PlaybackCommand.Resume) {
            if (capture != null && state == PlaybackState.PAUSED) {
                output.resume();
                state = PlaybackState.PLAYING;
            }
        } else if (command instanceof PlaybackCommand.Stop) {
            endSession();
        } else if (command instanceof PlaybackCommand.Seek seek) {
            seek(seek.positionSeconds());
        } else if (command instanceof PlaybackCommand.SetVolume volume) {
            output.setVolume(volume.volume());
        } else if (command instanceof PlaybackCommand.SetSpeed speed) {
            output.setSpeed(speed.speed());
        } else {
            throw new IllegalArgumentException("Unknown command: " + command);
        }
    }

    private void play(Path track) {
        endSession();
        DecodedStream decoded;
        try {
            decoded = source.open(track);
        } catch (AudioLoadException e) {
            log.warn("Cannot play {}: {}", track, e.getMessage());
            emit(new PlaybackEvent.Error(describe(e), true));
            return;
        }

        PlaybackCounters fresh =
                new PlaybackCounters(decoded.sampleRate(), decoded.channelCount());
        CaptureStream wrapped = new CaptureStream(decoded, fresh, visualizerChannel);
        visualizerChannel.clear();
        try {
            output.play(wrapped);
        } catch (RuntimeException e) {
            wrapped.close();
            throw e;
        }
        capture = wrapped;
        counters = fresh;
        duration = decoded.totalDuration();
        state = PlaybackState.PLAYING;
        log.info("Playing {}", track);
        emit(new PlaybackEvent.Playing(duration.orElse(0.0)));
    }

    private void seek(double requested) {
        PlaybackCounters current = counters;
        if (capture == null || current == null) {
            log.debug("Seek with nothing loaded, ignoring");
            return;
        }
        double target = Math.max(0.0, requested);
        if (duration.isPresent()) {
            target = Math.min(target, duration.getAsDouble());
        }
        long previous = current.samples();
        current.seekTo(target);
        try {
            output.seek(target);
        } catch (AudioSeekException e) {
            current.restore(previous);
            log.warn("Seek to {}s failed: {}", target, e.getMessage());
            emit(new PlaybackEvent.Error(describe(e)));
        }
    }

    private void checkFinished() {
        PlaybackCounters current = counters;
        if (current == null || !current.isFinished() || !output.isDrained()) {
            return;
        }
        if (current.consumeFinished()) {
            log.debug("Track finished at {}s", current.positionSeconds());
            emit(new PlaybackEvent.TrackFinished());
            endSession();
        }
    }

    /** Detaches the capture before stopping so the old track cannot touch fresh counters. */
    private void endSession() {
        CaptureStream ending = capture;
        capture = null;
        counters = null;
        duration = OptionalDouble.empty();
        state = PlaybackState.IDLE;
        if (ending != null) {
            ending.detach();
            output.stop();
            ending.close();
        }
    }

    private void emit(PlaybackEvent event) {
        if (!events.offer(event)) {
            log.trace("Event queue full, dropped {}", event);
        }
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}

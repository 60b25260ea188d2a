package playback;

import audio.AudioReadException;
import audio.PlaybackCommand;
import audio.PlaybackEngine;
import audio.PlaybackEvent;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;
import library.MetadataReader;
import library.Track;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import visualizer.Visualizer;

/**
 * Player state machine: playlist, selection and search, shuffle and repeat, volume, speed and the
 * sleep timer. Turns user and remote intents into engine commands and folds engine events back
 * into its own state.
 *
 * <p>Not thread-safe. Every call, including {@link #tick()}, must come from the event dispatch
 * thread.
 */
@Slf4j
public class PlaybackOrchestrator {

    static final float VOLUME_STEP = 0.05f;
    static final double SEEK_STEP_SECONDS = 5.0;
    static final double RESTART_THRESHOLD_SECONDS = 3.0;

    private final PlaybackEngine engine;
    private final Visualizer visualizer;
    private final MetadataReader metadataReader;
    private final Clock clock;
    @Getter private final List<Track> library;
    private final ShuffleOrder shuffleOrder;
    private final List<PlayerListener> listeners = new CopyOnWriteArrayList<>();

    private List<Integer> filteredIndices;
    @Getter private int selectedIndex;
    private int playingIndex = -1;
    @Getter private boolean playing;
    @Getter private float volume;
    @Getter private boolean shuffle;
    @Getter private RepeatMode repeat = RepeatMode.OFF;
    @Getter private double progress;
    @Getter private double duration;
    @Getter private Theme theme = Theme.DEFAULT;
    @Getter private PlaybackSpeed speed = PlaybackSpeed.NORMAL;
    @Getter private boolean miniMode;
    @Getter private boolean showInfo;
    @Getter private boolean searchMode;
    private final StringBuilder searchQuery = new StringBuilder();
    private SleepTimer sleepTimer;
    private byte[] albumArt;
    private String errorMessage;

    // Play commands the engine has not yet answered with Playing or a load failure. Progress and
    // TrackFinished arriving meanwhile belong to a replaced track.
    private int pendingStarts;

    private PlayerState lastPublishedState = PlayerState.IDLE;
    private int lastPublishedIndex = -1;

    public PlaybackOrchestrator(
            @NonNull PlaybackEngine engine,
            @NonNull Visualizer visualizer,
            @NonNull MetadataReader metadataReader,
            @NonNull List<Track> library,
            @NonNull Clock clock,
            @NonNull Random random,
            float initialVolume) {
        this.engine = engine;
        this.visualizer = visualizer;
        this.metadataReader = metadataReader;
        this.library = List.copyOf(library);
        this.clock = clock;
        this.shuffleOrder = new ShuffleOrder(random);
        this.volume = clamp(initialVolume);
        this.filteredIndices = allIndices();
        send(new PlaybackCommand.SetVolume(volume));
    }

    public void addListener(@NonNull PlayerListener listener) {
        listeners.add(listener);
    }

    // Transport

    /** Starts {@code index} from the beginning. Out-of-range indices are ignored. */
    public void play(int index) {
        if (index < 0 || index >= library.size()) {
            log.debug("Ignoring play of out-of-range index {}", index);
            return;
        }
        Track track = library.get(index);
        playingIndex = index;
        playing = true;
        progress = 0.0;
        duration = track.durationSeconds();
        loadAlbumArt(track);
        if (send(new PlaybackCommand.Play(track.path()))) {
            pendingStarts++;
        }
        publish();
    }

    public void playSelected() {
        if (filteredIndices.isEmpty()) {
            return;
        }
        play(filteredIndices.get(selectedIndex));
    }

    /** Pauses or resumes; plays the selection when nothing is loaded. */
    public void togglePause() {
        if (playingIndex < 0) {
            playSelected();
            return;
        }
        playing = !playing;
        send(playing ? new PlaybackCommand.Resume() : new PlaybackCommand.Pause());
        publishIfChanged();
    }

    public void stop() {
        send(new PlaybackCommand.Stop());
        goIdle();
    }

    /**
     * Advances to the next track.
     *
     * @return false when already at the end and the repeat mode does not wrap
     */
    public boolean next() {
        if (library.isEmpty()) {
            return false;
        }
        OptionalInt target = shuffle ? nextShuffled() : nextSequential();
        if (target.isEmpty()) {
            log.debug("End of playlist, repeat {}", repeat);
            return false;
        }
        play(target.getAsInt());
        return true;
    }

    private OptionalInt nextSequential() {
        if (playingIndex < 0) {
            return OptionalInt.of(0);
        }
        int next = playingIndex + 1;
        if (next < library.size()) {
            return OptionalInt.of(next);
        }
        return repeat == RepeatMode.ALL ? OptionalInt.of(0) : OptionalInt.empty();
    }

    private OptionalInt nextShuffled() {
        if (shuffleOrder.isEmpty()) {
            shuffleOrder.regenerate(library.size());
        }
        if (playingIndex < 0) {
            return OptionalInt.of(shuffleOrder.get(0));
        }
        int position = shuffleOrder.positionOf(playingIndex);
        if (position < 0) {
            return OptionalInt.of(shuffleOrder.get(0));
        }
        if (position + 1 < shuffleOrder.size()) {
            return OptionalInt.of(shuffleOrder.get(position + 1));
        }
        if (repeat == RepeatMode.ALL) {
            shuffleOrder.regenerate(library.size());
            return OptionalInt.of(shuffleOrder.get(0));
        }
        return OptionalInt.empty();
    }

    /** Restarts the track when more than three seconds in, otherwise steps back one. */
    public void prev() {
        if (library.isEmpty()) {
            return;
        }
        if (progress > RESTART_THRESHOLD_SECONDS && playingIndex >= 0) {
            play(playingIndex);
            return;
        }
        int target;
        if (playingIndex < 0) {
            target = 0;
        } else if (playingIndex == 0) {
            target = repeat == RepeatMode.ALL ? library.size() - 1 : 0;
        } else {
            target = playingIndex - 1;
        }
        play(target);
    }

    public void handleTrackFinished() {
        if (repeat == RepeatMode.ONE && playingIndex >= 0) {
            play(playingIndex);
            return;
        }
        if (!next()) {
            goIdle();
        }
    }

    public void seekForward() {
        seekTo(Math.min(progress + SEEK_STEP_SECONDS, duration));
    }

    public void seekBackward() {
        seekTo(Math.max(progress - SEEK_STEP_SECONDS, 0.0));
    }

    public void seekTo(double seconds) {
        if (playingIndex < 0) {
            return;
        }
        double target = Math.max(0.0, seconds);
        if (duration > 0) {
            target = Math.min(target, duration);
        }
        progress = target;
        send(new PlaybackCommand.Seek(target));
    }

    private void goIdle() {
        playing = false;
        playingIndex = -1;
        progress = 0.0;
        duration = 0.0;
        albumArt = null;
        publishIfChanged();
    }

    // Volume, speed and sleep timer

    public void volumeUp() {
        setVolume(volume + VOLUME_STEP);
    }

    public void volumeDown() {
        setVolume(volume - VOLUME_STEP);
    }

    /** Clamped to [0, 1]. */
    public void setVolume(float requested) {
        volume = clamp(requested);
        send(new PlaybackCommand.SetVolume(volume));
    }

    public void speedUp() {
        speed = speed.up();
        send(new PlaybackCommand.SetSpeed(speed.multiplier()));
    }

    public void speedDown() {
        speed = speed.down();
        send(new PlaybackCommand.SetSpeed(speed.multiplier()));
    }

    /** Off, 15, 30, 45, 60 minutes, then off again. Turning it off restores the volume. */
    public void cycleSleepTimer() {
        OptionalInt minutes =
                sleepTimer == null ? OptionalInt.of(SleepTimer.firstRung()) : sleepTimer.nextRung();
        if (minutes.isPresent()) {
            float original = sleepTimer == null ? volume : sleepTimer.originalVolume();
            sleepTimer = SleepTimer.start(clock.instant(), minutes.getAsInt(), original);
            log.debug("Sleep timer set to {} minutes", minutes.getAsInt());
            return;
        }
        if (sleepTimer != null) {
            volume = sleepTimer.originalVolume();
            send(new PlaybackCommand.SetVolume(volume));
        }
        sleepTimer = null;
        log.debug("Sleep timer off");
    }

    public void updateSleepTimer() {
        if (sleepTimer == null) {
            return;
        }
        Instant now = clock.instant();
        if (sleepTimer.isExpired(now)) {
            log.info("Sleep timer expired, pausing");
            send(new PlaybackCommand.Pause());
            playing = false;
            volume = sleepTimer.originalVolume();
            send(new PlaybackCommand.SetVolume(volume));
            sleepTimer = null;
            publishIfChanged();
        } else if (sleepTimer.isFading(now)) {
            volume = sleepTimer.volumeAt(now);
            send(new PlaybackCommand.SetVolume(volume));
        }
    }

    public Optional<SleepTimer> getSleepTimer() {
        return Optional.ofNullable(sleepTimer);
    }

    // Modes

    public void toggleShuffle() {
        shuffle = !shuffle;
        if (shuffle) {
            shuffleOrder.regenerate(library.size());
        }
    }

    public void cycleRepeat() {
        repeat = repeat.cycle();
    }

    public void setRepeat(@NonNull RepeatMode repeat) {
        this.repeat = repeat;
    }

    public void cycleTheme() {
        theme = theme.cycle();
    }

    public void cycleVisualizer() {
        visualizer.cycle();
    }

    public void toggleMiniMode() {
        miniMode = !miniMode;
    }

    public void toggleInfo() {
        showInfo = !showInfo;
    }

    // Selection and search

    public void moveSelectionUp() {
        if (selectedIndex > 0) {
            selectedIndex--;
        }
    }

    public void moveSelectionDown() {
        if (selectedIndex + 1 < filteredIndices.size()) {
            selectedIndex++;
        }
    }

    /** Leaving search mode clears the query. */
    public void toggleSearch() {
        searchMode = !searchMode;
        if (!searchMode) {
            searchQuery.setLength(0);
            updateFilter();
        }
    }

    public void searchInput(char c) {
        searchQuery.append(c);
        updateFilter();
    }

    public void searchBackspace() {
        if (searchQuery.length() > 0) {
            searchQuery.setLength(searchQuery.length() - 1);
        }
        updateFilter();
    }

    public String getSearchQuery() {
        return searchQuery.toString();
    }

    /** Library indices matching the current search, in library order. */
    public List<Integer> getFilteredIndices() {
        return List.copyOf(filteredIndices);
    }

    private void updateFilter() {
        if (searchQuery.length() == 0) {
            filteredIndices = allIndices();
        } else {
            String query = searchQuery.toString().toLowerCase(Locale.ROOT);
            List<Integer> matches = new ArrayList<>();
            for (int i = 0; i < library.size(); i++) {
                Track track = library.get(i);
                if (track.title().toLowerCase(Locale.ROOT).contains(query)
                        || track.artist().toLowerCase(Locale.ROOT).contains(query)) {
                    matches.add(i);
                }
            }
            filteredIndices = matches;
        }
        if (selectedIndex >= filteredIndices.size()) {
            selectedIndex = Math.max(filteredIndices.size() - 1, 0);
        }
    }

    private List<Integer> allIndices() {
        List<Integer> all = new ArrayList<>(library.size());
        for (int i = 0; i < library.size(); i++) {
            all.add(i);
        }
        return all;
    }

    // Event loop

    /** One dispatch-thread iteration: engine events, visualizer input, then the sleep timer. */
    public void tick() {
        processAudioEvents();
        updateSleepTimer();
    }

    public void processAudioEvents() {
        for (PlaybackEvent event : engine.drainEvents()) {
            handleEvent(event);
        }
        Optional<float[]> samples = engine.pollLatestSamples();
        if (samples.isPresent()) {
            visualizer.processSamples(samples.get());
        } else if (!playing) {
            visualizer.decay();
        }
    }

    private void handleEvent(PlaybackEvent event) {
        if (event instanceof PlaybackEvent.Playing started) {
            if (answerStart() && playingIndex >= 0 && started.durationSeconds() > 0) {
                duration = started.durationSeconds();
            }
        } else if (event instanceof PlaybackEvent.Progress update) {
            if (pendingStarts == 0 && playingIndex >= 0) {
                progress = update.positionSeconds();
            }
        } else if (event instanceof PlaybackEvent.TrackFinished) {
            if (pendingStarts == 0) {
                handleTrackFinished();
            } else {
                log.debug("Ignoring TrackFinished of a replaced track");
            }
        } else if (event instanceof PlaybackEvent.Error error) {
            log.warn("Playback error: {}", error.message());
            errorMessage = error.message();
            if (error.loadFailure() && answerStart() && playingIndex >= 0) {
                // the engine stays idle after a failed open
                goIdle();
            }
        }
    }

    /** @return true when the answered Play is the most recent one */
    private boolean answerStart() {
        if (pendingStarts > 0) {
            pendingStarts--;
        }
        return pendingStarts == 0;
    }

    // Read model

    public PlayerState getState() {
        if (playingIndex < 0) {
            return PlayerState.IDLE;
        }
        return playing ? PlayerState.PLAYING : PlayerState.PAUSED;
    }

    public OptionalInt getPlayingIndex() {
        return playingIndex < 0 ? OptionalInt.empty() : OptionalInt.of(playingIndex);
    }

    public Optional<Track> currentTrack() {
        return playingIndex < 0 ? Optional.empty() : Optional.of(library.get(playingIndex));
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    public void clearError() {
        errorMessage = null;
    }

    public Visualizer getVisualizer() {
        return visualizer;
    }

    public PlaybackSnapshot snapshot() {
        Optional<Track> track = currentTrack();
        Long sleepRemaining =
                sleepTimer == null ? null : sleepTimer.remaining(clock.instant()).toSeconds();
        return new PlaybackSnapshot(
                getState(),
                playingIndex < 0 ? null : playingIndex,
                track.map(Track::title).orElse(null),
                track.map(Track::artist).orElse(null),
                track.map(Track::album).orElse(null),
                progress,
                duration,
                playing,
                volume,
                shuffle,
                repeat.label(),
                theme.displayName(),
                visualizer.label(),
                visualizer.state().bars(),
                speed.label(),
                sleepRemaining,
                errorMessage,
                albumArt != null);
    }

    // Internals

    private boolean send(PlaybackCommand command) {
        if (!engine.send(command)) {
            log.warn("Engine did not accept {}", command);
            return false;
        }
        return true;
    }

    private void loadAlbumArt(Track track) {
        try {
            albumArt = metadataReader.read(track.path()).albumArt();
        } catch (AudioReadException e) {
            log.debug("No album art for {}: {}", track.path(), e.getMessage());
            albumArt = null;
        }
    }

    private void publishIfChanged() {
        if (getState() == lastPublishedState && playingIndex == lastPublishedIndex) {
            return;
        }
        publish();
    }

    /** A replay of the same index still counts as a track change. */
    private void publish() {
        PlayerState previous = lastPublishedState;
        lastPublishedState = getState();
        lastPublishedIndex = playingIndex;
        if (listeners.isEmpty()) {
            return;
        }
        PlaybackSnapshot snapshot = snapshot();
        for (PlayerListener listener : listeners) {
            try {
                listener.onStateChanged(previous, snapshot);
            } catch (RuntimeException e) {
                log.warn("Error in player listener", e);
            }
        }
    }

    private static float clamp(float value) {
        return Math.max(0f, Math.min(1f, value));
    }
}

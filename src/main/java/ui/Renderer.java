package ui;

import lombok.NonNull;
import playback.PlaybackSnapshot;
import visualizer.VisualizerState;

/** Draws one frame of player state. Called on the event dispatch thread once per tick. */
public interface Renderer {

    void render(@NonNull PlaybackSnapshot snapshot, @NonNull VisualizerState visualizer);
}

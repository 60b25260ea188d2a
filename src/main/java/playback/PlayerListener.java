package playback;

import lombok.NonNull;

/** Notified on the player thread when the current track or its play/pause state changes. */
public interface PlayerListener {

    void onStateChanged(@NonNull PlayerState previous, @NonNull PlaybackSnapshot snapshot);
}

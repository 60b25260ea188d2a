package server.rpc.dto;

import playback.PlaybackSnapshot;
import playback.PlayerState;

public record PlayerStateChanged(
        PlayerState previous, PlayerState current, PlaybackSnapshot snapshot) {}

package server.rpc.dto;

/** Requested volume; values outside [0, 1] are clamped. */
public record SetVolume(float volume) {}

package server.rpc.dto;

public record SeekTo(double seconds) {}

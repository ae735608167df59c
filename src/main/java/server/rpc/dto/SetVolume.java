package server.rpc.dto;

public record SetVolume(String trackId, float volume) {}

package server.rpc.dto;

public record SongFinished(String songId) {}

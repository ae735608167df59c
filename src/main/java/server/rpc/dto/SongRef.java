package server.rpc.dto;

public record SongRef(String songId) {}

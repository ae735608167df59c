package server.rpc.dto;

public record TrackRef(String trackId) {}

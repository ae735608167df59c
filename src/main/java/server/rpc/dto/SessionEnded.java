package server.rpc.dto;

public record SessionEnded(String sessionId) {}

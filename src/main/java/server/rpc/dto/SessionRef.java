package server.rpc.dto;

public record SessionRef(String sessionId) {}

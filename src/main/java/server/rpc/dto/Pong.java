package server.rpc.dto;

public record Pong(String deviceId) {}

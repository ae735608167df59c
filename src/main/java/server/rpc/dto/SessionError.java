package server.rpc.dto;

public record SessionError(String message) {}

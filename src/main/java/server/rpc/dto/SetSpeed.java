package server.rpc.dto;

public record SetSpeed(float multiplier) {}

package server.rpc.dto;

public record SwitchUser(String userId) {}

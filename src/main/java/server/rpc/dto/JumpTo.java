package server.rpc.dto;

public record JumpTo(int index) {}

package server.rpc.dto;

public record QueueSongChanged(String songId, int index) {}

package server.rpc.dto;

/** Null fields leave the corresponding mode unchanged. */
public record QueueModes(Boolean repeatSingle, Boolean repeatQueue, Boolean shuffle) {}

package server.rpc.dto;

import content.Song;

public record AddSong(Song song) {}

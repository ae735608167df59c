package server.rpc.dto;

import java.util.List;
import queue.QueueMode;

public record StartQueue(List<String> songIds, QueueMode mode, int startIndex) {}

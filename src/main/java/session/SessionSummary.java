package session;

/** One entry of the active session list. */
public record SessionSummary(
        String sessionId, String adminDeviceId, long createdAt, String songId) {}

package session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.NonNull;

/**
 * The shared session document. Written once by the admin on creation; afterwards only {@code
 * transportSnapshot} changes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionState(
        @NonNull String sessionId,
        @NonNull String adminDeviceId,
        long createdAt,
        TransportSnapshot transportSnapshot) {

    public SessionSummary summary() {
        return new SessionSummary(
                sessionId,
                adminDeviceId,
                createdAt,
                transportSnapshot == null ? null : transportSnapshot.songId());
    }
}

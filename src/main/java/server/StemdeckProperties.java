package server;

import java.util.UUID;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import session.SyncSettings;

/** Externalized configuration for the playback core. A blank device id gets a random one. */
@ConfigurationProperties(prefix = "stemdeck")
public record StemdeckProperties(
        @DefaultValue("") String deviceId,
        @DefaultValue("local") String userId,
        @DefaultValue("50") long progressIntervalMs,
        @DefaultValue("300") long clickWindowMs,
        @DefaultValue Sync sync,
        @DefaultValue("/tmp/stemdeck") String socketPath) {

    public StemdeckProperties {
        if (deviceId == null || deviceId.isBlank()) {
            deviceId = UUID.randomUUID().toString();
        }
    }

    public record Sync(
            @DefaultValue("100") long debounceMs,
            @DefaultValue("0.1") double seekToleranceSeconds,
            @DefaultValue("true") boolean deleteOnAdminLeave) {

        public SyncSettings toSettings() {
            return new SyncSettings(debounceMs, seekToleranceSeconds, deleteOnAdminLeave);
        }
    }
}

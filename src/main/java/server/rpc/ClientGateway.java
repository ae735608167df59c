package server.rpc;

import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import playback.TransportState;
import server.rpc.dto.MixChanged;
import server.rpc.dto.QueueSongChanged;
import server.rpc.dto.SessionEnded;
import server.rpc.dto.SessionError;
import server.rpc.dto.SongFinished;

/** Pushes notifications to the client once one is connected; drops them before that. */
@Component
@Slf4j
public class ClientGateway {

    private volatile ClientApi client;

    public void setClient(ClientApi client) {
        this.client = client;
    }

    public boolean isConnected() {
        return client != null;
    }

    public void transportChanged(TransportState state) {
        send("transportChanged", state, c -> c.transportChanged(state));
    }

    public void transportPosition(TransportState state) {
        send("transportPosition", state, c -> c.transportPosition(state));
    }

    public void transportFinished(SongFinished payload) {
        send("transportFinished", payload, c -> c.transportFinished(payload));
    }

    public void mixChanged(MixChanged payload) {
        send("mixChanged", payload, c -> c.mixChanged(payload));
    }

    public void queueSongChanged(QueueSongChanged payload) {
        send("queueSongChanged", payload, c -> c.queueSongChanged(payload));
    }

    public void queueComplete() {
        send("queueComplete", null, ClientApi::queueComplete);
    }

    public void sessionError(SessionError payload) {
        send("sessionError", payload, c -> c.sessionError(payload));
    }

    public void sessionEnded(SessionEnded payload) {
        send("sessionEnded", payload, c -> c.sessionEnded(payload));
    }

    private void send(String name, Object payload, Consumer<ClientApi> notification) {
        ClientApi c = this.client;
        if (c != null) {
            try {
                notification.accept(c);
            } catch (Throwable t) {
                log.warn("Failed to notify client: {}", name, t);
            }
        } else {
            log.trace("Client not connected; dropping {}: {}", name, payload);
        }
    }
}

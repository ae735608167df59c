package server.rpc;

import org.eclipse.lsp4j.jsonrpc.services.JsonNotification;
import playback.TransportState;
import server.rpc.dto.MixChanged;
import server.rpc.dto.QueueSongChanged;
import server.rpc.dto.SessionEnded;
import server.rpc.dto.SessionError;
import server.rpc.dto.SongFinished;

/** Notifications pushed to the connected client. */
public interface ClientApi {

    @JsonNotification("transport/changed")
    void transportChanged(TransportState state);

    @JsonNotification("transport/position")
    void transportPosition(TransportState state);

    @JsonNotification("transport/finished")
    void transportFinished(SongFinished payload);

    @JsonNotification("mix/changed")
    void mixChanged(MixChanged payload);

    @JsonNotification("queue/songChanged")
    void queueSongChanged(QueueSongChanged payload);

    @JsonNotification("queue/complete")
    void queueComplete();

    @JsonNotification("session/error")
    void sessionError(SessionError payload);

    @JsonNotification("session/ended")
    void sessionEnded(SessionEnded payload);
}

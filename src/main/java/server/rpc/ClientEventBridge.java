package server.rpc;

import content.Song;
import java.util.Map;
import mixer.GainResolver;
import mixer.MixListener;
import mixer.TrackMixState;
import mixer.TrackMixer;
import org.springframework.stereotype.Component;
import playback.PlaybackTransport;
import playback.TransportListener;
import playback.TransportState;
import queue.QueueController;
import queue.QueueListener;
import server.rpc.dto.MixChanged;
import server.rpc.dto.QueueSongChanged;
import server.rpc.dto.SessionEnded;
import server.rpc.dto.SessionError;
import server.rpc.dto.SongFinished;
import session.SessionException;
import session.SessionListener;
import session.SessionSyncService;

/** Forwards core events to the client through the {@link ClientGateway}. */
@Component
public class ClientEventBridge
        implements TransportListener, MixListener, QueueListener, SessionListener {

    private final ClientGateway gateway;

    public ClientEventBridge(
            ClientGateway gateway,
            PlaybackTransport transport,
            TrackMixer mixer,
            QueueController queue,
            SessionSyncService sessions) {
        this.gateway = gateway;
        transport.addListener(this);
        mixer.addListener(this);
        queue.addListener(this);
        sessions.addListener(this);
    }

    @Override
    public void onTransportChanged(TransportState state) {
        gateway.transportChanged(state);
    }

    @Override
    public void onPositionTick(TransportState state) {
        gateway.transportPosition(state);
    }

    @Override
    public void onFinished(Song song) {
        gateway.transportFinished(new SongFinished(song.id()));
    }

    @Override
    public void onMixChanged(String songId, Map<String, TrackMixState> mix) {
        gateway.mixChanged(new MixChanged(songId, mix, GainResolver.resolve(mix)));
    }

    @Override
    public void onSongChanged(Song song, int index) {
        gateway.queueSongChanged(new QueueSongChanged(song.id(), index));
    }

    @Override
    public void onQueueComplete() {
        gateway.queueComplete();
    }

    @Override
    public void onSessionEnded(String sessionId) {
        gateway.sessionEnded(new SessionEnded(sessionId));
    }

    @Override
    public void onSessionError(SessionException error) {
        gateway.sessionError(new SessionError(error.getMessage()));
    }
}

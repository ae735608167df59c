package server.rpc;

import content.InMemoryContentStore;
import content.Song;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import mixer.TrackMixer;
import org.eclipse.lsp4j.jsonrpc.services.JsonRequest;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import playback.PlaybackTransport;
import playback.TransportState;
import queue.QueueController;
import queue.QueueStatus;
import server.rpc.dto.AddSong;
import server.rpc.dto.JumpTo;
import server.rpc.dto.MixChanged;
import server.rpc.dto.Pong;
import server.rpc.dto.QueueModes;
import server.rpc.dto.SeekTo;
import server.rpc.dto.SessionRef;
import server.rpc.dto.SetSpeed;
import server.rpc.dto.SetVolume;
import server.rpc.dto.SongRef;
import server.rpc.dto.StartQueue;
import server.rpc.dto.SwitchUser;
import server.rpc.dto.TrackRef;
import session.SessionState;
import session.SessionSummary;
import session.SessionSyncService;
import trackstate.TrackStateStore;

/**
 * JSON-RPC entry points. Every request runs on the control thread; requests that wait for the
 * store or for channels to load complete once that work is done.
 */
@Service
public class JsonRpcService {
    private final PlaybackTransport transport;
    private final TrackMixer mixer;
    private final QueueController queue;
    private final SessionSyncService sessions;
    private final TrackStateStore trackStates;
    private final InMemoryContentStore content;
    private final ExecutorService control;

    public JsonRpcService(
            PlaybackTransport transport,
            TrackMixer mixer,
            QueueController queue,
            SessionSyncService sessions,
            TrackStateStore trackStates,
            InMemoryContentStore content,
            @Qualifier("control") ExecutorService control) {
        this.transport = transport;
        this.mixer = mixer;
        this.queue = queue;
        this.sessions = sessions;
        this.trackStates = trackStates;
        this.content = content;
        this.control = control;
    }

    private <T> CompletableFuture<T> onControl(Callable<T> task) {
        var cf = new CompletableFuture<T>();
        control.execute(
                () -> {
                    try {
                        cf.complete(task.call());
                    } catch (Throwable t) {
                        cf.completeExceptionally(t);
                    }
                });
        return cf;
    }

    private CompletableFuture<Void> runOnControl(Runnable task) {
        return onControl(
                () -> {
                    task.run();
                    return null;
                });
    }

    private <T> CompletableFuture<T> composeOnControl(Callable<CompletableFuture<T>> task) {
        return onControl(task).thenCompose(inner -> inner);
    }

    @JsonRequest("ping")
    public CompletableFuture<Pong> ping() {
        return onControl(() -> new Pong(sessions.getDeviceId()));
    }

    // Library

    @JsonRequest("library/addSong")
    public CompletableFuture<Void> addSong(AddSong req) {
        return runOnControl(() -> content.put(req.song()));
    }

    // Transport

    @JsonRequest("transport/load")
    public CompletableFuture<TransportState> load(SongRef req) {
        return composeOnControl(
                () -> transport.load(song(req.songId())).thenApply(ctx -> transport.getState()));
    }

    @JsonRequest("transport/play")
    public CompletableFuture<Void> play() {
        return runOnControl(transport::play);
    }

    @JsonRequest("transport/pause")
    public CompletableFuture<Void> pause() {
        return runOnControl(transport::pause);
    }

    @JsonRequest("transport/togglePlayPause")
    public CompletableFuture<Void> togglePlayPause() {
        return runOnControl(transport::togglePlayPause);
    }

    @JsonRequest("transport/seek")
    public CompletableFuture<Void> seek(SeekTo req) {
        return runOnControl(() -> transport.seek(req.seconds()));
    }

    @JsonRequest("transport/setSpeed")
    public CompletableFuture<Void> setSpeed(SetSpeed req) {
        return runOnControl(() -> transport.setSpeed(req.multiplier()));
    }

    @JsonRequest("transport/restart")
    public CompletableFuture<Void> restart() {
        return runOnControl(transport::restart);
    }

    @JsonRequest("transport/stop")
    public CompletableFuture<Void> stop() {
        return runOnControl(transport::stop);
    }

    @JsonRequest("transport/unload")
    public CompletableFuture<Void> unload() {
        return runOnControl(transport::unload);
    }

    @JsonRequest("transport/state")
    public CompletableFuture<TransportState> transportState() {
        return onControl(transport::getState);
    }

    // Mixer

    @JsonRequest("mixer/setVolume")
    public CompletableFuture<Void> setVolume(SetVolume req) {
        return runOnControl(() -> mixer.setVolume(req.trackId(), req.volume()));
    }

    @JsonRequest("mixer/toggleMute")
    public CompletableFuture<Void> toggleMute(TrackRef req) {
        return runOnControl(() -> mixer.toggleMute(req.trackId()));
    }

    @JsonRequest("mixer/toggleSolo")
    public CompletableFuture<Void> toggleSolo(TrackRef req) {
        return runOnControl(() -> mixer.toggleSolo(req.trackId()));
    }

    @JsonRequest("mixer/click")
    public CompletableFuture<Void> click(TrackRef req) {
        return runOnControl(() -> mixer.classifyClick(req.trackId()));
    }

    @JsonRequest("mixer/state")
    public CompletableFuture<MixChanged> mixState() {
        return onControl(
                () ->
                        new MixChanged(
                                transport.getState().songId(),
                                mixer.getMix(),
                                mixer.getEffectiveGains()));
    }

    @JsonRequest("user/switch")
    public CompletableFuture<Void> switchUser(SwitchUser req) {
        return runOnControl(() -> trackStates.switchUser(req.userId()));
    }

    // Queue

    @JsonRequest("queue/start")
    public CompletableFuture<QueueStatus> startQueue(StartQueue req) {
        return onControl(
                () -> {
                    queue.startByIds(req.songIds(), req.mode(), req.startIndex());
                    return queue.getStatus();
                });
    }

    @JsonRequest("queue/next")
    public CompletableFuture<QueueStatus> next() {
        return onControl(
                () -> {
                    queue.next();
                    return queue.getStatus();
                });
    }

    @JsonRequest("queue/previous")
    public CompletableFuture<QueueStatus> previous() {
        return onControl(
                () -> {
                    queue.previous();
                    return queue.getStatus();
                });
    }

    @JsonRequest("queue/jumpTo")
    public CompletableFuture<QueueStatus> jumpTo(JumpTo req) {
        return onControl(
                () -> {
                    queue.jumpTo(req.index());
                    return queue.getStatus();
                });
    }

    @JsonRequest("queue/setModes")
    public CompletableFuture<QueueStatus> setModes(QueueModes req) {
        return onControl(
                () -> {
                    if (req.repeatSingle() != null) {
                        queue.setRepeatSingle(req.repeatSingle());
                    }
                    if (req.repeatQueue() != null) {
                        queue.setRepeatQueue(req.repeatQueue());
                    }
                    if (req.shuffle() != null) {
                        queue.setShuffle(req.shuffle());
                    }
                    return queue.getStatus();
                });
    }

    @JsonRequest("queue/exit")
    public CompletableFuture<Void> exitQueue() {
        return runOnControl(queue::exit);
    }

    @JsonRequest("queue/status")
    public CompletableFuture<QueueStatus> queueStatus() {
        return onControl(queue::getStatus);
    }

    // Session

    @JsonRequest("session/create")
    public CompletableFuture<SessionState> createSession() {
        return composeOnControl(sessions::createSession);
    }

    @JsonRequest("session/join")
    public CompletableFuture<SessionState> joinSession(SessionRef req) {
        return composeOnControl(() -> sessions.joinSession(req.sessionId()));
    }

    @JsonRequest("session/leave")
    public CompletableFuture<Void> leaveSession() {
        return composeOnControl(sessions::leave);
    }

    @JsonRequest("session/list")
    public CompletableFuture<List<SessionSummary>> listSessions() {
        return composeOnControl(sessions::listActiveSessions);
    }

    @JsonRequest("session/delete")
    public CompletableFuture<Void> deleteSession(SessionRef req) {
        return composeOnControl(() -> sessions.deleteSession(req.sessionId()));
    }

    private Song song(String songId) {
        return content.getSong(songId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown song: " + songId));
    }
}

package server;

import audio.ChannelEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Guice;
import content.InMemoryContentStore;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import mixer.TrackMixer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import playback.PlaybackTransport;
import queue.QueueController;
import session.SessionSyncService;
import store.DocumentStore;
import store.InMemoryDocumentStore;
import timing.ExecutorScheduler;
import timing.Scheduler;
import trackstate.TrackStateStore;

/**
 * Wires the playback core. Every component runs on the single {@code control} thread; requests
 * from the client are dispatched onto it by the JSON-RPC service.
 */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(StemdeckProperties.class)
public class StemdeckConfiguration {

    @Bean(name = "control", destroyMethod = "shutdown")
    public ExecutorService control() {
        return Executors.newSingleThreadExecutor(
                r -> {
                    Thread t = new Thread(r, "ControlThread");
                    t.setDaemon(true);
                    return t;
                });
    }

    @Bean(destroyMethod = "close")
    public ExecutorScheduler scheduler(@Qualifier("control") ExecutorService control) {
        return new ExecutorScheduler(Clock.systemUTC(), control);
    }

    /** The engine binding lives in the audio package's Guice module. */
    @Bean(destroyMethod = "close")
    public ChannelEngine channelEngine() {
        return Guice.createInjector(new audio.Module()).getInstance(ChannelEngine.class);
    }

    @Bean
    public DocumentStore documentStore() {
        return new InMemoryDocumentStore();
    }

    @Bean
    public InMemoryContentStore contentStore() {
        return new InMemoryContentStore();
    }

    @Bean(destroyMethod = "close")
    public PlaybackTransport playbackTransport(
            ChannelEngine engine,
            @Qualifier("control") ExecutorService control,
            Scheduler scheduler,
            StemdeckProperties properties) {
        return new PlaybackTransport(engine, control, scheduler, properties.progressIntervalMs());
    }

    @Bean(destroyMethod = "close")
    public TrackStateStore trackStateStore(
            DocumentStore documents, ObjectMapper mapper, StemdeckProperties properties) {
        return new TrackStateStore(documents, mapper, properties.userId());
    }

    @Bean(destroyMethod = "close")
    public TrackMixer trackMixer(
            PlaybackTransport transport,
            TrackStateStore store,
            @Qualifier("control") ExecutorService control,
            Scheduler scheduler,
            StemdeckProperties properties) {
        return new TrackMixer(transport, store, control, scheduler, properties.clickWindowMs());
    }

    @Bean(destroyMethod = "close")
    public SessionSyncService sessionSyncService(
            DocumentStore documents,
            ObjectMapper mapper,
            PlaybackTransport transport,
            TrackMixer mixer,
            @Qualifier("control") ExecutorService control,
            Scheduler scheduler,
            StemdeckProperties properties) {
        return new SessionSyncService(
                documents,
                mapper,
                transport,
                mixer,
                control,
                scheduler,
                properties.deviceId(),
                properties.sync().toSettings());
    }

    @Bean(destroyMethod = "close")
    public QueueController queueController(
            PlaybackTransport transport, InMemoryContentStore content) {
        return new QueueController(transport, content);
    }
}

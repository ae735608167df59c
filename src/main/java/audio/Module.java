package audio;

import audio.javasound.JavaSoundChannelEngine;
import com.google.inject.AbstractModule;
import com.google.inject.Singleton;

/**
 * Guice module for the audio package.
 *
 * <p>Binds the channel engine to the Java Sound implementation for embedders that do not run the
 * Spring application.
 */
public class Module extends AbstractModule {

    @Override
    protected void configure() {
        // One engine per process: it owns the worker pool and every open channel
        bind(ChannelEngine.class).to(JavaSoundChannelEngine.class).in(Singleton.class);
    }
}

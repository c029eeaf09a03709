package de.bsommerfeld.widgetd.daemon;

import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.widgetd.core.command.CommandHandler;
import de.bsommerfeld.widgetd.core.command.CommandQueue;
import de.bsommerfeld.widgetd.core.command.CommandSink;
import de.bsommerfeld.widgetd.core.config.DaemonPaths;
import de.bsommerfeld.widgetd.core.config.DaemonSettings;
import de.bsommerfeld.widgetd.core.debounce.DebounceGate;
import de.bsommerfeld.widgetd.daemon.app.ConfigLoader;
import de.bsommerfeld.widgetd.daemon.app.ScssStylesheetLoader;
import de.bsommerfeld.widgetd.daemon.app.StylesheetLoader;
import de.bsommerfeld.widgetd.daemon.app.WidgetApp;
import de.bsommerfeld.widgetd.daemon.app.YuckConfigLoader;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Guice wiring for the daemon.
 *
 * <p>
 * Two scheduling domains come out of this module: the worker pool and timer
 * used by the background tasks, and the {@link CommandQueue} drained by the UI
 * loop on the main thread. Worker threads are daemon threads, so they never
 * keep the process alive on their own.
 */
public class DaemonModule extends AbstractModule {

    private final DaemonPaths paths;
    private final DaemonSettings settings;

    public DaemonModule(DaemonPaths paths, DaemonSettings settings) {
        this.paths = paths;
        this.settings = settings;
    }

    @Override
    protected void configure() {
        bind(DaemonPaths.class).toInstance(paths);
        bind(DaemonSettings.class).toInstance(settings);

        // Producers only get the sink, the UI loop gets the queue itself
        bind(CommandSink.class).to(CommandQueue.class);
        bind(CommandHandler.class).to(WidgetApp.class);

        bind(ConfigLoader.class).to(YuckConfigLoader.class);
        bind(StylesheetLoader.class).to(ScssStylesheetLoader.class);
    }

    @Provides
    @Singleton
    ListeningExecutorService provideWorkers() {
        return MoreExecutors.listeningDecorator(Executors.newCachedThreadPool(
                new ThreadFactoryBuilder().setNameFormat("widgetd-worker-%d").setDaemon(true).build()));
    }

    @Provides
    @Singleton
    ScheduledExecutorService provideTimer() {
        return Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder().setNameFormat("widgetd-timer-%d").setDaemon(true).build());
    }

    @Provides
    @Singleton
    DebounceGate provideDebounceGate(ScheduledExecutorService timer) {
        return new DebounceGate(DebounceGate.DEFAULT_COOLDOWN, timer);
    }
}

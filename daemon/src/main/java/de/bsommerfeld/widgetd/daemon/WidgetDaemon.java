package de.bsommerfeld.widgetd.daemon;

import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.widgetd.core.command.UiLoop;
import de.bsommerfeld.widgetd.core.config.DaemonPaths;
import de.bsommerfeld.widgetd.core.lifecycle.ExitForwarder;
import de.bsommerfeld.widgetd.core.lifecycle.ExitSignal;
import de.bsommerfeld.widgetd.core.lifecycle.Supervisor;
import de.bsommerfeld.widgetd.daemon.app.ConfigLoadException;
import de.bsommerfeld.widgetd.daemon.app.WidgetApp;
import de.bsommerfeld.widgetd.daemon.watch.FileWatcher;
import de.bsommerfeld.widgetd.ipc.CommandServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the daemon once it is detached: loads the initial configuration, starts
 * the supervised background tasks and turns the calling thread into the UI
 * loop.
 */
@Singleton
public class WidgetDaemon {

    private static final Logger LOG = LoggerFactory.getLogger(WidgetDaemon.class);

    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(1);

    private final DaemonPaths paths;
    private final WidgetApp app;
    private final UiLoop uiLoop;
    private final Supervisor supervisor;
    private final ExitSignal exitSignal;
    private final FileWatcher fileWatcher;
    private final CommandServer commandServer;
    private final ExitForwarder exitForwarder;
    private final ListeningExecutorService workers;
    private final ScheduledExecutorService timer;

    private final AtomicReference<Throwable> taskFailure = new AtomicReference<>();
    private final CountDownLatch stopped = new CountDownLatch(1);

    @Inject
    public WidgetDaemon(DaemonPaths paths, WidgetApp app, UiLoop uiLoop, Supervisor supervisor,
            ExitSignal exitSignal, FileWatcher fileWatcher, CommandServer commandServer,
            ExitForwarder exitForwarder, ListeningExecutorService workers, ScheduledExecutorService timer) {
        this.paths = paths;
        this.app = app;
        this.uiLoop = uiLoop;
        this.supervisor = supervisor;
        this.exitSignal = exitSignal;
        this.fileWatcher = fileWatcher;
        this.commandServer = commandServer;
        this.exitForwarder = exitForwarder;
        this.workers = workers;
        this.timer = timer;
    }

    /**
     * Blocks until the UI loop stops.
     *
     * @return the process exit status
     * @throws ConfigLoadException if the initial configuration cannot be loaded
     */
    public int run() throws ConfigLoadException {
        try {
            LOG.info("Initializing widget daemon");
            LOG.info("Loading paths: {}", paths);
            app.initialize();

            ListenableFuture<Void> tasks = supervisor.run(List.of(fileWatcher, commandServer, exitForwarder));
            Futures.addCallback(tasks, new FutureCallback<Void>() {
                @Override
                public void onSuccess(Void result) {
                    LOG.debug("Background tasks finished");
                }

                @Override
                public void onFailure(Throwable t) {
                    taskFailure.compareAndSet(null, t);
                    exitSignal.signal();
                }
            }, MoreExecutors.directExecutor());

            uiLoop.run();
            LOG.info("Main application thread finished");

            stopTasks();
            return taskFailure.get() == null ? 0 : 1;
        } finally {
            stopped.countDown();
        }
    }

    /**
     * @return {@code true} once {@link #run()} has returned, with the
     *         background tasks stopped and the socket file removed
     */
    public boolean isStopped() {
        return stopped.getCount() == 0;
    }

    /**
     * Closes the watcher and the server so their loops end, lets open client
     * connections write their last response, then interrupts whatever is left.
     */
    private void stopTasks() {
        try {
            commandServer.close();
            fileWatcher.close();
        } catch (IOException e) {
            LOG.warn("Error while closing background tasks: {}", e.getMessage());
        }
        timer.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(STOP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.debug("Background tasks still running after {}, interrupting", STOP_TIMEOUT);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        workers.shutdownNow();
    }

    public void installShutdownHook() {
        new ShutdownHook(exitSignal, stopped).install();
    }
}

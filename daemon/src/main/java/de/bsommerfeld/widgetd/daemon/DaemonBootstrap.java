package de.bsommerfeld.widgetd.daemon;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.widgetd.core.config.DaemonPaths;
import de.bsommerfeld.widgetd.core.config.DaemonSettings;
import de.bsommerfeld.widgetd.daemon.app.ConfigLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts the daemon in the current (already detached) process.
 */
public final class DaemonBootstrap {

    private static final Logger LOG = LoggerFactory.getLogger(DaemonBootstrap.class);

    private DaemonBootstrap() {
    }

    /**
     * @return the process exit status
     */
    public static int start(DaemonPaths paths, DaemonSettings settings) {
        LogLevels.applyDebugMode(settings.isDebugMode());

        Injector injector = Guice.createInjector(new DaemonModule(paths, settings));
        WidgetDaemon daemon = injector.getInstance(WidgetDaemon.class);
        daemon.installShutdownHook();
        try {
            return daemon.run();
        } catch (ConfigLoadException e) {
            LOG.error("Failed to load configuration: {}", e.getMessage());
            return 1;
        }
    }
}

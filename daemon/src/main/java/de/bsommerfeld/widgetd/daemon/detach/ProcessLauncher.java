package de.bsommerfeld.widgetd.daemon.detach;

import java.io.IOException;

/**
 * Starts the detached daemon process.
 */
@FunctionalInterface
public interface ProcessLauncher {

    void launch(LaunchRequest request) throws IOException;
}

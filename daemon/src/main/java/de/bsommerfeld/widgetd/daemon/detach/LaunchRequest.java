package de.bsommerfeld.widgetd.daemon.detach;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything needed to start the detached copy of this process.
 *
 * @param workingDir  working directory of the daemon
 * @param logFile     target for redirected streams
 * @param plan        which streams to redirect
 * @param arguments   program arguments for the daemon's entry point
 */
public record LaunchRequest(Path workingDir, Path logFile, RedirectPlan plan, List<String> arguments) {

    public LaunchRequest {
        arguments = List.copyOf(arguments);
    }
}

package de.bsommerfeld.widgetd.daemon.detach;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Detaches the daemon from the controlling terminal.
 *
 * <p>
 * A JVM cannot fork, so detachment starts a second copy of this process in the
 * background and lets the caller exit. The copy is recognised by the
 * {@link #DETACHED_PROPERTY} system property and continues as the daemon.
 * This must run before any thread, watcher or socket is created.
 *
 * <p>
 * The log file is opened (created if absent, append mode) before anything is
 * launched, so an unusable log file aborts startup without leaving a daemon
 * behind. Standard output and error are only redirected to it when they are
 * attached to a terminal; a caller that already redirected them keeps its
 * targets.
 */
public class Daemonizer {

    public static final String DETACHED_PROPERTY = "widgetd.detached";

    private final TerminalProbe terminalProbe;
    private final ProcessLauncher launcher;
    private final boolean detachedChild;

    public Daemonizer(ProcessLauncher launcher) {
        this(new LibcTerminalProbe(), launcher, Boolean.getBoolean(DETACHED_PROPERTY));
    }

    public Daemonizer(TerminalProbe terminalProbe, ProcessLauncher launcher, boolean detachedChild) {
        this.terminalProbe = terminalProbe;
        this.launcher = launcher;
        this.detachedChild = detachedChild;
    }

    /**
     * @param logFile    file receiving the daemon's output
     * @param workingDir working directory of the daemon
     * @param arguments  arguments the daemon is started with
     * @return {@link Role#PARENT} if this process launched the daemon and should
     *         exit, {@link Role#DAEMON} if this process is the daemon
     */
    public Role detach(Path logFile, Path workingDir, List<String> arguments) throws DaemonizeException {
        if (detachedChild) {
            return Role.DAEMON;
        }

        openLogFile(logFile);
        if (!Files.isDirectory(workingDir)) {
            throw new DaemonizeException("Failed to change working directory to " + workingDir, null);
        }

        RedirectPlan plan = RedirectPlan.probe(terminalProbe);
        try {
            launcher.launch(new LaunchRequest(workingDir, logFile, plan, arguments));
        } catch (IOException e) {
            throw new DaemonizeException("Failed to start the detached daemon process", e);
        }
        return Role.PARENT;
    }

    static void openLogFile(Path logFile) throws DaemonizeException {
        try {
            Path parent = logFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (FileChannel ignored = FileChannel.open(logFile,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE)) {
                // only checking that the file is writable
            }
        } catch (IOException e) {
            throw new DaemonizeException("Error opening log file (" + logFile + ") for writing", e);
        }
    }
}

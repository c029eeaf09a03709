package de.bsommerfeld.widgetd.daemon.detach;

import java.lang.ProcessBuilder.Redirect;
import java.nio.file.Path;

/**
 * Decides, per standard stream, whether the daemon's output goes to the log
 * file. A stream attached to a terminal is redirected; anything else (a file
 * or pipe chosen by the caller) is inherited untouched.
 */
public record RedirectPlan(boolean redirectStdout, boolean redirectStderr) {

    public static RedirectPlan of(boolean stdoutIsTerminal, boolean stderrIsTerminal) {
        return new RedirectPlan(stdoutIsTerminal, stderrIsTerminal);
    }

    public static RedirectPlan probe(TerminalProbe probe) {
        return of(probe.isTerminal(StandardStream.STDOUT), probe.isTerminal(StandardStream.STDERR));
    }

    public Redirect stdout(Path logFile) {
        return redirectStdout ? Redirect.appendTo(logFile.toFile()) : Redirect.INHERIT;
    }

    public Redirect stderr(Path logFile) {
        return redirectStderr ? Redirect.appendTo(logFile.toFile()) : Redirect.INHERIT;
    }
}

package de.bsommerfeld.widgetd.core.command;

import java.util.Map;

/**
 * A single unit of work for the UI loop.
 *
 * <p>
 * Commands are the only values that cross from the worker tasks (file watcher,
 * command server, exit forwarder) into the UI thread. The set of variants is
 * open: the command server may add its own domain commands next to the ones
 * declared here.
 */
public interface DaemonCommand {

    /**
     * Marks commands that carry a private response channel for their requester.
     */
    interface WithResponse extends DaemonCommand {
        ResponseChannel response();
    }

    /**
     * Re-reads the widget configuration and the stylesheet from disk.
     */
    record ReloadConfigAndCss(ResponseChannel response) implements WithResponse {
    }

    /**
     * Terminal command. The UI loop stops after applying it.
     */
    record KillServer() implements DaemonCommand {
    }

    record Ping(ResponseChannel response) implements WithResponse {
    }

    /**
     * Merges the given variables into the daemon's global variable state.
     */
    record UpdateVars(Map<String, String> vars, ResponseChannel response) implements WithResponse {
        public UpdateVars {
            vars = Map.copyOf(vars);
        }
    }

    record PrintState(ResponseChannel response) implements WithResponse {
    }
}

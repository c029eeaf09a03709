package de.bsommerfeld.widgetd.daemon.detach;

/**
 * Tells whether one of the process's standard streams is attached to a
 * terminal.
 */
@FunctionalInterface
public interface TerminalProbe {

    boolean isTerminal(StandardStream stream);
}

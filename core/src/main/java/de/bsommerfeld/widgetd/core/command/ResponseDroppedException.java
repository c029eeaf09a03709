package de.bsommerfeld.widgetd.core.command;

/**
 * Signals that a command was discarded before the UI loop answered it.
 */
public class ResponseDroppedException extends RuntimeException {

    public ResponseDroppedException() {
        super("Command was dropped without a response");
    }
}

package de.bsommerfeld.widgetd.core.command;

/**
 * Thrown when a command is sent after the UI loop stopped consuming.
 */
public class QueueClosedException extends IllegalStateException {

    public QueueClosedException(String message) {
        super(message);
    }
}

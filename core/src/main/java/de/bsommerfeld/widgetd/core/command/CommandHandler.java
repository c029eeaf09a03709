package de.bsommerfeld.widgetd.core.command;

/**
 * Applies commands to application state. Only ever called from the UI loop.
 */
@FunctionalInterface
public interface CommandHandler {

    /**
     * @return {@code false} to stop the loop after this command
     */
    boolean handle(DaemonCommand command);
}

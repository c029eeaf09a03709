package de.bsommerfeld.widgetd.core.command;

/**
 * Producer side of the command queue. Every worker task that wants to affect
 * application state holds one of these and nothing else.
 */
@FunctionalInterface
public interface CommandSink {

    /**
     * Enqueues a command without blocking.
     *
     * @throws QueueClosedException if the consumer has already stopped
     */
    void send(DaemonCommand command);
}

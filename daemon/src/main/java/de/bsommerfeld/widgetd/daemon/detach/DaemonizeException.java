package de.bsommerfeld.widgetd.daemon.detach;

/**
 * Fatal failure while detaching the daemon.
 */
public class DaemonizeException extends Exception {

    public DaemonizeException(String message, Throwable cause) {
        super(message, cause);
    }
}

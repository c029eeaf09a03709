package de.bsommerfeld.widgetd.daemon.app;

/**
 * A configuration or stylesheet file could not be read or is unusable.
 */
public class ConfigLoadException extends Exception {

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}

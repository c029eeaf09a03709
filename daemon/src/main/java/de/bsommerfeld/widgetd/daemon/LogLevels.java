package de.bsommerfeld.widgetd.daemon;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runtime log level adjustments on top of {@code logback.xml}.
 */
final class LogLevels {

    private LogLevels() {
    }

    static void applyDebugMode(boolean debugMode) {
        if (!debugMode) {
            return;
        }
        if (LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME) instanceof Logger root) {
            root.setLevel(Level.DEBUG);
            root.debug("Debug logging enabled");
        }
    }
}

package de.bsommerfeld.widgetd.daemon.app;

import java.nio.file.Path;

/**
 * Reads the widget configuration. The configuration language itself is the
 * widget engine's business; implementations hand it the source.
 */
public interface ConfigLoader {

    WidgetConfig load(Path configFile) throws ConfigLoadException;
}

package de.bsommerfeld.widgetd.daemon.app;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A loaded widget configuration. Interpreting the source is up to the widget
 * engine; the daemon only keeps the text it was given.
 */
public record WidgetConfig(Path source, String content, Instant loadedAt) {
}

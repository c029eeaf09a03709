package de.bsommerfeld.widgetd.daemon.app;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads {@code eww.scss}. A missing stylesheet is fine, an unreadable one is
 * not.
 */
public class ScssStylesheetLoader implements StylesheetLoader {

    @Override
    public Optional<String> load(Path stylesheetFile) throws ConfigLoadException {
        if (!Files.exists(stylesheetFile)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(stylesheetFile));
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read stylesheet " + stylesheetFile + ": " + e.getMessage(), e);
        }
    }
}

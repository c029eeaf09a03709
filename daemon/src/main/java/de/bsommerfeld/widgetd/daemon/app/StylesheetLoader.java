package de.bsommerfeld.widgetd.daemon.app;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads the stylesheet applied to the widgets.
 */
public interface StylesheetLoader {

    /**
     * @return the stylesheet source, or empty if there is no stylesheet file
     */
    Optional<String> load(Path stylesheetFile) throws ConfigLoadException;
}

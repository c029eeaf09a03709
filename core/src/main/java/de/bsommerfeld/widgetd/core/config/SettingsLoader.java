package de.bsommerfeld.widgetd.core.config;

import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link DaemonSettings} from a TOML file. A missing file yields the
 * defaults; a malformed one is an error.
 */
public final class SettingsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SettingsLoader.class);

    private static final TomlMapper MAPPER = new TomlMapper();

    private SettingsLoader() {
    }

    public static DaemonSettings load(Path settingsFile) throws IOException {
        if (!Files.exists(settingsFile)) {
            LOG.debug("No settings file at {}, using defaults", settingsFile);
            return new DaemonSettings();
        }
        LOG.debug("Loading settings from {}", settingsFile);
        String content = Files.readString(settingsFile);
        if (content.isBlank()) {
            return new DaemonSettings();
        }
        DaemonSettings settings = MAPPER.readValue(content, DaemonSettings.class);
        if (settings.getResponseTimeoutMs() <= 0) {
            throw new IOException("response-timeout-ms must be positive in " + settingsFile);
        }
        return settings;
    }
}

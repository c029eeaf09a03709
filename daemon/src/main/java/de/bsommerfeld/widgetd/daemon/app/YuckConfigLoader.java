package de.bsommerfeld.widgetd.daemon.app;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Reads {@code eww.yuck}. The file must exist, be valid UTF-8 and not be blank.
 */
public class YuckConfigLoader implements ConfigLoader {

    @Override
    public WidgetConfig load(Path configFile) throws ConfigLoadException {
        String content;
        try {
            content = Files.readString(configFile);
        } catch (NoSuchFileException e) {
            throw new ConfigLoadException("Config file " + configFile + " does not exist", e);
        } catch (CharacterCodingException e) {
            throw new ConfigLoadException("Config file " + configFile + " is not valid UTF-8", e);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read config file " + configFile + ": " + e.getMessage(), e);
        }
        if (content.isBlank()) {
            throw new ConfigLoadException("Config file " + configFile + " is empty");
        }
        return new WidgetConfig(configFile, content, Instant.now());
    }
}

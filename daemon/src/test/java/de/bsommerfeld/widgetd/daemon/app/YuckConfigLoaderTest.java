package de.bsommerfeld.widgetd.daemon.app;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class YuckConfigLoaderTest {

    @TempDir
    Path tempDir;

    private final YuckConfigLoader loader = new YuckConfigLoader();

    @Test
    void load_shouldReadConfig() throws Exception {
        Path file = tempDir.resolve("eww.yuck");
        Files.writeString(file, "(defwidget clock [] \"12:00\")");

        var config = loader.load(file);

        assertEquals(file, config.source());
        assertEquals("(defwidget clock [] \"12:00\")", config.content());
        assertNotNull(config.loadedAt());
    }

    @Test
    void load_shouldRejectInvalidUtf8() throws Exception {
        Path file = tempDir.resolve("eww.yuck");
        Files.write(file, new byte[]{(byte) 0xC3, (byte) 0x28});

        var error = assertThrows(ConfigLoadException.class, () -> loader.load(file));

        assertTrue(error.getMessage().contains("not valid UTF-8"));
    }

    @Test
    void load_shouldRejectBlankConfig() throws Exception {
        Path file = tempDir.resolve("eww.yuck");
        Files.writeString(file, "\n\t\n");

        assertThrows(ConfigLoadException.class, () -> loader.load(file));
    }

    @Test
    void stylesheetLoader_shouldReturnEmptyForMissingFile() throws Exception {
        assertTrue(new ScssStylesheetLoader().load(tempDir.resolve("eww.scss")).isEmpty());
    }
}

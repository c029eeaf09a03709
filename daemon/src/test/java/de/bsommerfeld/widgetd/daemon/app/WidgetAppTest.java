package de.bsommerfeld.widgetd.daemon.app;

import de.bsommerfeld.widgetd.core.command.DaemonCommand;
import de.bsommerfeld.widgetd.core.command.DaemonCommand.KillServer;
import de.bsommerfeld.widgetd.core.command.DaemonCommand.Ping;
import de.bsommerfeld.widgetd.core.command.DaemonCommand.PrintState;
import de.bsommerfeld.widgetd.core.command.DaemonCommand.ReloadConfigAndCss;
import de.bsommerfeld.widgetd.core.command.DaemonCommand.UpdateVars;
import de.bsommerfeld.widgetd.core.command.DaemonResponse;
import de.bsommerfeld.widgetd.core.command.ResponseChannel;
import de.bsommerfeld.widgetd.core.config.DaemonPaths;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class WidgetAppTest {

    @TempDir
    Path configDir;

    private DaemonPaths paths;
    private WidgetApp app;

    @BeforeEach
    void setUp() {
        paths = new DaemonPaths(configDir, configDir.resolve("eww.log"), configDir.resolve("eww.sock"));
        app = new WidgetApp(paths, new YuckConfigLoader(), new ScssStylesheetLoader());
    }

    private static DaemonResponse answer(ResponseChannel channel) throws Exception {
        return channel.receiver().get(1, TimeUnit.SECONDS);
    }

    @Test
    void initialize_shouldLoadConfigAndStylesheet() throws Exception {
        Files.writeString(paths.yuckPath(), "(defwindow bar)");
        Files.writeString(paths.scssPath(), ".bar { color: red; }");

        app.initialize();

        assertEquals("(defwindow bar)", app.getConfig().content());
        assertEquals(".bar { color: red; }", app.getStylesheet());
    }

    @Test
    void initialize_shouldFailWithoutConfig() {
        var error = assertThrows(ConfigLoadException.class, app::initialize);

        assertTrue(error.getMessage().contains("does not exist"));
    }

    @Test
    void initialize_shouldAcceptMissingStylesheet() throws Exception {
        Files.writeString(paths.yuckPath(), "(defwindow bar)");

        app.initialize();

        assertEquals("", app.getStylesheet());
    }

    @Test
    void reload_shouldSwapInNewConfig() throws Exception {
        Files.writeString(paths.yuckPath(), "(defwindow old)");
        app.initialize();
        Files.writeString(paths.yuckPath(), "(defwindow new)");
        var channel = ResponseChannel.create();

        assertTrue(app.handle(new ReloadConfigAndCss(channel)));

        DaemonResponse response = answer(channel);
        assertTrue(response.isSuccess());
        assertEquals("(defwindow new)", app.getConfig().content());
    }

    @Test
    void reload_shouldKeepPreviousConfigOnFailure() throws Exception {
        Files.writeString(paths.yuckPath(), "(defwindow old)");
        app.initialize();
        Files.writeString(paths.yuckPath(), "   ");
        var channel = ResponseChannel.create();

        assertTrue(app.handle(new ReloadConfigAndCss(channel)));

        DaemonResponse response = answer(channel);
        assertFalse(response.isSuccess());
        assertTrue(response.text().contains("is empty"));
        assertEquals("(defwindow old)", app.getConfig().content());
    }

    @Test
    void updateVars_shouldMergeAndPrintStateSorted() throws Exception {
        var first = ResponseChannel.create();
        var second = ResponseChannel.create();
        var state = ResponseChannel.create();

        app.handle(new UpdateVars(Map.of("volume", "40", "battery", "88"), first));
        app.handle(new UpdateVars(Map.of("volume", "55"), second));
        app.handle(new PrintState(state));

        assertEquals(DaemonResponse.success("Updated 2 variable(s)"), answer(first));
        assertEquals(DaemonResponse.success("Updated 1 variable(s)"), answer(second));
        assertEquals(DaemonResponse.success("battery: 88\nvolume: 55"), answer(state));
        assertEquals(Map.of("volume", "55", "battery", "88"), app.getVars());
    }

    @Test
    void ping_shouldAnswerPong() throws Exception {
        var channel = ResponseChannel.create();

        assertTrue(app.handle(new Ping(channel)));

        assertEquals(DaemonResponse.success("pong"), answer(channel));
    }

    @Test
    void killServer_shouldStopLoop() {
        assertFalse(app.handle(new KillServer()));
    }

    @Test
    void handle_shouldRejectUnknownCommands() throws Exception {
        var channel = ResponseChannel.create();
        DaemonCommand.WithResponse unknown = () -> channel;

        assertTrue(app.handle(unknown));

        assertEquals(DaemonResponse.failure("Unsupported command"), answer(channel));
    }
}

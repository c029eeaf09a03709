package de.bsommerfeld.widgetd.daemon.app;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.widgetd.core.command.CommandHandler;
import de.bsommerfeld.widgetd.core.command.DaemonCommand;
import de.bsommerfeld.widgetd.core.command.DaemonCommand.KillServer;
import de.bsommerfeld.widgetd.core.command.DaemonCommand.Ping;
import de.bsommerfeld.widgetd.core.command.DaemonCommand.PrintState;
import de.bsommerfeld.widgetd.core.command.DaemonCommand.ReloadConfigAndCss;
import de.bsommerfeld.widgetd.core.command.DaemonCommand.UpdateVars;
import de.bsommerfeld.widgetd.core.command.DaemonResponse;
import de.bsommerfeld.widgetd.core.config.DaemonPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Application state of the daemon: the active configuration, the active
 * stylesheet and the global variables.
 *
 * <p>
 * Not thread-safe. Every method except {@link #initialize()} is called from
 * the UI loop only, which is what keeps this state free of races.
 */
@Singleton
public class WidgetApp implements CommandHandler {

    private static final Logger LOG = LoggerFactory.getLogger(WidgetApp.class);

    private final DaemonPaths paths;
    private final ConfigLoader configLoader;
    private final StylesheetLoader stylesheetLoader;

    private final Map<String, String> vars = new TreeMap<>();
    private WidgetConfig config;
    private String stylesheet = "";

    @Inject
    public WidgetApp(DaemonPaths paths, ConfigLoader configLoader, StylesheetLoader stylesheetLoader) {
        this.paths = paths;
        this.configLoader = configLoader;
        this.stylesheetLoader = stylesheetLoader;
    }

    /**
     * Loads the initial configuration before the UI loop starts. A broken
     * configuration is fatal here; a broken stylesheet is only logged.
     */
    public void initialize() throws ConfigLoadException {
        config = configLoader.load(paths.yuckPath());
        try {
            stylesheet = stylesheetLoader.load(paths.scssPath()).orElse("");
        } catch (ConfigLoadException e) {
            LOG.warn("Ignoring stylesheet: {}", e.getMessage());
        }
        LOG.info("Loaded configuration from {}", config.source());
    }

    @Override
    public boolean handle(DaemonCommand command) {
        if (command instanceof ReloadConfigAndCss reload) {
            reload.response().send(reload());
        } else if (command instanceof UpdateVars update) {
            vars.putAll(update.vars());
            LOG.debug("Updated variables {}", update.vars().keySet());
            update.response().send(DaemonResponse.success("Updated " + update.vars().size() + " variable(s)"));
        } else if (command instanceof PrintState print) {
            print.response().send(DaemonResponse.success(renderState()));
        } else if (command instanceof Ping ping) {
            ping.response().send(DaemonResponse.success("pong"));
        } else if (command instanceof KillServer) {
            LOG.info("Received kill command, stopping UI loop");
            return false;
        } else {
            LOG.warn("Ignoring unsupported command {}", command);
            if (command instanceof DaemonCommand.WithResponse withResponse) {
                withResponse.response().send(DaemonResponse.failure("Unsupported command"));
            }
        }
        return true;
    }

    private DaemonResponse reload() {
        WidgetConfig newConfig;
        Optional<String> newStylesheet;
        try {
            newConfig = configLoader.load(paths.yuckPath());
            newStylesheet = stylesheetLoader.load(paths.scssPath());
        } catch (ConfigLoadException e) {
            LOG.warn("Keeping previous configuration: {}", e.getMessage());
            return DaemonResponse.failure(e.getMessage());
        }
        config = newConfig;
        stylesheet = newStylesheet.orElse("");
        return DaemonResponse.success("Reloaded " + newConfig.source());
    }

    private String renderState() {
        return vars.entrySet().stream()
                .map(entry -> entry.getKey() + ": " + entry.getValue())
                .collect(Collectors.joining("\n"));
    }

    public WidgetConfig getConfig() {
        return config;
    }

    public String getStylesheet() {
        return stylesheet;
    }

    public Map<String, String> getVars() {
        return Map.copyOf(vars);
    }
}

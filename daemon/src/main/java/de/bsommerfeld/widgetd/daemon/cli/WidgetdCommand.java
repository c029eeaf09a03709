package de.bsommerfeld.widgetd.daemon.cli;

import de.bsommerfeld.widgetd.core.config.DaemonPaths;
import de.bsommerfeld.widgetd.core.config.DaemonSettings;
import de.bsommerfeld.widgetd.core.config.SettingsLoader;
import de.bsommerfeld.widgetd.daemon.DaemonBootstrap;
import de.bsommerfeld.widgetd.daemon.WidgetdMain;
import de.bsommerfeld.widgetd.daemon.detach.Daemonizer;
import de.bsommerfeld.widgetd.daemon.detach.DaemonizeException;
import de.bsommerfeld.widgetd.daemon.detach.JvmProcessLauncher;
import de.bsommerfeld.widgetd.daemon.detach.Role;
import de.bsommerfeld.widgetd.ipc.IpcClient;
import de.bsommerfeld.widgetd.ipc.IpcRequest;
import de.bsommerfeld.widgetd.ipc.IpcResponse;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "widgetd",
        mixinStandardHelpOptions = true,
        description = "Widget daemon and its control commands",
        subcommands = {
                WidgetdCommand.StartDaemonCommand.class,
                WidgetdCommand.PingCommand.class,
                WidgetdCommand.ReloadCommand.class,
                WidgetdCommand.KillCommand.class,
                WidgetdCommand.UpdateCommand.class,
                WidgetdCommand.StateCommand.class
        }
)
public final class WidgetdCommand implements Runnable {

    @Option(names = {"-c", "--config"}, description = "Configuration directory (default: $XDG_CONFIG_HOME/eww)")
    String configDir;

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    Path configDir() {
        return DaemonPaths.resolveConfigDir(configDir).toAbsolutePath().normalize();
    }

    DaemonSettings settings() throws IOException {
        return SettingsLoader.load(DaemonPaths.forConfigDir(configDir()).settingsPath());
    }

    DaemonPaths paths(DaemonSettings settings) {
        return DaemonPaths.forConfigDir(configDir()).withSettings(settings);
    }

    @Command(name = "daemon", description = "Start the widget daemon")
    static final class StartDaemonCommand implements Callable<Integer> {
        @ParentCommand
        WidgetdCommand parent;

        @Option(names = {"--no-daemonize"}, description = "Stay in the foreground instead of detaching")
        boolean noDaemonize;

        @Option(names = {"--log-file"}, description = "Log file receiving the daemon's output")
        Path logFile;

        @Override
        public Integer call() {
            Path configDir = parent.configDir();
            if (!Files.isDirectory(configDir)) {
                System.err.println("Failed to change working directory to " + configDir + ": not a directory");
                return 1;
            }

            DaemonSettings settings;
            try {
                settings = parent.settings();
            } catch (IOException e) {
                System.err.println("Failed to read daemon settings: " + e.getMessage());
                return 1;
            }
            DaemonPaths paths = parent.paths(settings);
            if (logFile != null) {
                paths = paths.withLogFile(logFile.toAbsolutePath());
            }

            if (!noDaemonize) {
                Daemonizer daemonizer = new Daemonizer(new JvmProcessLauncher(WidgetdMain.class.getName()));
                try {
                    if (daemonizer.detach(paths.logFile(), paths.configDir(), childArguments(paths)) == Role.PARENT) {
                        return 0;
                    }
                } catch (DaemonizeException e) {
                    System.err.println(e.getMessage());
                    return 1;
                }
            }

            return DaemonBootstrap.start(paths, settings);
        }

        private static List<String> childArguments(DaemonPaths paths) {
            List<String> arguments = new ArrayList<>();
            arguments.add("--config");
            arguments.add(paths.configDir().toString());
            arguments.add("daemon");
            arguments.add("--log-file");
            arguments.add(paths.logFile().toString());
            return arguments;
        }
    }

    /**
     * Base for the commands that talk to a running daemon.
     */
    abstract static class ClientCommand implements Callable<Integer> {
        @ParentCommand
        WidgetdCommand parent;

        abstract IpcRequest request();

        @Override
        public Integer call() {
            Path socketFile;
            try {
                socketFile = parent.paths(parent.settings()).socketFile();
            } catch (IOException e) {
                System.err.println("Failed to read daemon settings: " + e.getMessage());
                return 1;
            }

            IpcResponse response;
            try {
                response = new IpcClient(socketFile).send(request());
            } catch (IOException e) {
                System.err.println("Failed to connect to daemon at " + socketFile + ": " + e.getMessage());
                System.err.println("Is the daemon running?");
                return 1;
            }

            PrintStream out = response.success() ? System.out : System.err;
            if (response.message() != null && !response.message().isEmpty()) {
                out.println(response.message());
            }
            return response.success() ? 0 : 1;
        }
    }

    @Command(name = "ping", description = "Check whether the daemon is responding")
    static final class PingCommand extends ClientCommand {
        @Override
        IpcRequest request() {
            return IpcRequest.of(IpcRequest.PING);
        }
    }

    @Command(name = "reload", description = "Reload the configuration and stylesheet")
    static final class ReloadCommand extends ClientCommand {
        @Override
        IpcRequest request() {
            return IpcRequest.of(IpcRequest.RELOAD);
        }
    }

    @Command(name = "kill", description = "Shut the daemon down")
    static final class KillCommand extends ClientCommand {
        @Override
        IpcRequest request() {
            return IpcRequest.of(IpcRequest.KILL);
        }
    }

    @Command(name = "state", description = "Print the daemon's variables")
    static final class StateCommand extends ClientCommand {
        @Override
        IpcRequest request() {
            return IpcRequest.of(IpcRequest.STATE);
        }
    }

    @Command(name = "update", description = "Update variables, given as name=value")
    static final class UpdateCommand extends ClientCommand {
        @Spec
        CommandSpec spec;

        @Parameters(arity = "1..*", paramLabel = "NAME=VALUE", description = "Variables to set")
        List<String> assignments;

        @Override
        IpcRequest request() {
            try {
                return new IpcRequest(IpcRequest.UPDATE, parseAssignments(assignments));
            } catch (IllegalArgumentException e) {
                throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage());
            }
        }
    }

    static Map<String, String> parseAssignments(List<String> assignments) {
        Map<String, String> vars = new LinkedHashMap<>();
        for (String assignment : assignments) {
            int separator = assignment.indexOf('=');
            if (separator <= 0) {
                throw new IllegalArgumentException("Expected NAME=VALUE but got '" + assignment + "'");
            }
            vars.put(assignment.substring(0, separator), assignment.substring(separator + 1));
        }
        return vars;
    }
}

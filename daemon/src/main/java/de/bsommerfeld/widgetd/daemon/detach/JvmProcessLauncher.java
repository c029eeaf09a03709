package de.bsommerfeld.widgetd.daemon.detach;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Relaunches the running JVM command line as a background process.
 *
 * <p>
 * The child gets the same JVM options and class path, the
 * {@link Daemonizer#DETACHED_PROPERTY} marker, stdin from the null device and
 * the configured working directory. Where {@code setsid} is available the
 * child is started in a new session so it no longer has a controlling
 * terminal.
 */
public class JvmProcessLauncher implements ProcessLauncher {

    private static final Logger LOG = LoggerFactory.getLogger(JvmProcessLauncher.class);

    private static final Path SETSID = Paths.get("/usr/bin/setsid");

    private final String mainClass;

    public JvmProcessLauncher(String mainClass) {
        this.mainClass = mainClass;
    }

    @Override
    public void launch(LaunchRequest request) throws IOException {
        List<String> command = buildCommand(request.arguments());
        ProcessBuilder builder = new ProcessBuilder(command)
                .directory(request.workingDir().toFile())
                .redirectInput(ProcessBuilder.Redirect.from(nullDevice()))
                .redirectOutput(request.plan().stdout(request.logFile()))
                .redirectError(request.plan().stderr(request.logFile()));
        Process process = builder.start();
        LOG.debug("Started detached daemon with pid {}", process.pid());
    }

    List<String> buildCommand(List<String> arguments) {
        List<String> command = new ArrayList<>();
        if (Files.isExecutable(SETSID)) {
            command.add(SETSID.toString());
        }
        command.add(javaExecutable());
        for (String jvmArgument : ManagementFactory.getRuntimeMXBean().getInputArguments()) {
            if (!jvmArgument.startsWith("-D" + Daemonizer.DETACHED_PROPERTY)) {
                command.add(jvmArgument);
            }
        }
        command.add("-D" + Daemonizer.DETACHED_PROPERTY + "=true");
        command.add("-cp");
        command.add(System.getProperty("java.class.path"));
        command.add(mainClass);
        command.addAll(arguments);
        return command;
    }

    private static String javaExecutable() {
        return ProcessHandle.current().info().command()
                .orElseGet(() -> Paths.get(System.getProperty("java.home"), "bin", "java").toString());
    }

    private static File nullDevice() {
        boolean windows = System.getProperty("os.name", "").toLowerCase(Locale.ENGLISH).contains("win");
        return new File(windows ? "NUL" : "/dev/null");
    }
}

package de.bsommerfeld.widgetd.core.config;

import com.google.common.hash.Hashing;
import de.bsommerfeld.widgetd.core.util.StorageUtils;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Every filesystem location the daemon uses, derived from the configuration
 * directory.
 *
 * <p>
 * The log file and the IPC socket carry a short hash of the absolute config
 * directory in their names, so daemons started for different config
 * directories never share them.
 */
public record DaemonPaths(Path configDir, Path logFile, Path socketFile) {

    public static final String APP_NAME = "eww";
    public static final String CONFIG_FILE = "eww.yuck";
    public static final String STYLESHEET_FILE = "eww.scss";
    public static final String SETTINGS_FILE = "daemon.toml";

    static final String CONFIG_DIR_PROPERTY = "widgetd.config";
    static final String CONFIG_DIR_ENV = "WIDGETD_CONFIG";

    public DaemonPaths {
        configDir = configDir.toAbsolutePath().normalize();
        logFile = logFile.toAbsolutePath().normalize();
        socketFile = socketFile.toAbsolutePath().normalize();
    }

    /**
     * Derives the default log and socket locations for the given config dir.
     */
    public static DaemonPaths forConfigDir(Path configDir) {
        Path absolute = configDir.toAbsolutePath().normalize();
        String hash = hashOf(absolute);
        return new DaemonPaths(
                absolute,
                StorageUtils.getCacheDir().resolve("eww_" + hash + ".log"),
                StorageUtils.getRuntimeDir().resolve("eww-server_" + hash));
    }

    /**
     * Applies the overrides from {@code daemon.toml}, resolving relative
     * override paths against the config dir.
     */
    public DaemonPaths withSettings(DaemonSettings settings) {
        Path log = settings.getLogFile() == null ? logFile : configDir.resolve(settings.getLogFile());
        Path socket = settings.getSocketFile() == null ? socketFile : configDir.resolve(settings.getSocketFile());
        return new DaemonPaths(configDir, log, socket);
    }

    public DaemonPaths withLogFile(Path log) {
        return new DaemonPaths(configDir, configDir.resolve(log), socketFile);
    }

    /**
     * Resolves the configuration directory: explicit argument first, then the
     * {@code widgetd.config} system property, then the {@code WIDGETD_CONFIG}
     * environment variable, then the platform default.
     */
    public static Path resolveConfigDir(String explicit) {
        if (explicit != null && !explicit.isBlank()) {
            return Paths.get(explicit);
        }
        String configured = System.getProperty(CONFIG_DIR_PROPERTY);
        if (configured == null || configured.isBlank()) {
            configured = System.getenv(CONFIG_DIR_ENV);
        }
        if (configured != null && !configured.isBlank()) {
            return Paths.get(configured);
        }
        return StorageUtils.getConfigDir(APP_NAME);
    }

    public Path yuckPath() {
        return configDir.resolve(CONFIG_FILE);
    }

    public Path scssPath() {
        return configDir.resolve(STYLESHEET_FILE);
    }

    public Path settingsPath() {
        return configDir.resolve(SETTINGS_FILE);
    }

    static String hashOf(Path absoluteConfigDir) {
        return Hashing.sha256()
                .hashString(absoluteConfigDir.toString(), StandardCharsets.UTF_8)
                .toString()
                .substring(0, 16);
    }

    @Override
    public String toString() {
        return "config-dir: " + configDir + ", log-file: " + logFile + ", socket-file: " + socketFile;
    }
}

package de.bsommerfeld.widgetd.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.function.UnaryOperator;

/**
 * Resolves the per-user directories the daemon reads from and writes to,
 * following each platform's conventions. Paths are absolute but are
 * <strong>not</strong> created; the caller is responsible for that.
 *
 * <p>
 * Resolution on Linux and other XDG platforms:
 * <ul>
 * <li><strong>config</strong>: {@code $XDG_CONFIG_HOME} (fallback
 * {@code ~/.config})</li>
 * <li><strong>cache</strong>: {@code $XDG_CACHE_HOME} (fallback
 * {@code ~/.cache})</li>
 * <li><strong>runtime</strong>: {@code $XDG_RUNTIME_DIR} (fallback
 * {@code java.io.tmpdir})</li>
 * </ul>
 * macOS uses {@code ~/Library/Application Support} and
 * {@code ~/Library/Caches}, Windows {@code %APPDATA%} and
 * {@code %LOCALAPPDATA%}.
 */
public final class StorageUtils {

    private StorageUtils() {
    }

    public static Path getConfigDir(String appName) {
        return getConfigDir(appName, System::getenv);
    }

    public static Path getCacheDir() {
        return getCacheDir(System::getenv);
    }

    public static Path getRuntimeDir() {
        return getRuntimeDir(System::getenv);
    }

    static Path getConfigDir(String appName, UnaryOperator<String> env) {
        String os = osName();
        if (isMac(os)) {
            return home().resolve(Paths.get("Library", "Application Support", appName));
        }
        if (isWindows(os)) {
            return nonEmpty(env.apply("APPDATA"))
                    ? Paths.get(env.apply("APPDATA"), appName)
                    : home().resolve(Paths.get("AppData", "Roaming", appName));
        }
        String xdgConfig = env.apply("XDG_CONFIG_HOME");
        return nonEmpty(xdgConfig)
                ? Paths.get(xdgConfig, appName)
                : home().resolve(Paths.get(".config", appName));
    }

    static Path getCacheDir(UnaryOperator<String> env) {
        String os = osName();
        if (isMac(os)) {
            return home().resolve(Paths.get("Library", "Caches"));
        }
        if (isWindows(os)) {
            return nonEmpty(env.apply("LOCALAPPDATA"))
                    ? Paths.get(env.apply("LOCALAPPDATA"))
                    : home().resolve(Paths.get("AppData", "Local"));
        }
        String xdgCache = env.apply("XDG_CACHE_HOME");
        return nonEmpty(xdgCache) ? Paths.get(xdgCache) : home().resolve(".cache");
    }

    static Path getRuntimeDir(UnaryOperator<String> env) {
        String xdgRuntime = env.apply("XDG_RUNTIME_DIR");
        return nonEmpty(xdgRuntime)
                ? Paths.get(xdgRuntime)
                : Paths.get(System.getProperty("java.io.tmpdir"));
    }

    private static Path home() {
        return Paths.get(System.getProperty("user.home"));
    }

    private static String osName() {
        return System.getProperty("os.name", "generic").toLowerCase(Locale.ENGLISH);
    }

    private static boolean isMac(String os) {
        return os.contains("mac") || os.contains("darwin");
    }

    private static boolean isWindows(String os) {
        return os.contains("win");
    }

    private static boolean nonEmpty(String value) {
        return value != null && !value.isEmpty();
    }
}

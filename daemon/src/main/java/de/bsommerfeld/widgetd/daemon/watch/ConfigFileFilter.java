package de.bsommerfeld.widgetd.daemon.watch;

import com.google.common.collect.ImmutableSet;
import com.google.common.io.MoreFiles;

import java.nio.file.Path;
import java.util.Set;

/**
 * Decides which file changes may affect the running configuration: widget
 * definitions ({@code .yuck}) and stylesheets ({@code .scss}).
 *
 * <p>
 * Changes to these files trigger a reload; everything else (editor swap files,
 * backups, unrelated files) is ignored.
 */
public final class ConfigFileFilter {

    public static final Set<String> RELEVANT_EXTENSIONS = ImmutableSet.of("yuck", "scss");

    private ConfigFileFilter() {
    }

    public static boolean isRelevant(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return false;
        }
        return RELEVANT_EXTENSIONS.contains(MoreFiles.getFileExtension(fileName));
    }
}

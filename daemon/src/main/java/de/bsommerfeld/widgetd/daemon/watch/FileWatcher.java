package de.bsommerfeld.widgetd.daemon.watch;

import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.widgetd.core.command.QueueClosedException;
import de.bsommerfeld.widgetd.core.config.DaemonPaths;
import de.bsommerfeld.widgetd.core.lifecycle.SupervisedTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Watches the configuration directory tree and asks the {@link ReloadTrigger}
 * for a reload whenever a widget definition or stylesheet changes.
 *
 * <p>
 * {@link WatchService} only watches single directories, so every directory in
 * the tree is registered at start and directories created later are
 * registered as they appear. Failing to set up the initial watch fails the
 * task; problems with individual events are logged and skipped. Once the UI
 * loop stops accepting commands the task ends normally.
 */
@Singleton
public class FileWatcher implements SupervisedTask {

    private static final Logger LOG = LoggerFactory.getLogger(FileWatcher.class);

    private final Path rootDir;
    private final ReloadTrigger trigger;
    private final Map<WatchKey, Path> watchedDirs = new ConcurrentHashMap<>();
    private volatile WatchService watchService;

    @Inject
    public FileWatcher(DaemonPaths paths, ReloadTrigger trigger) {
        this(paths.configDir(), trigger);
    }

    public FileWatcher(Path rootDir, ReloadTrigger trigger) {
        this.rootDir = rootDir;
        this.trigger = trigger;
    }

    @Override
    public String name() {
        return "file-watcher";
    }

    @Override
    public ListenableFuture<?> start(ListeningExecutorService workers) {
        return workers.submit(() -> {
            watch();
            return null;
        });
    }

    /**
     * Runs the event loop on the calling thread until {@link #close()} is called.
     *
     * @throws IOException if the root directory cannot be watched
     */
    public void watch() throws IOException {
        if (!Files.isDirectory(rootDir)) {
            throw new NotDirectoryException(rootDir.toString());
        }
        try (WatchService service = rootDir.getFileSystem().newWatchService()) {
            watchService = service;
            registerTree(service, rootDir);
            LOG.info("Watching {} ({} directories)", rootDir, watchedDirs.size());
            pollLoop(service);
        } finally {
            watchedDirs.clear();
        }
    }

    public void close() throws IOException {
        WatchService service = watchService;
        if (service != null) {
            service.close();
        }
    }

    /**
     * @return number of directories currently registered
     */
    public int watchedDirectoryCount() {
        return watchedDirs.size();
    }

    private void pollLoop(WatchService service) {
        while (true) {
            WatchKey key;
            try {
                key = service.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.info("File watcher interrupted");
                return;
            } catch (ClosedWatchServiceException e) {
                LOG.info("File watcher closed");
                return;
            }

            Path dir = watchedDirs.get(key);
            try {
                for (WatchEvent<?> event : key.pollEvents()) {
                    handleEvent(service, dir, event);
                }
            } catch (QueueClosedException e) {
                // the UI loop is gone, nobody is left to reload
                LOG.info("Stopping file watcher, UI loop no longer accepts commands: {}", e.getMessage());
                return;
            }

            if (!key.reset()) {
                watchedDirs.remove(key);
                LOG.debug("Stopped watching {} (no longer accessible)", dir);
            }
        }
    }

    private void handleEvent(WatchService service, Path dir, WatchEvent<?> event) {
        WatchEvent.Kind<?> kind = event.kind();
        if (kind == StandardWatchEventKinds.OVERFLOW) {
            LOG.warn("File watch events were lost under {}", dir);
            return;
        }
        if (dir == null) {
            return;
        }

        Path changed = dir.resolve((Path) event.context());
        LOG.trace("{} {}", kind.name(), changed);

        if (kind == StandardWatchEventKinds.ENTRY_CREATE
                && Files.isDirectory(changed, LinkOption.NOFOLLOW_LINKS)) {
            try {
                registerTree(service, changed);
            } catch (IOException e) {
                LOG.warn("Failed to watch new directory {}: {}", changed, e.getMessage());
            }
        }

        // Reload on relevant changes only. Changes to any other file are not
        // part of the configuration and never trigger a reload.
        if (ConfigFileFilter.isRelevant(changed)) {
            trigger.onRelevantChange(changed);
        }
    }

    private void registerTree(WatchService service, Path start) throws IOException {
        Files.walkFileTree(start, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                WatchKey key = dir.register(service,
                        StandardWatchEventKinds.ENTRY_CREATE,
                        StandardWatchEventKinds.ENTRY_MODIFY,
                        StandardWatchEventKinds.ENTRY_DELETE);
                watchedDirs.put(key, dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}

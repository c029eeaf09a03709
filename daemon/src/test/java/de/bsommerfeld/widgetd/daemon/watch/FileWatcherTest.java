package de.bsommerfeld.widgetd.daemon.watch;

import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import de.bsommerfeld.widgetd.core.command.CommandQueue;
import de.bsommerfeld.widgetd.core.command.DaemonCommand.ReloadConfigAndCss;
import de.bsommerfeld.widgetd.core.command.DaemonResponse;
import de.bsommerfeld.widgetd.core.command.QueueClosedException;
import de.bsommerfeld.widgetd.core.debounce.DebounceGate;
import de.bsommerfeld.widgetd.core.lifecycle.Supervisor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class FileWatcherTest {

    private static final long EVENT_TIMEOUT_MS = 10_000;

    @TempDir
    Path configDir;

    private ListeningExecutorService workers;
    private ScheduledExecutorService timer;
    private ReloadTrigger trigger;

    @BeforeEach
    void setUp() {
        workers = MoreExecutors.listeningDecorator(Executors.newCachedThreadPool());
        timer = Executors.newSingleThreadScheduledExecutor();
        trigger = mock(ReloadTrigger.class);
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
        timer.shutdownNow();
    }

    private FileWatcher startWatcher(int expectedDirs) throws Exception {
        var watcher = new FileWatcher(configDir, trigger);
        ListenableFuture<?> task = watcher.start(workers);
        awaitDirectoryCount(watcher, task, expectedDirs);
        return watcher;
    }

    private static void awaitDirectoryCount(FileWatcher watcher, ListenableFuture<?> task, int expected)
            throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(EVENT_TIMEOUT_MS);
        while (watcher.watchedDirectoryCount() < expected && System.nanoTime() < deadline) {
            if (task != null) {
                assertFalse(task.isDone(), "watcher ended early");
            }
            Thread.sleep(10);
        }
        assertTrue(watcher.watchedDirectoryCount() >= expected);
    }

    @Test
    void watch_shouldTriggerReloadForChangedWidgetFile() throws Exception {
        var watcher = startWatcher(1);

        Files.writeString(configDir.resolve("panel.yuck"), "(defwindow panel)");

        verify(trigger, timeout(EVENT_TIMEOUT_MS).atLeastOnce()).onRelevantChange(configDir.resolve("panel.yuck"));
        watcher.close();
    }

    @Test
    void watch_shouldIgnoreIrrelevantFiles() throws Exception {
        var watcher = startWatcher(1);

        Files.writeString(configDir.resolve("notes.txt"), "todo");
        Files.writeString(configDir.resolve("marker.scss"), "* { }");

        verify(trigger, timeout(EVENT_TIMEOUT_MS).atLeastOnce()).onRelevantChange(configDir.resolve("marker.scss"));
        verify(trigger, never()).onRelevantChange(configDir.resolve("notes.txt"));
        watcher.close();
    }

    @Test
    void watch_shouldCoverExistingAndNewSubdirectories() throws Exception {
        Path existing = Files.createDirectories(configDir.resolve("widgets"));
        var watcher = startWatcher(2);

        Files.writeString(existing.resolve("bar.yuck"), "(defwidget bar [])");
        verify(trigger, timeout(EVENT_TIMEOUT_MS).atLeastOnce()).onRelevantChange(existing.resolve("bar.yuck"));

        Path created = Files.createDirectory(configDir.resolve("themes"));
        awaitDirectoryCount(watcher, null, 3);
        Files.writeString(created.resolve("dark.scss"), "* { color: black; }");
        verify(trigger, timeout(EVENT_TIMEOUT_MS).atLeastOnce()).onRelevantChange(created.resolve("dark.scss"));
        watcher.close();
    }

    @Test
    void close_shouldEndTaskNormally() throws Exception {
        var watcher = new FileWatcher(configDir, trigger);
        ListenableFuture<?> task = watcher.start(workers);
        awaitDirectoryCount(watcher, task, 1);

        watcher.close();

        assertNull(task.get(5, TimeUnit.SECONDS));
        assertEquals(0, watcher.watchedDirectoryCount());
        verify(trigger, never()).onRelevantChange(any());
    }

    @Test
    void watch_shouldFailForMissingDirectory() {
        var watcher = new FileWatcher(configDir.resolve("missing"), trigger);

        assertThrows(NotDirectoryException.class, watcher::watch);
    }

    @Test
    void name_shouldIdentifyTask() {
        assertEquals("file-watcher", new FileWatcher(configDir, trigger).name());
    }

    @Test
    void watch_shouldSendSingleReloadForBurstOfWritesAndAcceptAnswer() throws Exception {
        var queue = new CommandQueue();
        var gate = new DebounceGate(Duration.ofSeconds(30), timer);
        var watcher = new FileWatcher(configDir, new ReloadTrigger(gate, queue));
        ListenableFuture<?> task = watcher.start(workers);
        awaitDirectoryCount(watcher, task, 1);

        Path panel = configDir.resolve("panel.yuck");
        for (int i = 0; i < 20; i++) {
            Files.writeString(panel, "(defwindow panel :revision " + i + ")");
        }

        var reload = assertInstanceOf(ReloadConfigAndCss.class,
                queue.poll(Duration.ofMillis(EVENT_TIMEOUT_MS)));
        assertTrue(reload.response().send(DaemonResponse.success("Reloaded " + panel)));
        assertNull(queue.poll(Duration.ofMillis(300)));
        assertFalse(gate.isOpen());
        watcher.close();
        assertNull(task.get(5, TimeUnit.SECONDS));
    }

    @Test
    void watch_shouldEndNormallyOnceQueueIsClosed() throws Exception {
        var queue = new CommandQueue();
        var gate = new DebounceGate(Duration.ofMillis(500), timer);
        var watcher = new FileWatcher(configDir, new ReloadTrigger(gate, queue));
        var joined = new Supervisor(workers).run(List.of(watcher));
        awaitDirectoryCount(watcher, null, 1);

        queue.close();
        Files.writeString(configDir.resolve("panel.yuck"), "(defwindow panel)");

        assertNull(joined.get(EVENT_TIMEOUT_MS, TimeUnit.MILLISECONDS));
        assertEquals(0, watcher.watchedDirectoryCount());
    }

    @Test
    void watch_shouldStopWhenTriggerReportsClosedQueue() throws Exception {
        when(trigger.onRelevantChange(any())).thenThrow(new QueueClosedException("closed"));
        var watcher = new FileWatcher(configDir, trigger);
        ListenableFuture<?> task = watcher.start(workers);
        awaitDirectoryCount(watcher, task, 1);

        Files.writeString(configDir.resolve("eww.scss"), "* { }");

        assertNull(task.get(EVENT_TIMEOUT_MS, TimeUnit.MILLISECONDS));
    }
}

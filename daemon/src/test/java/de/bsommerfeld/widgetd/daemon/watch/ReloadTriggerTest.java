package de.bsommerfeld.widgetd.daemon.watch;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import de.bsommerfeld.widgetd.core.command.CommandQueue;
import de.bsommerfeld.widgetd.core.command.DaemonCommand.ReloadConfigAndCss;
import de.bsommerfeld.widgetd.core.command.DaemonResponse;
import de.bsommerfeld.widgetd.core.command.QueueClosedException;
import de.bsommerfeld.widgetd.core.debounce.DebounceGate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

class ReloadTriggerTest {

    private ScheduledExecutorService timer;
    private DebounceGate gate;
    private CommandQueue queue;
    private ReloadTrigger trigger;

    private ListAppender<ILoggingEvent> logEvents;

    @BeforeEach
    void setUp() {
        timer = mock(ScheduledExecutorService.class);
        gate = new DebounceGate(Duration.ofMillis(500), timer);
        queue = new CommandQueue();
        trigger = new ReloadTrigger(gate, queue);

        logEvents = new ListAppender<>();
        logEvents.start();
        triggerLogger().addAppender(logEvents);
    }

    @AfterEach
    void tearDown() {
        triggerLogger().detachAppender(logEvents);
    }

    private static Logger triggerLogger() {
        return (Logger) LoggerFactory.getLogger(ReloadTrigger.class);
    }

    private List<String> errorMessages() {
        return logEvents.list.stream()
                .filter(event -> event.getLevel() == Level.ERROR)
                .map(ILoggingEvent::getFormattedMessage)
                .collect(Collectors.toList());
    }

    @Test
    void onRelevantChange_shouldSendOneReloadAndObserveResponse() throws Exception {
        assertTrue(trigger.onRelevantChange(Path.of("/cfg/panel.yuck")));

        var reload = assertInstanceOf(ReloadConfigAndCss.class, queue.poll(Duration.ofSeconds(1)));
        assertTrue(reload.response().send(DaemonResponse.success("Reloaded /cfg/eww.yuck")));
        assertTrue(reload.response().receiver().isDone());
        assertEquals(0, queue.size());
    }

    @Test
    void onRelevantChange_shouldCoalesceBurstIntoSingleReload() {
        int sent = 0;
        for (int i = 0; i < 10; i++) {
            if (trigger.onRelevantChange(Path.of("/cfg/eww.scss"))) {
                sent++;
            }
        }

        assertEquals(1, sent);
        assertEquals(1, queue.size());
    }

    @Test
    void onRelevantChange_shouldSendAgainAfterCooldown() {
        var reopen = ArgumentCaptor.forClass(Runnable.class);
        trigger.onRelevantChange(Path.of("/cfg/eww.yuck"));
        verify(timer).schedule(reopen.capture(), anyLong(), any(TimeUnit.class));

        reopen.getValue().run();

        assertTrue(trigger.onRelevantChange(Path.of("/cfg/eww.yuck")));
        assertEquals(2, queue.size());
    }

    @Test
    void onRelevantChange_shouldLogFailedReload() throws Exception {
        trigger.onRelevantChange(Path.of("/cfg/eww.yuck"));
        var reload = (ReloadConfigAndCss) queue.poll(Duration.ofSeconds(1));

        assertTrue(reload.response().send(DaemonResponse.failure("Config file is empty")));

        assertEquals(List.of("Failed to reload config: Config file is empty"), errorMessages());
        assertFalse(gate.isOpen());
    }

    @Test
    void onRelevantChange_shouldLogMissingResponseWhenCommandIsDropped() {
        trigger.onRelevantChange(Path.of("/cfg/eww.yuck"));

        queue.close();

        assertEquals(List.of("No response to configuration-reload request"), errorMessages());
    }

    @Test
    void onRelevantChange_shouldLogNothingForSuccessfulReload() throws Exception {
        trigger.onRelevantChange(Path.of("/cfg/eww.yuck"));
        var reload = (ReloadConfigAndCss) queue.poll(Duration.ofSeconds(1));

        reload.response().send(DaemonResponse.success("Reloaded /cfg/eww.yuck"));

        assertTrue(errorMessages().isEmpty());
    }

    @Test
    void onRelevantChange_shouldFailWhenQueueIsClosed() {
        queue.close();

        assertThrows(QueueClosedException.class, () -> trigger.onRelevantChange(Path.of("/cfg/eww.yuck")));
    }
}

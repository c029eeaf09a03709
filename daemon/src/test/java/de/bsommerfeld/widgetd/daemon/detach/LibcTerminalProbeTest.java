package de.bsommerfeld.widgetd.daemon.detach;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LibcTerminalProbeTest {

    @Test
    void isTerminal_shouldAskAboutTheProbedDescriptorOnly() {
        List<Integer> asked = new ArrayList<>();
        var probe = new LibcTerminalProbe(fd -> {
            asked.add(fd);
            return fd == 1 ? 1 : 0;
        });

        assertTrue(probe.isTerminal(StandardStream.STDOUT));
        assertFalse(probe.isTerminal(StandardStream.STDERR));
        assertEquals(List.of(1, 2), asked);
    }

    @Test
    void isTerminal_shouldRedirectOnlyStderrWhenStdoutIsAFile() {
        var probe = new LibcTerminalProbe(fd -> fd == 2 ? 1 : 0);

        assertEquals(RedirectPlan.of(false, true), RedirectPlan.probe(probe));
    }

    @Test
    void isTerminal_shouldReportNoTerminalWithoutCLibrary() {
        var probe = new LibcTerminalProbe(null);

        assertFalse(probe.isTerminal(StandardStream.STDOUT));
        assertFalse(probe.isTerminal(StandardStream.STDERR));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void isTerminal_shouldCallNativeLibrary() {
        var probe = new LibcTerminalProbe();

        assertDoesNotThrow(() -> probe.isTerminal(StandardStream.STDERR));
    }
}

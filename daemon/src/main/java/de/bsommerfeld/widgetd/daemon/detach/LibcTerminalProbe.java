package de.bsommerfeld.widgetd.daemon.detach;

import com.sun.jna.Library;
import com.sun.jna.Native;
import com.sun.jna.Platform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks the C library whether a descriptor refers to a terminal, one descriptor
 * at a time.
 *
 * <p>
 * If the C library cannot be loaded every stream is reported as not being a
 * terminal, which leaves the daemon's streams where the caller put them.
 */
public class LibcTerminalProbe implements TerminalProbe {

    private static final Logger LOG = LoggerFactory.getLogger(LibcTerminalProbe.class);

    public interface CLibrary extends Library {
        int isatty(int fd);
    }

    private final CLibrary libc;

    public LibcTerminalProbe() {
        this(loadLibc());
    }

    LibcTerminalProbe(CLibrary libc) {
        this.libc = libc;
    }

    @Override
    public boolean isTerminal(StandardStream stream) {
        if (libc == null) {
            return false;
        }
        return libc.isatty(stream.getDescriptor()) == 1;
    }

    private static CLibrary loadLibc() {
        try {
            return Native.load(Platform.C_LIBRARY_NAME, CLibrary.class);
        } catch (UnsatisfiedLinkError e) {
            LOG.warn("C library unavailable, treating all streams as redirected: {}", e.getMessage());
            return null;
        }
    }
}

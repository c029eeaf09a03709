package de.bsommerfeld.widgetd.daemon;

import de.bsommerfeld.widgetd.core.lifecycle.ExitSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.IntConsumer;

/**
 * Translates SIGINT/SIGTERM (which make the JVM run its shutdown hooks) into
 * the {@link ExitSignal}, then waits until the daemon has fully stopped: UI
 * loop finished, background tasks closed, socket file removed.
 *
 * <p>
 * The JVM halts as soon as this hook returns, so returning early would cut the
 * daemon's own cleanup short. If the shutdown does not complete in time, the
 * process is halted with a non-zero status.
 */
public class ShutdownHook implements Runnable {

    static final Duration DEFAULT_GRACE_PERIOD = Duration.ofSeconds(5);

    private static final Logger LOG = LoggerFactory.getLogger(ShutdownHook.class);

    private final ExitSignal exitSignal;
    private final CountDownLatch stopped;
    private final Duration gracePeriod;
    private final IntConsumer halt;

    /**
     * @param stopped released once the daemon has finished its own shutdown
     */
    public ShutdownHook(ExitSignal exitSignal, CountDownLatch stopped) {
        this(exitSignal, stopped, DEFAULT_GRACE_PERIOD, status -> Runtime.getRuntime().halt(status));
    }

    ShutdownHook(ExitSignal exitSignal, CountDownLatch stopped, Duration gracePeriod, IntConsumer halt) {
        this.exitSignal = exitSignal;
        this.stopped = stopped;
        this.gracePeriod = gracePeriod;
        this.halt = halt;
    }

    public void install() {
        Runtime.getRuntime().addShutdownHook(new Thread(this, "widgetd-shutdown"));
    }

    @Override
    public void run() {
        if (stopped.getCount() == 0) {
            return;
        }
        LOG.info("Shutting down widget daemon...");
        exitSignal.signal();
        try {
            if (!stopped.await(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.error("Failed to send application shutdown event to workers within {}", gracePeriod);
                halt.accept(1);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.error("Interrupted while waiting for the daemon to stop");
            halt.accept(1);
        }
    }
}

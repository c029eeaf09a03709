package de.bsommerfeld.widgetd.core.command;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * The single consumer of the {@link CommandQueue}.
 *
 * <p>
 * {@link #run()} occupies the calling thread, which becomes the UI thread: each
 * command is handed to the {@link CommandHandler} and fully applied before the
 * next one is taken. No command is ever applied concurrently with another.
 */
@Singleton
public class UiLoop {

    private static final Logger LOG = LoggerFactory.getLogger(UiLoop.class);

    private final CommandQueue queue;
    private final CommandHandler handler;
    private final CountDownLatch terminated = new CountDownLatch(1);

    @Inject
    public UiLoop(CommandQueue queue, CommandHandler handler) {
        this.queue = queue;
        this.handler = handler;
    }

    public void run() {
        LOG.debug("UI loop started on thread {}", Thread.currentThread().getName());
        try {
            boolean running = true;
            while (running) {
                DaemonCommand command = queue.receive();
                running = apply(command);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("UI loop interrupted");
        } finally {
            queue.close();
            terminated.countDown();
            LOG.debug("UI loop finished");
        }
    }

    private boolean apply(DaemonCommand command) {
        LOG.debug("Handling {}", command);
        try {
            return handler.handle(command);
        } catch (RuntimeException e) {
            LOG.error("Error while handling {}", command, e);
            if (command instanceof DaemonCommand.WithResponse withResponse) {
                withResponse.response().send(DaemonResponse.failure(String.valueOf(e.getMessage())));
            }
            return true;
        }
    }

    /**
     * Waits until {@link #run()} has returned.
     *
     * @return {@code true} if the loop finished within the timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isTerminated() {
        return terminated.getCount() == 0;
    }
}

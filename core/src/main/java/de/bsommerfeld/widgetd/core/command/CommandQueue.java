package de.bsommerfeld.widgetd.core.command;

import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Unbounded multi-producer, single-consumer queue between the worker tasks and
 * the UI loop.
 *
 * <p>
 * Producers only see the {@link CommandSink} side. Commands from one producer
 * are received in the order that producer sent them; there is no ordering
 * between producers. Once {@link #close() closed}, sends fail with
 * {@link QueueClosedException} and commands still waiting are dropped.
 */
@Singleton
public class CommandQueue implements CommandSink {

    private static final Logger LOG = LoggerFactory.getLogger(CommandQueue.class);

    private final BlockingQueue<DaemonCommand> queue = new LinkedBlockingQueue<>();
    private final Object lock = new Object();
    private boolean closed;

    @Override
    public void send(DaemonCommand command) {
        synchronized (lock) {
            if (closed) {
                throw new QueueClosedException("Command queue is closed, cannot send " + command);
            }
            queue.add(command);
        }
        LOG.trace("Queued {}", command);
    }

    /**
     * Waits for the next command.
     */
    public DaemonCommand receive() throws InterruptedException {
        return queue.take();
    }

    /**
     * Waits up to {@code timeout} for the next command.
     *
     * @return the command, or {@code null} if none arrived in time
     */
    public DaemonCommand poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Stops accepting commands. Pending commands are discarded and their
     * requesters are told that no response will come.
     */
    public void close() {
        List<DaemonCommand> pending = new ArrayList<>();
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            queue.drainTo(pending);
        }
        if (!pending.isEmpty()) {
            LOG.debug("Dropping {} pending command(s) on close", pending.size());
        }
        for (DaemonCommand command : pending) {
            if (command instanceof DaemonCommand.WithResponse withResponse) {
                withResponse.response().drop();
            }
        }
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    public int size() {
        return queue.size();
    }
}

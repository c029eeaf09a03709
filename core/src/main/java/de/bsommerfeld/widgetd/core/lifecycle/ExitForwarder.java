package de.bsommerfeld.widgetd.core.lifecycle;

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.widgetd.core.command.CommandSink;
import de.bsommerfeld.widgetd.core.command.DaemonCommand.KillServer;
import de.bsommerfeld.widgetd.core.command.QueueClosedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the {@link ExitSignal} into a {@link KillServer} command so that every
 * shutdown path ends up in the queue the UI loop already consumes.
 */
@Singleton
public class ExitForwarder implements SupervisedTask {

    private static final Logger LOG = LoggerFactory.getLogger(ExitForwarder.class);

    private final ExitSignal exitSignal;
    private final CommandSink sink;

    @Inject
    public ExitForwarder(ExitSignal exitSignal, CommandSink sink) {
        this.exitSignal = exitSignal;
        this.sink = sink;
    }

    @Override
    public String name() {
        return "exit-forwarder";
    }

    @Override
    public ListenableFuture<?> start(ListeningExecutorService workers) {
        return Futures.transform(exitSignal.await(), ignored -> {
            forward();
            return null;
        }, workers);
    }

    private void forward() {
        LOG.info("Forward task received exit event");
        try {
            sink.send(new KillServer());
        } catch (QueueClosedException e) {
            // best effort, the UI loop is already gone
            LOG.warn("Could not forward exit to UI loop: {}", e.getMessage());
        }
    }
}

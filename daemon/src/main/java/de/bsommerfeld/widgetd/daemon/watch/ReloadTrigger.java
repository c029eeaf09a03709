package de.bsommerfeld.widgetd.daemon.watch;

import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.widgetd.core.command.CommandSink;
import de.bsommerfeld.widgetd.core.command.DaemonCommand.ReloadConfigAndCss;
import de.bsommerfeld.widgetd.core.command.DaemonResponse;
import de.bsommerfeld.widgetd.core.command.ResponseChannel;
import de.bsommerfeld.widgetd.core.debounce.DebounceGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Turns relevant file changes into at most one {@link ReloadConfigAndCss} per
 * debounce window.
 *
 * <p>
 * The response is observed through a callback, so the caller (the watcher's
 * event loop) never waits for the UI loop.
 */
@Singleton
public class ReloadTrigger {

    private static final Logger LOG = LoggerFactory.getLogger(ReloadTrigger.class);

    private final DebounceGate gate;
    private final CommandSink sink;

    @Inject
    public ReloadTrigger(DebounceGate gate, CommandSink sink) {
        this.gate = gate;
        this.sink = sink;
    }

    /**
     * @return {@code true} if a reload command was sent, {@code false} if the
     *         change was coalesced into an earlier one
     * @throws de.bsommerfeld.widgetd.core.command.QueueClosedException if the UI
     *         loop no longer accepts commands
     */
    public boolean onRelevantChange(Path changed) {
        if (!gate.tryClose()) {
            LOG.trace("Coalescing change to {}", changed);
            return false;
        }

        LOG.debug("Change to {} detected, requesting reload", changed);
        ResponseChannel channel = ResponseChannel.create();
        sink.send(new ReloadConfigAndCss(channel));
        Futures.addCallback(channel.receiver(), new FutureCallback<DaemonResponse>() {
            @Override
            public void onSuccess(DaemonResponse response) {
                if (response.isSuccess()) {
                    LOG.info("Reloaded config successfully");
                } else {
                    LOG.error("Failed to reload config: {}", response.text());
                }
            }

            @Override
            public void onFailure(Throwable t) {
                LOG.error("No response to configuration-reload request");
            }
        }, MoreExecutors.directExecutor());
        return true;
    }
}

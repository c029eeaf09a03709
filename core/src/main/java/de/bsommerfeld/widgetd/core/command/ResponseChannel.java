package de.bsommerfeld.widgetd.core.command;

import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One-shot channel carrying exactly one {@link DaemonResponse} from the UI loop
 * back to whoever issued the command.
 *
 * <p>
 * The requester observes {@link #receiver()}. If it loses interest it simply
 * cancels that future; a later {@link #send} then reports {@code false} and the
 * response is discarded. A command that is thrown away unanswered should be
 * {@link #drop() dropped} so the requester does not wait forever.
 */
public final class ResponseChannel {

    private static final Logger LOG = LoggerFactory.getLogger(ResponseChannel.class);

    private final SettableFuture<DaemonResponse> future = SettableFuture.create();

    private ResponseChannel() {
    }

    public static ResponseChannel create() {
        return new ResponseChannel();
    }

    /**
     * Delivers the response.
     *
     * @return {@code true} if the requester will see this response,
     *         {@code false} if a response was already sent or the requester
     *         cancelled
     */
    public boolean send(DaemonResponse response) {
        boolean delivered = future.set(response);
        if (!delivered) {
            LOG.debug("Response receiver is gone, discarding {}", response);
        }
        return delivered;
    }

    /**
     * Completes the channel without a response.
     */
    public void drop() {
        future.setException(new ResponseDroppedException());
    }

    public ListenableFuture<DaemonResponse> receiver() {
        return future;
    }
}

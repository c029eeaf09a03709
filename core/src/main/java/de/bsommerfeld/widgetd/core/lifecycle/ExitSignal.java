package de.bsommerfeld.widgetd.core.lifecycle;

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shutdown broadcast shared by every long-running task.
 *
 * <p>
 * {@link #signal()} may be called any number of times from any thread; only the
 * first call has an effect. Each call to {@link #await()} hands out an
 * independent future that completes once the signal has fired, so tasks can
 * subscribe without the signalling side knowing about them. The signal is
 * never reset.
 */
@Singleton
public class ExitSignal {

    private static final Logger LOG = LoggerFactory.getLogger(ExitSignal.class);

    private final SettableFuture<Void> signaled = SettableFuture.create();

    /**
     * @return {@code true} if this call fired the signal
     */
    public boolean signal() {
        boolean first = signaled.set(null);
        if (first) {
            LOG.info("Exit signal raised");
        } else {
            LOG.debug("Exit signal already raised, ignoring");
        }
        return first;
    }

    /**
     * Returns a future that completes once the signal has fired. Cancelling it
     * only detaches this waiter.
     */
    public ListenableFuture<Void> await() {
        return Futures.nonCancellationPropagating(signaled);
    }

    public boolean isSignaled() {
        return signaled.isDone();
    }
}

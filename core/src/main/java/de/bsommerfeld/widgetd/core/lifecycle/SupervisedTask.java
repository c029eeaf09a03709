package de.bsommerfeld.widgetd.core.lifecycle;

import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;

/**
 * A background task started and joined by the {@link Supervisor}.
 */
public interface SupervisedTask {

    String name();

    /**
     * Starts the task on the worker pool.
     *
     * @return a future that completes when the task ends; a failed future is an
     *         unrecoverable fault of the daemon
     */
    ListenableFuture<?> start(ListeningExecutorService workers);
}

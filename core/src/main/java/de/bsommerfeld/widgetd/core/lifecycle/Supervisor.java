package de.bsommerfeld.widgetd.core.lifecycle;

import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Starts a fixed set of tasks on the worker pool and joins them fail-fast.
 *
 * <p>
 * The returned future fails as soon as any task fails; the remaining tasks are
 * left running and are reclaimed when the process exits. Nothing is restarted.
 */
@Singleton
public class Supervisor {

    private static final Logger LOG = LoggerFactory.getLogger(Supervisor.class);

    private final ListeningExecutorService workers;

    @Inject
    public Supervisor(ListeningExecutorService workers) {
        this.workers = workers;
    }

    public ListenableFuture<Void> run(List<? extends SupervisedTask> tasks) {
        List<ListenableFuture<?>> running = new ArrayList<>(tasks.size());
        for (SupervisedTask task : tasks) {
            LOG.debug("Starting task '{}'", task.name());
            running.add(named(task, startSafely(task)));
        }

        ListenableFuture<Void> joined = Futures.transform(
                Futures.allAsList(running), results -> null, MoreExecutors.directExecutor());

        Futures.addCallback(joined, new FutureCallback<Void>() {
            @Override
            public void onSuccess(Void result) {
                LOG.info("All supervised tasks finished");
            }

            @Override
            public void onFailure(Throwable t) {
                LOG.error("Daemon exiting with error", t);
            }
        }, MoreExecutors.directExecutor());
        return joined;
    }

    private ListenableFuture<?> startSafely(SupervisedTask task) {
        try {
            return task.start(workers);
        } catch (RuntimeException e) {
            return Futures.immediateFailedFuture(e);
        }
    }

    private static ListenableFuture<Object> named(SupervisedTask task, ListenableFuture<?> future) {
        ListenableFuture<Object> widened = Futures.transform(future, result -> result, MoreExecutors.directExecutor());
        return Futures.catchingAsync(widened, Throwable.class,
                t -> Futures.immediateFailedFuture(new SupervisedTaskException(task.name(), t)),
                MoreExecutors.directExecutor());
    }
}

package de.bsommerfeld.mandump.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A set of tasks that succeed or fail together.
 *
 * <p>Tasks are submitted to a shared executor. The first task to throw records its
 * exception and cancels the group: every other task is interrupted and
 * {@link #isCancelled()} turns {@code true}, which blocking operations observe through the
 * {@link Cancellation} interface. {@link #await()} waits for all tasks and rethrows the
 * first failure.
 *
 * <h3>Nesting</h3>
 * A {@link #child()} group shares the executor and reports itself cancelled as soon as
 * any ancestor is. A failing child does not cancel its parent directly; the task that
 * awaits the child fails with the child's error, which then cancels the parent.
 */
public final class TaskGroup implements Cancellation {

    private static final Logger LOG = LoggerFactory.getLogger(TaskGroup.class);

    /**
     * A unit of work run by a group.
     */
    @FunctionalInterface
    public interface Task {
        void run() throws Exception;
    }

    private final ExecutorService executor;
    private final TaskGroup parent;

    private final List<Future<?>> futures = new ArrayList<>();
    private final AtomicReference<Exception> firstError = new AtomicReference<>();
    private volatile boolean cancelled;

    public TaskGroup(ExecutorService executor) {
        this(executor, null);
    }

    private TaskGroup(ExecutorService executor, TaskGroup parent) {
        this.executor = executor;
        this.parent = parent;
    }

    /**
     * Creates a group whose cancellation follows this one's.
     */
    public TaskGroup child() {
        return new TaskGroup(executor, this);
    }

    /**
     * Submits a task.
     *
     * @throws CancellationException if the group has already been cancelled
     */
    public void submit(Task task) {
        throwIfCancelled();
        Future<?> future = executor.submit(() -> {
            try {
                task.run();
            } catch (Exception e) {
                fail(e);
            }
            return null;
        });
        synchronized (futures) {
            futures.add(future);
        }
        if (isCancelled()) {
            future.cancel(true);
        }
    }

    private void fail(Exception e) {
        Exception cause = unwrap(e);
        if (firstError.compareAndSet(null, cause)) {
            LOG.debug("Task failed, cancelling group", cause);
            cancel();
        }
    }

    /**
     * Cancels the group, interrupting all running tasks.
     */
    public void cancel() {
        cancelled = true;
        List<Future<?>> snapshot;
        synchronized (futures) {
            snapshot = new ArrayList<>(futures);
        }
        for (Future<?> f : snapshot) {
            f.cancel(true);
        }
    }

    @Override
    public boolean isCancelled() {
        return cancelled || (parent != null && parent.isCancelled());
    }

    /**
     * Waits for all submitted tasks.
     *
     * @throws ExecutionException   wrapping the first task failure
     * @throws InterruptedException if the waiting thread is interrupted; the group is
     *                              cancelled first
     */
    public void await() throws ExecutionException, InterruptedException {
        List<Future<?>> snapshot;
        synchronized (futures) {
            snapshot = new ArrayList<>(futures);
        }
        for (Future<?> f : snapshot) {
            try {
                f.get();
            } catch (CancellationException e) {
                // Only cancelled because of a recorded failure or a cancelled ancestor
                LOG.trace("Skipping cancelled task");
            } catch (InterruptedException e) {
                cancel();
                throw e;
            }
        }

        Exception error = firstError.get();
        if (error != null) {
            throw new ExecutionException(error);
        }
    }

    /**
     * Returns the first recorded failure, if any.
     */
    public Exception firstError() {
        return firstError.get();
    }

    private static Exception unwrap(Exception e) {
        Exception current = e;
        while (current instanceof ExecutionException && current.getCause() instanceof Exception) {
            current = (Exception) current.getCause();
        }
        return current;
    }
}

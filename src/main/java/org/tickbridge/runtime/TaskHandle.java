package org.tickbridge.runtime;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Handle to a background task spawned with {@link BridgeHandle#spawnBackgroundTask}.
 * <p>
 * Cancelling stops the task from observing any further result: pending sleeps and pending
 * main-thread responses of the task complete as cancelled. Callbacks the task already
 * enqueued still run on the world thread.
 *
 * @param <T> the task's result type
 */
public final class TaskHandle<T> {

    private final CompletableFuture<T> result;
    private final TaskScope scope;

    TaskHandle(CompletableFuture<T> result, TaskScope scope) {
        this.result = result;
        this.scope = scope;
    }

    /**
     * @return the future of the task's result; cancelling it cancels the task
     */
    public CompletableFuture<T> future() {
        return result;
    }

    /**
     * Cancels the task.
     *
     * @return true if the task was still running
     */
    public boolean cancel() {
        return result.cancel(false);
    }

    public boolean isDone() {
        return result.isDone();
    }

    public boolean isCancelled() {
        return result.isCancelled();
    }

    /**
     * Terminal states are read from the result future, the others from the task's last wait.
     */
    public TaskState getState() {
        if (result.isCancelled()) {
            return TaskState.CANCELLED;
        }
        if (result.isCompletedExceptionally()) {
            return TaskState.FAILED;
        }
        if (result.isDone()) {
            return TaskState.COMPLETED;
        }
        return scope.state();
    }

    public T join() {
        return result.join();
    }

    public T get(long timeout, TimeUnit unit) throws InterruptedException, ExecutionException, TimeoutException {
        return result.get(timeout, unit);
    }
}

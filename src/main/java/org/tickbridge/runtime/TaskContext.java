package org.tickbridge.runtime;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;

import org.tickbridge.runtime.api.ClockClosedException;
import org.tickbridge.runtime.api.ResponseLostException;
import org.tickbridge.runtime.api.WorldUnavailableException;

/**
 * The capability handed to every background task: read the tick, wait for ticks, and run
 * work on the world thread.
 * <p>
 * Contexts are cheap and immutable; {@link #copy()} returns a handle sharing the same clock,
 * queue, executor and task scope, so copies may be passed freely between the futures of one
 * task. All futures returned here complete on the task executor, never on the world thread.
 * <p>
 * Waiting is expressed by composing on the returned futures. Blocking a runtime thread with
 * {@code join()} works but occupies that thread until the world ticks.
 */
public final class TaskContext {

    private final TickClock clock;
    private final MainThreadQueue queue;
    private final Executor executor;
    private final TaskScope scope;

    TaskContext(TickClock clock, MainThreadQueue queue, Executor executor, TaskScope scope) {
        this.clock = clock;
        this.queue = queue;
        this.executor = executor;
        this.scope = scope;
    }

    /**
     * @return a context for the same task, sharing all underlying state
     */
    public TaskContext copy() {
        return new TaskContext(clock, queue, executor, scope);
    }

    /**
     * Reads the current tick without waiting. The world may advance at any moment, so the
     * value can be stale by the time it is used.
     */
    public long currentTick() {
        return clock.current();
    }

    /**
     * Waits until the clock has advanced by at least {@code updates} ticks from the value
     * observed now.
     * <p>
     * The threshold is re-checked on every wake-up, so several ticks passing between two
     * observations complete the wait exactly once.
     *
     * @param updates number of ticks to wait, 0 completes immediately
     * @return a future completing normally once enough ticks elapsed, or exceptionally with
     *         {@link ClockClosedException} if the world shut down first, or cancelled if the
     *         task was cancelled
     */
    public CompletableFuture<Void> sleepUpdates(long updates) {
        if (updates < 0) {
            throw new IllegalArgumentException("updates cannot be negative: " + updates);
        }
        long start = clock.current();
        CompletableFuture<Void> done = scope.track(new CompletableFuture<>(), TaskState.SLEEPING);
        awaitTicks(start, updates, done);
        return done;
    }

    private void awaitTicks(long start, long updates, CompletableFuture<Void> done) {
        if (done.isDone()) {
            return;
        }
        // Subscribe before reading the tick so an advance in between cannot be missed.
        CompletableFuture<Long> change = clock.waitForChange();
        if (TickClock.hasElapsed(start, clock.current(), updates)) {
            done.complete(null);
            return;
        }
        change.whenCompleteAsync((tick, error) -> {
            if (error != null) {
                done.completeExceptionally(unwrap(error));
            } else {
                awaitTicks(start, updates, done);
            }
        }, executor);
    }

    /**
     * Runs {@code closure} on the world thread during the next tick pump and delivers its
     * return value.
     * <p>
     * Once enqueued the callback is never retracted: if this task is cancelled meanwhile, the
     * closure still runs and its result is discarded.
     *
     * @param closure the world work, receiving exclusive access via {@link MainThreadContext}
     * @param <T>     the result type
     * @return a future completing with the closure's result, or exceptionally with
     *         {@link WorldUnavailableException} if the world no longer accepts work, or with
     *         {@link ResponseLostException} if the closure threw or was dropped at shutdown
     */
    public <T> CompletableFuture<T> runOnMainThread(Function<MainThreadContext, T> closure) {
        if (closure == null) {
            throw new NullPointerException("closure cannot be null");
        }
        CompletableFuture<T> result = scope.track(new CompletableFuture<>(), TaskState.AWAITING_MAIN_THREAD);
        if (result.isCancelled()) {
            return result;
        }
        CompletableFuture<T> response = new CompletableFuture<>();
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                response.cancel(false);
            }
        });
        try {
            queue.enqueue(new MainThreadCallback<>(closure, response));
        } catch (WorldUnavailableException e) {
            result.completeExceptionally(e);
            return result;
        }
        response.whenCompleteAsync((value, error) -> {
            if (error != null) {
                result.completeExceptionally(unwrap(error));
            } else {
                result.complete(value);
            }
        }, executor);
        return result;
    }

    /**
     * @return true once the owning task has been cancelled through its {@link TaskHandle}
     */
    public boolean isCancelled() {
        return scope.isCancelled();
    }

    /**
     * Unwraps the {@link CompletionException} layer added by future composition.
     */
    static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    /**
     * @return true if {@code error} (or the cause it wraps) is a cancellation
     */
    static boolean isCancellation(Throwable error) {
        return unwrap(error) instanceof CancellationException;
    }
}

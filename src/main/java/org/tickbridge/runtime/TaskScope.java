package org.tickbridge.runtime;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-task state shared by every copy of that task's {@link TaskContext}: the cancellation
 * flag, the futures the task is currently waiting on, and its {@link TaskState}.
 */
final class TaskScope {

    private final Set<CompletableFuture<?>> inFlight = ConcurrentHashMap.newKeySet();
    private volatile boolean cancelled;
    private volatile TaskState state = TaskState.SPAWNED;

    boolean isCancelled() {
        return cancelled;
    }

    TaskState state() {
        return state;
    }

    void transition(TaskState next) {
        if (!state.isTerminal()) {
            state = next;
        }
    }

    /**
     * Tracks a wait so that cancelling the task cancels it too. The state returns to RUNNING
     * once the wait completes.
     */
    <T> CompletableFuture<T> track(CompletableFuture<T> wait, TaskState waitingState) {
        inFlight.add(wait);
        transition(waitingState);
        wait.whenComplete((value, error) -> {
            inFlight.remove(wait);
            if (inFlight.isEmpty()) {
                transition(TaskState.RUNNING);
            }
        });
        if (cancelled) {
            wait.cancel(false);
        }
        return wait;
    }

    void cancel() {
        cancelled = true;
        state = TaskState.CANCELLED;
        for (CompletableFuture<?> wait : inFlight) {
            wait.cancel(false);
        }
    }
}

package org.tickbridge.runtime;

/**
 * Lifecycle of a background task spawned through {@link BridgeHandle}.
 * <p>
 * SPAWNED -&gt; RUNNING -&gt; {SLEEPING | AWAITING_MAIN_THREAD} &lt;-&gt; RUNNING -&gt;
 * COMPLETED | FAILED | CANCELLED
 */
public enum TaskState {
    SPAWNED,
    RUNNING,
    /** Waiting in {@link TaskContext#sleepUpdates(long)}. */
    SLEEPING,
    /** Waiting for a {@link TaskContext#runOnMainThread(java.util.function.Function)} result. */
    AWAITING_MAIN_THREAD,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}

package org.tickbridge.runtime;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.tickbridge.runtime.api.ClockClosedException;

/**
 * Counts the ticks the world has completed and notifies waiters when the count changes.
 * <p>
 * <b>Coalescing notification:</b> the clock holds a single pending "next change" future.
 * {@link #advance()} swaps in a fresh future and completes the previous one with the new
 * tick. A waiter only ever learns about the tick current at the moment it is woken, never
 * about every intermediate tick, so waiters must express "wake me when tick &gt;= T" and
 * re-check the threshold instead of counting wake-ups.
 * <p>
 * <b>Thread safety:</b> {@link #current()} and {@link #waitForChange()} may be called from
 * any thread. {@link #advance()} is called by the world thread; {@link #close()} may race with
 * it and never leaves a waiter behind.
 * <p>
 * Ticks are unsigned and wrap on overflow; use {@link #elapsed(long, long)} to compare them.
 */
public class TickClock {

    private final AtomicLong ticks;
    private final AtomicReference<CompletableFuture<Long>> nextChange =
            new AtomicReference<>(new CompletableFuture<>());
    private final Object swapLock = new Object();
    private volatile boolean closed;

    public TickClock() {
        this(0L);
    }

    /**
     * @param initialTick the tick to start counting from
     */
    public TickClock(long initialTick) {
        this.ticks = new AtomicLong(initialTick);
    }

    /**
     * Advances the clock by one tick and wakes every current waiter.
     *
     * @return the new tick
     * @throws IllegalStateException if the clock has been closed
     */
    public long advance() {
        long tick;
        CompletableFuture<Long> previous;
        synchronized (swapLock) {
            if (closed) {
                throw new IllegalStateException("Cannot advance a closed tick clock");
            }
            // Counter first: a waiter that grabbed the old future is guaranteed to read the new tick.
            tick = ticks.incrementAndGet();
            previous = nextChange.getAndSet(new CompletableFuture<>());
        }
        previous.complete(tick);
        return tick;
    }

    /**
     * Returns the current tick. The value may change immediately after this returns.
     *
     * @return the current tick
     */
    public long current() {
        return ticks.get();
    }

    /**
     * Returns a future completing with the tick of the first {@link #advance()} that happens
     * after this call began.
     * <p>
     * Callbacks attached to the returned future without an executor run on the world thread.
     * Use the async variants to hop back to the task runtime. Each caller gets its own copy,
     * cancelling or completing it does not affect other waiters.
     *
     * @return the change future; completed exceptionally with {@link ClockClosedException}
     *         if the clock is or becomes closed
     */
    public CompletableFuture<Long> waitForChange() {
        return nextChange.get().copy();
    }

    /**
     * Closes the clock. Pending and future waiters fail with {@link ClockClosedException}.
     * Idempotent.
     */
    public void close() {
        CompletableFuture<Long> previous;
        synchronized (swapLock) {
            if (closed) {
                return;
            }
            closed = true;
            CompletableFuture<Long> failed = new CompletableFuture<>();
            failed.completeExceptionally(new ClockClosedException(ticks.get()));
            previous = nextChange.getAndSet(failed);
        }
        previous.completeExceptionally(new ClockClosedException(ticks.get()));
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Number of ticks from {@code from} to {@code to}, tolerating wraparound.
     * The result is unsigned; compare it with {@link Long#compareUnsigned(long, long)}.
     *
     * @param from the earlier tick
     * @param to   the later tick
     * @return the wrapping distance between both ticks
     */
    public static long elapsed(long from, long to) {
        return to - from;
    }

    /**
     * @return true if at least {@code updates} ticks lie between {@code from} and {@code to}
     */
    public static boolean hasElapsed(long from, long to, long updates) {
        return Long.compareUnsigned(elapsed(from, to), updates) >= 0;
    }
}

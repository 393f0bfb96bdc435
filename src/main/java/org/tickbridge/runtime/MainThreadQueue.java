package org.tickbridge.runtime;

import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.LongFunction;

import org.tickbridge.runtime.api.WorldUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Many-producer, single-consumer FIFO of {@link MainThreadCallback}s waiting for the world
 * thread.
 * <p>
 * {@link #enqueue(MainThreadCallback)} never blocks and may be called from any thread.
 * {@link #drainAll(LongFunction, long)} is called only by the tick pump.
 * <p>
 * <b>Overload:</b> with {@code maxPerDrain == 0} a drain runs until the queue is empty. If
 * producers enqueue faster than the world executes, a single tick can run arbitrarily long
 * and tick advancement stalls. Nothing sheds load here; configure a bound to spread a
 * backlog over several ticks instead.
 */
public class MainThreadQueue {

    private static final Logger log = LoggerFactory.getLogger(MainThreadQueue.class);

    private final ConcurrentLinkedQueue<MainThreadCallback<?>> queue = new ConcurrentLinkedQueue<>();
    private final int maxPerDrain;
    private volatile boolean closed;

    /**
     * Creates an unbounded queue that drains completely on every tick.
     */
    public MainThreadQueue() {
        this(0);
    }

    /**
     * @param maxPerDrain the maximum number of callbacks executed per drain, 0 for no limit
     */
    public MainThreadQueue(int maxPerDrain) {
        if (maxPerDrain < 0) {
            throw new IllegalArgumentException("maxPerDrain cannot be negative: " + maxPerDrain);
        }
        this.maxPerDrain = maxPerDrain;
    }

    /**
     * Hands a callback over to the world thread.
     *
     * @throws WorldUnavailableException if the queue has been closed
     */
    public void enqueue(MainThreadCallback<?> callback) {
        if (closed) {
            throw new WorldUnavailableException("World is shutting down, main-thread work is no longer accepted");
        }
        queue.offer(callback);
        // close() may have drained the queue between the check and the offer.
        if (closed && queue.remove(callback)) {
            throw new WorldUnavailableException("World is shutting down, main-thread work is no longer accepted");
        }
    }

    /**
     * Executes queued callbacks in FIFO order until the queue is empty or the per-drain
     * limit is reached.
     *
     * @param contextFactory creates the context for each callback from the current tick
     * @param tick           the tick the callbacks execute in
     * @return the number of callbacks executed
     */
    public int drainAll(LongFunction<MainThreadContext> contextFactory, long tick) {
        int executed = 0;
        MainThreadCallback<?> callback;
        while ((maxPerDrain == 0 || executed < maxPerDrain) && (callback = queue.poll()) != null) {
            callback.run(contextFactory.apply(tick));
            executed++;
        }
        if (maxPerDrain > 0 && executed == maxPerDrain && !queue.isEmpty()) {
            log.debug("Drain limit of {} reached at tick {}, {} callbacks deferred", maxPerDrain,
                    Long.toUnsignedString(tick), queue.size());
        }
        return executed;
    }

    /**
     * Rejects further work and fails every callback still waiting.
     *
     * @return the number of discarded callbacks
     */
    public int close() {
        closed = true;
        int discarded = 0;
        MainThreadCallback<?> callback;
        while ((callback = queue.poll()) != null) {
            callback.discard("World shut down before the main-thread callback could run");
            discarded++;
        }
        if (discarded > 0) {
            log.warn("Discarded {} pending main-thread callbacks during shutdown", discarded);
        }
        return discarded;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * @return approximate number of queued callbacks
     */
    public int size() {
        return queue.size();
    }

    public int getMaxPerDrain() {
        return maxPerDrain;
    }
}

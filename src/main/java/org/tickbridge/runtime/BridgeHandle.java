package org.tickbridge.runtime;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import org.tickbridge.runtime.api.DuplicateBridgeException;
import org.tickbridge.runtime.api.WorldUnavailableException;
import org.tickbridge.runtime.channels.ChannelEventBridge;
import org.tickbridge.runtime.channels.EventChannel;
import org.tickbridge.world.World;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connects a single-threaded {@link World} with background tasks running on an executor.
 * <p>
 * Owned by the world thread. Background work is started with
 * {@link #spawnBackgroundTask(Function)}; each task gets its own {@link TaskContext} for
 * waiting on ticks and running closures on the world thread. Asynchronous producers feed the
 * world through channels registered with {@link #addEventChannel(Class, EventChannel)}.
 * <p>
 * <b>Pump order</b> ({@link #tickPump()}, once per world update):
 * <ol>
 *   <li>advance the {@link TickClock} and wake waiters</li>
 *   <li>rotate the world's event buffers</li>
 *   <li>drain every channel bridge into its event storage</li>
 *   <li>optionally yield the world thread to the runtime</li>
 *   <li>run queued main-thread callbacks, FIFO</li>
 * </ol>
 * <p>
 * <b>Thread safety:</b> the first thread calling {@link #tickPump()} becomes the world thread.
 * Pumping from any other thread, or reentrantly from inside a callback, is rejected.
 * {@link #spawnBackgroundTask(Function)} and {@link #currentTick()} may be called from anywhere.
 */
public class BridgeHandle implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BridgeHandle.class);

    private final World world;
    private final BridgeOptions options;
    private final TickClock clock;
    private final MainThreadQueue mainThreadQueue;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final Map<Class<?>, ChannelEventBridge<?>> bridges = new LinkedHashMap<>();

    private volatile Thread worldThread;
    private boolean pumping;
    private volatile boolean closed;

    /**
     * Creates a handle with its own fixed-size task executor.
     */
    public BridgeHandle(World world, BridgeOptions options) {
        this(world, options, createExecutor(options), true, 0L);
    }

    /**
     * Creates a handle running tasks on an externally managed executor. {@link #close()}
     * does not shut it down.
     */
    public BridgeHandle(World world, BridgeOptions options, ExecutorService executor) {
        this(world, options, executor, false, 0L);
    }

    /**
     * Creates a handle whose clock starts at {@code initialTick} instead of 0.
     */
    BridgeHandle(World world, BridgeOptions options, long initialTick) {
        this(world, options, createExecutor(options), true, initialTick);
    }

    private BridgeHandle(World world, BridgeOptions options, ExecutorService executor, boolean ownsExecutor,
                         long initialTick) {
        this.world = world;
        this.options = options;
        this.clock = new TickClock(initialTick);
        this.mainThreadQueue = new MainThreadQueue(options.maxCallbacksPerTick());
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
    }

    private static ExecutorService createExecutor(BridgeOptions options) {
        AtomicInteger threadIndex = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, options.threadNamePrefix() + "-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(options.runtimeThreads(), factory);
    }

    /**
     * Starts a background task on the executor right away, independently of the tick cadence.
     *
     * @param factory receives the task's {@link TaskContext} and returns the task's future
     * @param <T>     the task's result type
     * @return a handle to await or cancel the task
     * @throws WorldUnavailableException if the handle has been closed
     */
    public <T> TaskHandle<T> spawnBackgroundTask(Function<TaskContext, CompletableFuture<T>> factory) {
        if (closed) {
            throw new WorldUnavailableException("Cannot spawn background task, bridge is closed");
        }
        TaskScope scope = new TaskScope();
        TaskContext context = new TaskContext(clock, mainThreadQueue, this::dispatch, scope);
        CompletableFuture<T> result = new CompletableFuture<>();
        result.whenComplete((value, error) -> {
            if (error != null && TaskContext.isCancellation(error)) {
                scope.cancel();
            }
        });
        executor.execute(() -> {
            if (result.isDone()) {
                return;
            }
            scope.transition(TaskState.RUNNING);
            CompletableFuture<T> task;
            try {
                task = factory.apply(context);
            } catch (VirtualMachineError e) {
                result.completeExceptionally(e);
                throw e;
            } catch (Throwable t) {
                result.completeExceptionally(t);
                return;
            }
            if (task == null) {
                result.completeExceptionally(new NullPointerException("Background task factory returned null"));
                return;
            }
            task.whenComplete((value, error) -> {
                if (error != null) {
                    result.completeExceptionally(TaskContext.unwrap(error));
                } else {
                    result.complete(value);
                }
            });
        });
        return new TaskHandle<>(result, scope);
    }

    /**
     * Installs a per-tick bridge draining {@code channel} into the world's events of
     * {@code type}. Claims the channel's receiver.
     *
     * @throws DuplicateBridgeException if {@code type} already has a bridge into this world,
     *                                  through this or any other handle
     * @throws IllegalStateException    if the channel's receiver was already claimed
     */
    public <T> ChannelEventBridge<T> addEventChannel(Class<T> type, EventChannel<T> channel) {
        checkWorldThread();
        world.claimBridge(type);
        EventChannel.Receiver<T> receiver;
        try {
            receiver = channel.receiver();
        } catch (IllegalStateException e) {
            world.releaseBridge(type);
            throw e;
        }
        ChannelEventBridge<T> bridge = new ChannelEventBridge<>(type, receiver, world.addEvent(type));
        bridges.put(type, bridge);
        log.info("Registered channel bridge '{}' for {}", channel.getName(), type.getSimpleName());
        return bridge;
    }

    /**
     * Runs one world update. See the class documentation for the order of steps.
     *
     * @return what the pump did
     * @throws IllegalStateException if called from a thread other than the world thread,
     *                               reentrantly, or after {@link #close()}
     */
    public TickReport tickPump() {
        if (closed) {
            throw new IllegalStateException("Cannot pump a closed bridge");
        }
        checkWorldThread();
        if (worldThread == null) {
            worldThread = Thread.currentThread();
            log.debug("World thread is '{}'", worldThread.getName());
        }
        if (pumping) {
            throw new IllegalStateException("tickPump() must not be called from inside a tick pump");
        }
        pumping = true;
        try {
            long tick = clock.advance();
            world.updateEvents();
            int bridged = 0;
            for (ChannelEventBridge<?> bridge : bridges.values()) {
                bridged += bridge.drainStep();
            }
            if (options.yieldToRuntime()) {
                Thread.yield();
            }
            int executed = mainThreadQueue.drainAll(t -> new MainThreadContext(world, t), tick);
            TickReport report = new TickReport(tick, bridged, executed, mainThreadQueue.size());
            if (log.isTraceEnabled()) {
                log.trace("Pumped tick {}: {} events bridged, {} callbacks run, {} pending",
                        Long.toUnsignedString(tick), bridged, executed, report.callbacksRemaining());
            }
            return report;
        } finally {
            pumping = false;
        }
    }

    private void checkWorldThread() {
        Thread owner = worldThread;
        if (owner != null && owner != Thread.currentThread()) {
            throw new IllegalStateException("World is owned by thread '" + owner.getName()
                    + "' but was accessed from '" + Thread.currentThread().getName() + "'");
        }
    }

    private void dispatch(Runnable continuation) {
        try {
            executor.execute(continuation);
        } catch (RejectedExecutionException e) {
            // Executor already shut down: finish the continuation here so no waiter hangs.
            log.debug("Task executor rejected a continuation, running it on '{}'", Thread.currentThread().getName());
            continuation.run();
        }
    }

    public World world() {
        return world;
    }

    public long currentTick() {
        return clock.current();
    }

    /**
     * @return approximate number of main-thread callbacks waiting for the next pump
     */
    public int pendingCallbacks() {
        return mainThreadQueue.size();
    }

    public Collection<ChannelEventBridge<?>> getBridges() {
        return Collections.unmodifiableCollection(bridges.values());
    }

    public BridgeOptions getOptions() {
        return options;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Tears the bridge down: sleeping tasks wake with
     * {@link org.tickbridge.runtime.api.ClockClosedException}, queued callbacks fail with
     * {@link org.tickbridge.runtime.api.ResponseLostException}, further requests fail with
     * {@link WorldUnavailableException}. An owned executor is shut down, forcibly if it does
     * not finish within the configured timeout. Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        clock.close();
        mainThreadQueue.close();
        if (ownsExecutor) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(options.shutdownTimeoutSeconds(), TimeUnit.SECONDS)) {
                    log.warn("Task executor did not terminate within {}s, forcing shutdown", options.shutdownTimeoutSeconds());
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for task executor shutdown");
                executor.shutdownNow();
            }
        }
        log.debug("Bridge closed at tick {}", Long.toUnsignedString(clock.current()));
    }
}

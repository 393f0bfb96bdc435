package org.tickbridge.host;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import org.tickbridge.runtime.BridgeHandle;
import org.tickbridge.runtime.BridgeOptions;
import org.tickbridge.runtime.TickReport;
import org.tickbridge.world.World;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a {@link World} on a dedicated thread: pumps its {@link BridgeHandle} at a fixed
 * cadence and runs the registered per-tick systems afterwards.
 * <p>
 * The host thread is the world thread. Startup systems run on it once, before the first tick,
 * and may register channels or spawn tasks. Per-tick systems run after every pump, in
 * registration order. A system that throws, whether an exception or an error, puts the host
 * into {@link State#ERROR}.
 * <p>
 * The bridge is closed when the loop exits, so tasks still waiting on ticks are released.
 */
public class WorldHost {

    /**
     * Lifecycle of the host loop.
     */
    public enum State {
        STOPPED,
        RUNNING,
        ERROR
    }

    private record WorldSystem(String name, Consumer<World> action) {}

    private final Logger log = LoggerFactory.getLogger(WorldHost.class);
    private final String name;
    private final BridgeOptions options;
    private final World world;
    private final BridgeHandle bridge;
    private final List<WorldSystem> systems = new CopyOnWriteArrayList<>();
    private final List<Consumer<BridgeHandle>> startupSystems = new CopyOnWriteArrayList<>();
    private final AtomicReference<State> currentState = new AtomicReference<>(State.STOPPED);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final Object tickMonitor = new Object();
    private volatile TickReport lastReport;
    private volatile boolean finished;
    private Thread hostThread;

    /**
     * @param name    name of the host, also used for its thread
     * @param world   the world to drive
     * @param options tick cadence, tick limit and bridge tuning
     */
    public WorldHost(String name, World world, BridgeOptions options) {
        this.name = name;
        this.world = world;
        this.options = options;
        this.bridge = new BridgeHandle(world, options);
    }

    /**
     * Registers work to run once on the world thread before the first tick.
     */
    public WorldHost addStartupSystem(Consumer<BridgeHandle> startup) {
        startupSystems.add(startup);
        return this;
    }

    /**
     * Registers work to run on the world thread after every tick pump.
     */
    public WorldHost addSystem(String systemName, Consumer<World> action) {
        systems.add(new WorldSystem(systemName, action));
        return this;
    }

    public void start() {
        if (hostThread != null) {
            throw new IllegalStateException(String.format("World host '%s' cannot be restarted, its bridge is closed", name));
        }
        if (!currentState.compareAndSet(State.STOPPED, State.RUNNING)) {
            throw new IllegalStateException(String.format("Cannot start world host '%s' as it is in state %s", name, getCurrentState()));
        }
        hostThread = new Thread(this::runHost, name);
        hostThread.start();
        log.info("World host '{}' started: tickInterval={}ms, maxTicks={}, systems={}", name,
                options.tickIntervalMs(), options.maxTicks(), systems.size());
    }

    private void runHost() {
        try {
            for (Consumer<BridgeHandle> startup : startupSystems) {
                startup.accept(bridge);
            }
            long intervalNanos = TimeUnit.MILLISECONDS.toNanos(options.tickIntervalMs());
            long nextTick = System.nanoTime();
            while (!stopRequested.get() && !Thread.currentThread().isInterrupted()) {
                TickReport report = bridge.tickPump();
                for (WorldSystem system : systems) {
                    runSystem(system, report.tick());
                }
                lastReport = report;
                synchronized (tickMonitor) {
                    tickMonitor.notifyAll();
                }
                if (options.maxTicks() > 0 && Long.compareUnsigned(report.tick(), options.maxTicks()) >= 0) {
                    log.info("World host '{}' reached tick limit {}", name, options.maxTicks());
                    break;
                }
                if (intervalNanos > 0) {
                    nextTick += intervalNanos;
                    long sleepNanos = nextTick - System.nanoTime();
                    if (sleepNanos > 0) {
                        TimeUnit.NANOSECONDS.sleep(sleepNanos);
                    } else {
                        // Behind schedule: do not try to catch up with a burst of ticks.
                        nextTick = System.nanoTime();
                    }
                }
            }
            currentState.compareAndSet(State.RUNNING, State.STOPPED);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("World host '{}' interrupted", name);
            currentState.compareAndSet(State.RUNNING, State.STOPPED);
        } catch (VirtualMachineError e) {
            currentState.set(State.ERROR);
            throw e;
        } catch (RuntimeException | Error e) {
            log.error("World host '{}' failed at tick {}: {}", name, Long.toUnsignedString(bridge.currentTick()), e.toString());
            log.debug("World host failure", e);
            currentState.set(State.ERROR);
        } finally {
            bridge.close();
            synchronized (tickMonitor) {
                finished = true;
                tickMonitor.notifyAll();
            }
            log.info("World host '{}' stopped at tick {}", name, Long.toUnsignedString(bridge.currentTick()));
        }
    }

    private void runSystem(WorldSystem system, long tick) {
        try {
            system.action().accept(world);
        } catch (RuntimeException e) {
            throw new IllegalStateException("System '" + system.name() + "' failed at tick "
                    + Long.toUnsignedString(tick) + ": " + e.getMessage(), e);
        }
    }

    /**
     * Requests the loop to stop and waits for the host thread to finish. Does nothing if the
     * loop already ended.
     */
    public void stop() {
        Thread thread = hostThread;
        if (thread == null) {
            return;
        }
        stopRequested.set(true);
        try {
            thread.join(Math.max(1L, TimeUnit.SECONDS.toMillis(options.shutdownTimeoutSeconds())));
            if (thread.isAlive()) {
                log.warn("World host '{}' did not stop within {}s, forcing interrupt", name, options.shutdownTimeoutSeconds());
                thread.interrupt();
                thread.join(1000);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for world host '{}' to stop", name);
        }
        if (thread.isAlive()) {
            log.error("World host '{}' thread did not stop! Forcing ERROR state.", name);
            currentState.set(State.ERROR);
        }
    }

    /**
     * Blocks until the world reached {@code tick} or the loop ended.
     *
     * @return true if the tick was reached
     */
    public boolean awaitTick(long tick, long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        synchronized (tickMonitor) {
            while (Long.compareUnsigned(bridge.currentTick(), tick) < 0) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0 || finished) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(tickMonitor, remaining);
            }
            return true;
        }
    }

    /**
     * Waits for the host thread to end on its own, e.g. after reaching the tick limit.
     *
     * @return true if the thread ended within the timeout
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        Thread thread = hostThread;
        if (thread == null) {
            return true;
        }
        thread.join(Math.max(1L, unit.toMillis(timeout)));
        return !thread.isAlive();
    }

    public State getCurrentState() {
        return currentState.get();
    }

    public BridgeHandle getBridge() {
        return bridge;
    }

    public World getWorld() {
        return world;
    }

    public String getName() {
        return name;
    }

    /**
     * @return the report of the most recent pump, or null before the first tick
     */
    public TickReport getLastReport() {
        return lastReport;
    }
}

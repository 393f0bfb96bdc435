package org.tickbridge.runtime;

import org.tickbridge.world.World;

/**
 * Call-scoped access to the world, handed to a main-thread callback.
 * <p>
 * Valid only while the callback runs. Once it returns, {@link #world()} throws, so a callback
 * that leaks the context into a background task cannot mutate the world from another thread.
 */
public final class MainThreadContext {

    private final World world;
    private final long currentTick;
    private boolean valid = true;

    MainThreadContext(World world, long currentTick) {
        this.world = world;
        this.currentTick = currentTick;
    }

    /**
     * @return the world, for exclusive use during this callback
     * @throws IllegalStateException if the callback has already returned
     */
    public World world() {
        if (!valid) {
            throw new IllegalStateException("MainThreadContext for tick " + Long.toUnsignedString(currentTick)
                    + " used after its callback returned");
        }
        return world;
    }

    /**
     * @return the tick during which this callback executes
     */
    public long currentTick() {
        return currentTick;
    }

    void invalidate() {
        valid = false;
    }
}

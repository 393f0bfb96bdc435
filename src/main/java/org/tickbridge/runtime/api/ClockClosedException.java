package org.tickbridge.runtime.api;

/**
 * Signals that the tick clock was closed while a task was waiting for ticks.
 * <p>
 * This is an early wake-up, not a completed sleep: the requested number of ticks has
 * not necessarily elapsed.
 */
public class ClockClosedException extends TickBridgeException {

    private final long lastTick;

    /**
     * @param lastTick the final tick reached before the clock closed
     */
    public ClockClosedException(long lastTick) {
        super("Tick clock closed at tick " + Long.toUnsignedString(lastTick));
        this.lastTick = lastTick;
    }

    public long getLastTick() {
        return lastTick;
    }
}

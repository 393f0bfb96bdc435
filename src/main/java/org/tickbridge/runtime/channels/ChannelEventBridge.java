package org.tickbridge.runtime.channels;

import java.util.concurrent.locks.ReentrantLock;

import org.tickbridge.runtime.api.InvariantViolationException;
import org.tickbridge.world.Events;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves values from an {@link EventChannel} into the world's {@link Events} storage for the
 * same type, once per tick.
 * <p>
 * At most one bridge exists per event type and world; registration enforces this. Only the
 * world thread calls {@link #drainStep()}. The internal lock never waits: a second concurrent
 * caller means the single-consumer contract is broken and fails with
 * {@link InvariantViolationException}.
 *
 * @param <T> the event type
 */
public class ChannelEventBridge<T> {

    private static final Logger log = LoggerFactory.getLogger(ChannelEventBridge.class);

    private final Class<T> eventType;
    private final EventChannel.Receiver<T> receiver;
    private final Events<T> events;
    private final ReentrantLock drainGuard = new ReentrantLock();
    private boolean closeReported;
    private long totalBridged;

    public ChannelEventBridge(Class<T> eventType, EventChannel.Receiver<T> receiver, Events<T> events) {
        this.eventType = eventType;
        this.receiver = receiver;
        this.events = events;
    }

    /**
     * Publishes every value currently in the channel into the event storage, in receive
     * order. Stops as soon as the channel is empty, whether or not it is closed.
     *
     * @return the number of events published
     * @throws InvariantViolationException if another thread is draining this bridge
     */
    public int drainStep() {
        if (!drainGuard.tryLock()) {
            throw new InvariantViolationException(
                    "Channel bridge for '" + eventType.getName() + "' is already being drained by another thread");
        }
        try {
            int bridged = 0;
            T value;
            while ((value = receiver.poll()) != null) {
                events.send(value);
                bridged++;
            }
            totalBridged += bridged;
            if (!closeReported && receiver.isClosed()) {
                closeReported = true;
                log.debug("Channel '{}' for {} closed after {} events", receiver.getChannelName(),
                        eventType.getSimpleName(), totalBridged);
            }
            return bridged;
        } finally {
            drainGuard.unlock();
        }
    }

    public Class<T> getEventType() {
        return eventType;
    }

    public long getTotalBridged() {
        return totalBridged;
    }
}

package org.tickbridge.runtime.channels;

import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * An unbounded multi-producer, single-consumer channel carrying values from asynchronous
 * producers towards the world.
 * <p>
 * Any number of threads may {@link #send(Object)}. The consuming side is claimed exactly once
 * through {@link #receiver()}, which transfers ownership to the claimant (normally a
 * {@link ChannelEventBridge}).
 *
 * @param <T> the value type
 */
public class EventChannel<T> {

    private final String name;
    private final ConcurrentLinkedQueue<T> queue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean receiverClaimed = new AtomicBoolean(false);
    private volatile boolean senderClosed;

    public EventChannel(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * Enqueues a value. Never blocks.
     *
     * @param value the value, never null
     * @return false if the channel was closed and the value was not accepted
     */
    public boolean send(T value) {
        if (value == null) {
            throw new NullPointerException("value cannot be null");
        }
        if (senderClosed) {
            return false;
        }
        queue.offer(value);
        return true;
    }

    /**
     * Stops accepting new values. Values already sent remain receivable.
     */
    public void close() {
        senderClosed = true;
    }

    /**
     * Claims the consuming end of this channel.
     *
     * @throws IllegalStateException if the receiver was already claimed
     */
    public Receiver<T> receiver() {
        if (!receiverClaimed.compareAndSet(false, true)) {
            throw new IllegalStateException("Receiver of channel '" + name + "' has already been claimed");
        }
        return new Receiver<>(this);
    }

    /**
     * @return approximate number of values waiting to be received
     */
    public int size() {
        return queue.size();
    }

    /**
     * The single consuming end of an {@link EventChannel}.
     *
     * @param <T> the value type
     */
    public static final class Receiver<T> {

        private final EventChannel<T> channel;

        private Receiver(EventChannel<T> channel) {
            this.channel = channel;
        }

        /**
         * Non-blocking receive.
         *
         * @return the oldest value, or null if none is available right now
         */
        public T poll() {
            return channel.queue.poll();
        }

        /**
         * Closed is reported only once the senders closed the channel and every value
         * has been received.
         */
        public boolean isClosed() {
            return channel.senderClosed && channel.queue.isEmpty();
        }

        public String getChannelName() {
            return channel.name;
        }
    }
}

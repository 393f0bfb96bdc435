package org.tickbridge.world;

import java.util.List;

/**
 * Cursor over an {@link Events} storage. Each call to {@link #read()} returns only the
 * events this reader has not seen yet.
 * <p>
 * A reader that is not polled for two or more ticks misses the events dropped in between;
 * {@link #missed()} reports how many.
 *
 * @param <T> the event type
 */
public class EventReader<T> {

    private final Events<T> events;
    private long cursor;
    private long missed;

    EventReader(Events<T> events, long cursor) {
        this.events = events;
        this.cursor = cursor;
    }

    /**
     * @return unread events, oldest first
     */
    public List<T> read() {
        long oldest = events.oldestId();
        if (cursor < oldest) {
            missed += oldest - cursor;
        }
        List<T> unread = events.readFrom(cursor);
        cursor = events.nextId();
        return unread;
    }

    /**
     * @return true if {@link #read()} would return at least one event
     */
    public boolean hasUnread() {
        return Math.max(cursor, events.oldestId()) < events.nextId();
    }

    public long missed() {
        return missed;
    }
}

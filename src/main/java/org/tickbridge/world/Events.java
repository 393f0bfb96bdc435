package org.tickbridge.world;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Double-buffered, poll-based storage for the events of one type.
 * <p>
 * Events sent during a tick stay readable during that tick and the following one.
 * {@link #update()} is called once per tick by the world and drops everything sent
 * before the previous update. Readers keep their own cursor, see {@link EventReader}.
 * <p>
 * Not thread-safe. Owned by the {@link World} and only touched from the world thread.
 *
 * @param <T> the event type
 */
public class Events<T> {

    private final Class<T> type;
    private List<T> previous = new ArrayList<>();
    private long previousStartId;
    private List<T> current = new ArrayList<>();
    private long currentStartId;
    private long nextId;

    public Events(Class<T> type) {
        this.type = type;
    }

    public Class<T> getType() {
        return type;
    }

    /**
     * Appends an event to the current buffer.
     *
     * @param event the event, never null
     */
    public void send(T event) {
        if (event == null) {
            throw new NullPointerException("event cannot be null");
        }
        current.add(event);
        nextId++;
    }

    /**
     * Rotates the buffers, dropping events that were sent before the previous update.
     */
    public void update() {
        previous = current;
        previousStartId = currentStartId;
        current = new ArrayList<>();
        currentStartId = nextId;
    }

    /**
     * @return the number of events currently readable
     */
    public int len() {
        return previous.size() + current.size();
    }

    public boolean isEmpty() {
        return len() == 0;
    }

    /**
     * Creates a reader that will see every event currently stored and all later ones.
     */
    public EventReader<T> reader() {
        return new EventReader<>(this, previousStartId);
    }

    /**
     * Creates a reader that only sees events sent after this call.
     */
    public EventReader<T> readerFromNow() {
        return new EventReader<>(this, nextId);
    }

    /**
     * Removes and returns all stored events, oldest first.
     */
    public List<T> drain() {
        List<T> all = new ArrayList<>(len());
        all.addAll(previous);
        all.addAll(current);
        previous = new ArrayList<>();
        current = new ArrayList<>();
        previousStartId = nextId;
        currentStartId = nextId;
        return all;
    }

    long nextId() {
        return nextId;
    }

    long oldestId() {
        return previousStartId;
    }

    List<T> readFrom(long cursor) {
        long from = Math.max(cursor, previousStartId);
        if (from >= nextId) {
            return Collections.emptyList();
        }
        List<T> result = new ArrayList<>((int) (nextId - from));
        if (from < currentStartId) {
            result.addAll(previous.subList((int) (from - previousStartId), previous.size()));
            result.addAll(current);
        } else {
            result.addAll(current.subList((int) (from - currentStartId), current.size()));
        }
        return result;
    }
}

package org.tickbridge.world;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.tickbridge.runtime.api.DuplicateBridgeException;

/**
 * The single-threaded owner of authoritative state: typed resources and per-type
 * {@link Events} storages.
 * <p>
 * A world is not thread-safe. Only the thread pumping ticks may touch it; background tasks
 * reach it through main-thread callbacks.
 */
public class World {

    private final Map<Class<?>, Object> resources = new LinkedHashMap<>();
    private final Map<Class<?>, Events<?>> events = new LinkedHashMap<>();
    private final Set<Class<?>> bridgedTypes = ConcurrentHashMap.newKeySet();

    /**
     * Registers event storage for a type. Registering the same type twice is a no-op.
     *
     * @return the storage for {@code type}
     */
    @SuppressWarnings("unchecked")
    public <T> Events<T> addEvent(Class<T> type) {
        return (Events<T>) events.computeIfAbsent(type, t -> new Events<>(type));
    }

    /**
     * Records that a channel bridge feeds the events of {@code type}. Only one bridge per type
     * may exist for a world, across every handle built on it.
     *
     * @throws DuplicateBridgeException if the type is already bridged
     */
    public void claimBridge(Class<?> type) {
        if (!bridgedTypes.add(type)) {
            throw new DuplicateBridgeException(type);
        }
    }

    /**
     * Gives up a claim taken with {@link #claimBridge(Class)} whose bridge was never installed.
     */
    public void releaseBridge(Class<?> type) {
        bridgedTypes.remove(type);
    }

    public boolean isBridged(Class<?> type) {
        return bridgedTypes.contains(type);
    }

    public boolean hasEvents(Class<?> type) {
        return events.containsKey(type);
    }

    /**
     * @throws IllegalStateException if no storage was registered for {@code type}
     */
    @SuppressWarnings("unchecked")
    public <T> Events<T> events(Class<T> type) {
        Events<T> storage = (Events<T>) events.get(type);
        if (storage == null) {
            throw new IllegalStateException("No event storage registered for type '" + type.getName() + "'");
        }
        return storage;
    }

    /**
     * Sends an event into the storage registered for its runtime class.
     */
    @SuppressWarnings("unchecked")
    public <T> void sendEvent(T event) {
        events((Class<T>) event.getClass()).send(event);
    }

    /**
     * Rotates the buffers of every event storage. Called once per tick.
     */
    public void updateEvents() {
        for (Events<?> storage : events.values()) {
            storage.update();
        }
    }

    /**
     * Inserts or replaces a resource.
     *
     * @return the previous resource of that type, if any
     */
    public <R> Optional<R> insertResource(Class<R> type, R resource) {
        return Optional.ofNullable(type.cast(resources.put(type, resource)));
    }

    public <R> Optional<R> getResource(Class<R> type) {
        return Optional.ofNullable(type.cast(resources.get(type)));
    }

    /**
     * @throws IllegalStateException if the resource is missing
     */
    public <R> R resource(Class<R> type) {
        return getResource(type).orElseThrow(() ->
                new IllegalStateException("Required resource '" + type.getName() + "' is not present in the world"));
    }

    public <R> Optional<R> removeResource(Class<R> type) {
        return Optional.ofNullable(type.cast(resources.remove(type)));
    }
}

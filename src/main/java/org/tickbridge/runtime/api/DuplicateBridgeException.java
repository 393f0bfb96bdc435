package org.tickbridge.runtime.api;

/**
 * Thrown when a second channel bridge is registered for an event type that already has one.
 * <p>
 * This is a setup-time programming error. There is no meaningful way to recover at runtime,
 * only one consumer may ever drain the events of a given type.
 */
public class DuplicateBridgeException extends TickBridgeException {

    private final Class<?> eventType;

    /**
     * @param eventType the event type that already has a registered bridge
     */
    public DuplicateBridgeException(Class<?> eventType) {
        super("A channel bridge for event type '" + eventType.getName() + "' is already registered");
        this.eventType = eventType;
    }

    public Class<?> getEventType() {
        return eventType;
    }
}

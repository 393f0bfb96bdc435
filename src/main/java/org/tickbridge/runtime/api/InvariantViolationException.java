package org.tickbridge.runtime.api;

/**
 * Thrown when a single-consumer contract is broken, e.g. two threads driving the same
 * drain step at once.
 * <p>
 * Indicates a bug in the caller, never a transient condition. Do not retry.
 */
public class InvariantViolationException extends TickBridgeException {

    public InvariantViolationException(String message) {
        super(message);
    }
}

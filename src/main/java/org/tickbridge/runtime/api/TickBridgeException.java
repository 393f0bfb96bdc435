package org.tickbridge.runtime.api;

/**
 * Base class of all failures raised by the tick bridge.
 * <p>
 * Unchecked: setup misuse is fatal, and runtime teardown conditions reach background tasks
 * as the exceptional completion of the futures they are waiting on.
 */
public abstract class TickBridgeException extends RuntimeException {

    protected TickBridgeException(String message) {
        super(message);
    }

    protected TickBridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}

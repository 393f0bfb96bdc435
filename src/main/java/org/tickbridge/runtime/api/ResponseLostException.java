package org.tickbridge.runtime.api;

/**
 * Thrown to a waiting task when its main-thread callback ended without delivering a result.
 * <p>
 * Happens when the callback itself threw, or when it was still queued as the world shut down.
 * The world thread keeps running in both cases.
 */
public class ResponseLostException extends TickBridgeException {

    public ResponseLostException(String message) {
        super(message);
    }

    public ResponseLostException(String message, Throwable cause) {
        super(message, cause);
    }
}

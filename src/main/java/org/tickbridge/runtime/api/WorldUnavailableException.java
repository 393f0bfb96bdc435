package org.tickbridge.runtime.api;

/**
 * Thrown when work is submitted for the world thread after the world has been torn down.
 * <p>
 * Background tasks receiving this should stop requesting main-thread work.
 */
public class WorldUnavailableException extends TickBridgeException {

    public WorldUnavailableException(String message) {
        super(message);
    }
}

package org.tickbridge.runtime;

/**
 * Outcome of one {@link BridgeHandle#tickPump()}.
 *
 * @param tick               the tick the pump advanced to
 * @param eventsBridged      events moved from channels into world event storage
 * @param callbacksExecuted  main-thread callbacks run during this pump
 * @param callbacksRemaining callbacks still queued afterwards (non-zero only with a drain limit,
 *                           or when tasks enqueued while the pump was draining)
 */
public record TickReport(long tick, int eventsBridged, int callbacksExecuted, int callbacksRemaining) {
}

package org.tickbridge.runtime;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import org.tickbridge.runtime.api.ResponseLostException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A one-shot unit of world work paired with the response slot of the task that requested it.
 * <p>
 * Executed exactly once by {@link MainThreadQueue#drainAll(java.util.function.LongFunction, long)}.
 * A closure that throws never propagates to the world thread: the waiting task receives a
 * {@link ResponseLostException} instead. If the requesting task no longer waits, the result
 * is discarded.
 *
 * @param <T> the result type
 */
public final class MainThreadCallback<T> {

    private static final Logger log = LoggerFactory.getLogger(MainThreadCallback.class);

    private final Function<MainThreadContext, T> closure;
    private final CompletableFuture<T> response;

    public MainThreadCallback(Function<MainThreadContext, T> closure, CompletableFuture<T> response) {
        this.closure = closure;
        this.response = response;
    }

    /**
     * Runs the closure on the calling (world) thread and delivers its result.
     */
    void run(MainThreadContext context) {
        T result;
        try {
            result = closure.apply(context);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable t) {
            log.warn("Main-thread callback failed at tick {}: {}", Long.toUnsignedString(context.currentTick()), t.toString());
            log.debug("Main-thread callback failure", t);
            response.completeExceptionally(new ResponseLostException("Main-thread callback failed without a result", t));
            return;
        } finally {
            context.invalidate();
        }
        if (!response.complete(result)) {
            log.debug("Discarding main-thread callback result at tick {}, requesting task is gone",
                    Long.toUnsignedString(context.currentTick()));
        }
    }

    /**
     * Fails the response slot without running the closure.
     */
    void discard(String reason) {
        response.completeExceptionally(new ResponseLostException(reason));
    }

    CompletableFuture<T> response() {
        return response;
    }
}

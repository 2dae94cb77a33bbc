package com.ryuqq.producer.core.spi;

import java.util.concurrent.CompletableFuture;

/**
 * Delay utility used between produce attempts.
 *
 * <p>Implementations must not block the calling thread: the returned future completes once the
 * delay has elapsed, and the next attempt is chained onto it. A retrying call therefore holds no
 * worker thread while it waits.</p>
 *
 * @author Producer Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Delayer {

    /**
     * Schedules a delay.
     *
     * @param millis the delay in milliseconds
     * @return future completed after the delay, or completed exceptionally if the delay
     *         cannot be scheduled (e.g. scheduler shut down)
     */
    CompletableFuture<Void> delay(long millis);
}

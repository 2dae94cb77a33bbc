package com.ryuqq.producer.testkit.support;

import com.ryuqq.producer.core.spi.Delayer;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link Delayer} that records requested delays and completes immediately.
 *
 * <p>An optional hook runs on every delay, e.g. to repair a fault between two attempts.</p>
 *
 * @author Producer Team
 * @since 1.0.0
 */
public class RecordingDelayer implements Delayer {

    private final List<Long> delays = new CopyOnWriteArrayList<>();
    private volatile Runnable hook = () -> { };

    @Override
    public CompletableFuture<Void> delay(long millis) {
        delays.add(millis);
        hook.run();
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Sets the action run on every delay.
     *
     * @param hook action
     */
    public void onDelay(Runnable hook) {
        if (hook == null) {
            throw new IllegalArgumentException("hook cannot be null");
        }
        this.hook = hook;
    }

    public List<Long> delays() {
        return List.copyOf(delays);
    }
}

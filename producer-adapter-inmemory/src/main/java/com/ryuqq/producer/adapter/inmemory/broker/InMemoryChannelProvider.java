package com.ryuqq.producer.adapter.inmemory.broker;

import com.ryuqq.producer.core.exception.BrokerException;
import com.ryuqq.producer.core.spi.ChannelProvider;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of {@link ChannelProvider}.
 *
 * <p>Hands out the current channel and opens a new one once it has been closed, mirroring a
 * connection manager that reconnects lazily.</p>
 *
 * @author Producer Team
 * @since 1.0.0
 */
public class InMemoryChannelProvider implements ChannelProvider {

    private final InMemoryBroker broker;
    private final AtomicInteger acquisitionFailures = new AtomicInteger();
    private final AtomicInteger channelsOpened = new AtomicInteger();
    private InMemoryChannel current;

    public InMemoryChannelProvider(InMemoryBroker broker) {
        if (broker == null) {
            throw new IllegalArgumentException("broker cannot be null");
        }
        this.broker = broker;
    }

    /**
     * {@inheritDoc}
     *
     * @throws BrokerException while injected acquisition failures remain
     */
    @Override
    public synchronized InMemoryChannel get() {
        if (acquisitionFailures.get() > 0) {
            acquisitionFailures.decrementAndGet();
            throw new BrokerException("Injected acquisition failure: connection refused");
        }
        if (current == null || !current.isOpen()) {
            current = broker.newChannel();
            channelsOpened.incrementAndGet();
        }
        return current;
    }

    /**
     * The channel handed out last, or {@code null} before the first {@link #get()}.
     */
    public synchronized InMemoryChannel current() {
        return current;
    }

    /**
     * Makes the next N calls to {@link #get()} fail.
     *
     * @param count number of failures
     */
    public void failNextAcquisitions(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative, but was: " + count);
        }
        acquisitionFailures.set(count);
    }

    public int channelsOpened() {
        return channelsOpened.get();
    }
}

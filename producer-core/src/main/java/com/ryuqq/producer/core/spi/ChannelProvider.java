package com.ryuqq.producer.core.spi;

/**
 * Connection manager SPI.
 *
 * <p>Hands out a ready {@link BrokerChannel}, reconnecting internally when the previous one
 * dropped. Reconnection policy belongs to the implementation; the producer only calls
 * {@link #get()} at the start of every attempt and reacts to channel close events.</p>
 *
 * @author Producer Team
 * @since 1.0.0
 */
public interface ChannelProvider {

    /**
     * Returns the current open channel, blocking while a new one is established.
     *
     * @return an open channel
     * @throws com.ryuqq.producer.core.exception.BrokerException if no channel can be obtained right now
     */
    BrokerChannel get();
}

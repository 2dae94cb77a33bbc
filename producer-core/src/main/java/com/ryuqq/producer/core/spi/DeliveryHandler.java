package com.ryuqq.producer.core.spi;

import com.ryuqq.producer.core.contract.InboundMessage;

/**
 * Callback for messages delivered by a consumer started with
 * {@link BrokerChannel#consume(String, boolean, DeliveryHandler)}.
 *
 * <p>Invoked on a broker thread. Implementations must not throw.</p>
 *
 * @author Producer Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface DeliveryHandler {

    void handle(InboundMessage message);
}

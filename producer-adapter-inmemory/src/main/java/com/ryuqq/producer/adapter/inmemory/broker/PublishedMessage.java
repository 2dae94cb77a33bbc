package com.ryuqq.producer.adapter.inmemory.broker;

import com.ryuqq.producer.core.contract.OutboundMessage;

/**
 * Journal entry of a publish accepted by {@link InMemoryBroker}.
 *
 * @param exchange exchange name ({@code ""} for the default exchange)
 * @param routingKey routing key (the queue name for direct sends)
 * @param queue queue the message was routed to, {@code null} when unroutable
 * @param message message as published
 *
 * @author Producer Team
 * @since 1.0.0
 */
public record PublishedMessage(
    String exchange,
    String routingKey,
    String queue,
    OutboundMessage message
) {

    public String correlationId() {
        return message.properties().correlationId();
    }

    public String replyTo() {
        return message.properties().replyTo();
    }
}

/**
 * Message contracts exchanged between the producer, the codec and the broker channel.
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.producer.core.contract.ProduceRequest} - Immutable request reused by every retry attempt</li>
 *   <li>{@link com.ryuqq.producer.core.contract.ProduceOptions} - Caller options (rpc, routingKey, persistent, durable, ...)</li>
 *   <li>{@link com.ryuqq.producer.core.contract.OutboundMessage} - Encoded body plus properties</li>
 *   <li>{@link com.ryuqq.producer.core.contract.InboundMessage} - Reply delivered by the broker</li>
 *   <li>{@link com.ryuqq.producer.core.contract.MessageProperties} - correlationId, replyTo, content type, persistence</li>
 *   <li>{@link com.ryuqq.producer.core.contract.QueueOptions} - Queue declaration flags</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Producer Team
 */
package com.ryuqq.producer.core.contract;

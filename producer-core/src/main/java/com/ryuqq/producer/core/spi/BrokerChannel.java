package com.ryuqq.producer.core.spi;

import com.ryuqq.producer.core.contract.OutboundMessage;
import com.ryuqq.producer.core.contract.QueueOptions;

/**
 * Broker channel SPI: the logical handle over which publish and consume operations run.
 *
 * <p>A channel may be invalidated at any time (network drop, broker-side channel error).
 * Once closed it never reopens; the {@link ChannelProvider} hands out a replacement instead.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Declaring queues (the RPC reply queue is durable and exclusive)</li>
 *   <li>Starting consumers that receive deliveries on broker threads</li>
 *   <li>Sending directly to a queue, or publishing to an exchange with a routing key</li>
 *   <li>Notifying close listeners exactly once when the channel drops</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: publish may be called from several producer threads</li>
 *   <li>Failures: every broker or I/O failure is thrown as
 *       {@link com.ryuqq.producer.core.exception.BrokerException}</li>
 *   <li>Close listeners registered after the channel closed fire immediately</li>
 * </ul>
 *
 * @author Producer Team
 * @since 1.0.0
 */
public interface BrokerChannel {

    /**
     * Declares (asserts) a queue.
     *
     * @param queueName the queue name
     * @param options declaration flags
     * @return the queue name as reported by the broker
     * @throws IllegalArgumentException if queueName is blank or options is null
     * @throws com.ryuqq.producer.core.exception.BrokerException if the declaration fails
     */
    String declareQueue(String queueName, QueueOptions options);

    /**
     * Starts a continuous consumer on a queue.
     *
     * @param queueName the queue to consume
     * @param noAck {@code true} for automatic acknowledgement at the broker
     * @param handler callback invoked for every delivery
     * @return the consumer tag
     * @throws com.ryuqq.producer.core.exception.BrokerException if the consumer cannot be started
     */
    String consume(String queueName, boolean noAck, DeliveryHandler handler);

    /**
     * Sends a message directly to a queue (default exchange).
     *
     * @param queueName the target queue
     * @param message the encoded message
     * @return {@code true} if the channel accepted the message
     * @throws com.ryuqq.producer.core.exception.BrokerException if the send fails
     */
    boolean sendToQueue(String queueName, OutboundMessage message);

    /**
     * Publishes a message to an exchange with a routing key.
     *
     * @param exchange the exchange name
     * @param routingKey the routing key
     * @param message the encoded message
     * @return {@code true} if the channel accepted the message
     * @throws com.ryuqq.producer.core.exception.BrokerException if the publish fails
     */
    boolean publish(String exchange, String routingKey, OutboundMessage message);

    /**
     * Registers a listener notified once when this channel closes.
     *
     * @param listener the close listener
     * @throws IllegalArgumentException if listener is null
     */
    void addCloseListener(Runnable listener);

    /**
     * Returns whether the channel is still usable.
     *
     * @return {@code true} while open
     */
    boolean isOpen();
}

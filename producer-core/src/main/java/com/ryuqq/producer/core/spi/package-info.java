/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the collaborators the producer runtime depends on. Adapter modules
 * (producer-adapter-inmemory, producer-adapter-rabbitmq, producer-codec-jackson) provide the
 * concrete implementations.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.producer.core.spi.ChannelProvider} - Connection manager handing out ready channels</li>
 *   <li>{@link com.ryuqq.producer.core.spi.BrokerChannel} - Declare, consume, send, publish, close notification</li>
 *   <li>{@link com.ryuqq.producer.core.spi.MessageCodec} - Payload encoding and content-type negotiation</li>
 *   <li>{@link com.ryuqq.producer.core.spi.ProducerTransport} - Traffic and failure logging sink</li>
 *   <li>{@link com.ryuqq.producer.core.spi.Delayer} - Delay between retry attempts</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on any broker client</li>
 *   <li><strong>Pluggability:</strong> In-memory broker for tests, RabbitMQ for production</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Producer Team
 */
package com.ryuqq.producer.core.spi;

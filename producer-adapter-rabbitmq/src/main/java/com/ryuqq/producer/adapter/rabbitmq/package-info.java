/**
 * RabbitMQ adapter.
 *
 * <p>Implements the channel SPIs on top of the RabbitMQ Java client ({@code com.rabbitmq:amqp-client})
 * and wires a ready-to-use producer.</p>
 *
 * <h2>Classes</h2>
 * <ul>
 *   <li>{@link com.ryuqq.producer.adapter.rabbitmq.RabbitBrokerChannel} - {@code BrokerChannel} over a client {@code Channel}</li>
 *   <li>{@link com.ryuqq.producer.adapter.rabbitmq.RabbitChannelProvider} - lazy connection / channel manager</li>
 *   <li>{@link com.ryuqq.producer.adapter.rabbitmq.RabbitConnectionConfig} - connection settings</li>
 *   <li>{@link com.ryuqq.producer.adapter.rabbitmq.RabbitProducerFactory} - Rabbit + Jackson + SLF4J wiring</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Producer Team
 */
package com.ryuqq.producer.adapter.rabbitmq;

/**
 * In-memory broker adapter.
 *
 * <p>A reference implementation of the channel SPIs used by unit and contract tests. It needs no
 * running broker and exposes fault injection hooks for closed channels, failed sends and failed
 * acquisitions.</p>
 *
 * <h2>Classes</h2>
 * <ul>
 *   <li>{@link com.ryuqq.producer.adapter.inmemory.broker.InMemoryBroker} - queues, direct exchanges, dispatcher</li>
 *   <li>{@link com.ryuqq.producer.adapter.inmemory.broker.InMemoryChannel} - {@code BrokerChannel} with fault injection</li>
 *   <li>{@link com.ryuqq.producer.adapter.inmemory.broker.InMemoryChannelProvider} - reopens closed channels on demand</li>
 *   <li>{@link com.ryuqq.producer.adapter.inmemory.broker.PublishedMessage} - publish journal entry</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Producer Team
 */
package com.ryuqq.producer.adapter.inmemory.broker;

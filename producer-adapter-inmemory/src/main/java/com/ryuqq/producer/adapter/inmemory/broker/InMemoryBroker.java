package com.ryuqq.producer.adapter.inmemory.broker;

import com.ryuqq.producer.core.contract.InboundMessage;
import com.ryuqq.producer.core.contract.OutboundMessage;
import com.ryuqq.producer.core.contract.QueueOptions;
import com.ryuqq.producer.core.exception.BrokerException;
import com.ryuqq.producer.core.spi.DeliveryHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory AMQP-like broker for testing and reference purposes.
 *
 * <p>Models the subset of broker behavior the producer relies on:</p>
 * <ul>
 *   <li><strong>Queues:</strong> named, optionally exclusive to the declaring channel</li>
 *   <li><strong>Direct exchanges:</strong> route by exact routing key to bound queues</li>
 *   <li><strong>Default exchange:</strong> {@code ""} routes to the queue named by the routing key</li>
 *   <li><strong>Consumers:</strong> no-ack push delivery, round-robin across consumers of a queue</li>
 * </ul>
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>State:</strong> guarded by the broker monitor, every operation is short and non-blocking</li>
 *   <li><strong>Delivery:</strong> a single dispatcher thread invokes consumer handlers, like a client
 *       library's consumer work pool. Handlers therefore never run on the publishing thread.</li>
 *   <li><strong>Journal:</strong> every accepted publish is recorded for assertions</li>
 * </ul>
 *
 * <p><strong>Failure semantics:</strong></p>
 * <ul>
 *   <li>Declaring an exclusive queue owned by another open channel fails with {@code RESOURCE_LOCKED}</li>
 *   <li>Consuming from a missing queue fails with {@code NOT_FOUND}</li>
 *   <li>Publishing to a missing exchange fails with {@code NOT_FOUND} and closes the channel</li>
 *   <li>Sending to a missing queue is accepted and the message is dropped (unroutable)</li>
 *   <li>Closing a channel deletes its exclusive queues and cancels its consumers</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * try (InMemoryBroker broker = new InMemoryBroker()) {
 *     InMemoryChannelProvider provider = new InMemoryChannelProvider(broker);
 *     broker.declareQueue("hello-world");
 *
 *     ResilientProducer producer = new ResilientProducer(provider, codec, config);
 *     producer.produce("hello-world", Map.of("msg", "hi")).join();
 *
 *     broker.published("hello-world"); // one message
 * }
 * </pre>
 *
 * @author Producer Team
 * @since 1.0.0
 */
public class InMemoryBroker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBroker.class);

    /**
     * Name of the default exchange.
     */
    public static final String DEFAULT_EXCHANGE = "";

    private final Map<String, QueueState> queues = new HashMap<>();
    private final Map<String, Map<String, Set<String>>> exchanges = new HashMap<>();
    private final Map<String, AtomicInteger> declareCounts = new HashMap<>();
    private final List<PublishedMessage> journal = new CopyOnWriteArrayList<>();
    private final AtomicInteger channelSequence = new AtomicInteger();
    private final AtomicInteger consumerSequence = new AtomicInteger();
    private final ExecutorService dispatcher;

    public InMemoryBroker() {
        this.dispatcher = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "in-memory-broker-dispatcher");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Opens a new channel on this broker.
     *
     * @return open channel
     */
    public InMemoryChannel newChannel() {
        return new InMemoryChannel(this, channelSequence.incrementAndGet());
    }

    /**
     * Declares a shared durable queue outside of any channel (test setup).
     *
     * @param name queue name
     */
    public void declareQueue(String name) {
        declareQueue(null, name, QueueOptions.durableQueue());
    }

    /**
     * Declares a direct exchange (idempotent).
     *
     * @param name exchange name
     * @throws IllegalArgumentException if name is null or blank
     */
    public synchronized void declareExchange(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("exchange name cannot be null or blank");
        }
        exchanges.computeIfAbsent(name, key -> new HashMap<>());
    }

    /**
     * Binds a queue to an exchange with a routing key.
     *
     * @param queue queue name
     * @param exchange exchange name
     * @param routingKey routing key
     * @throws BrokerException if the queue or the exchange does not exist
     */
    public synchronized void bindQueue(String queue, String exchange, String routingKey) {
        if (!queues.containsKey(queue)) {
            throw new BrokerException("NOT_FOUND - no queue '" + queue + "'");
        }
        Map<String, Set<String>> bindings = exchanges.get(exchange);
        if (bindings == null) {
            throw new BrokerException("NOT_FOUND - no exchange '" + exchange + "'");
        }
        bindings.computeIfAbsent(routingKey, key -> new LinkedHashSet<>()).add(queue);
    }

    // ============================================================
    // Channel operations
    // ============================================================

    synchronized String declareQueue(InMemoryChannel owner, String name, QueueOptions options) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("queue name cannot be null or blank");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }

        QueueState existing = queues.get(name);
        if (existing != null) {
            if (existing.owner != null && existing.owner != owner) {
                throw new BrokerException(
                    "RESOURCE_LOCKED - cannot obtain exclusive access to locked queue '" + name + "'");
            }
        } else {
            queues.put(name, new QueueState(name, options.exclusive() ? owner : null));
        }

        declareCounts.computeIfAbsent(name, key -> new AtomicInteger()).incrementAndGet();
        return name;
    }

    synchronized String consume(InMemoryChannel owner, String queue, DeliveryHandler handler) {
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        QueueState state = queues.get(queue);
        if (state == null) {
            throw new BrokerException("NOT_FOUND - no queue '" + queue + "'");
        }

        String consumerTag = "ctag-" + consumerSequence.incrementAndGet();
        state.consumers.add(new ConsumerRegistration(consumerTag, owner, handler));
        while (!state.backlog.isEmpty()) {
            deliver(state, state.backlog.poll());
        }
        return consumerTag;
    }

    synchronized boolean sendToQueue(String queue, OutboundMessage message) {
        journal.add(new PublishedMessage(DEFAULT_EXCHANGE, queue, queue, message));
        route(queue, message);
        return true;
    }

    synchronized boolean publish(String exchange, String routingKey, OutboundMessage message) {
        if (DEFAULT_EXCHANGE.equals(exchange)) {
            return sendToQueue(routingKey, message);
        }

        Map<String, Set<String>> bindings = exchanges.get(exchange);
        if (bindings == null) {
            throw new BrokerException("NOT_FOUND - no exchange '" + exchange + "'");
        }

        Set<String> targets = bindings.getOrDefault(routingKey, Set.of());
        if (targets.isEmpty()) {
            journal.add(new PublishedMessage(exchange, routingKey, null, message));
            log.debug("Unroutable message on exchange {} with routing key {}", exchange, routingKey);
            return true;
        }
        for (String queue : targets) {
            journal.add(new PublishedMessage(exchange, routingKey, queue, message));
            route(queue, message);
        }
        return true;
    }

    synchronized void channelClosed(InMemoryChannel channel) {
        List<String> deleted = new ArrayList<>();
        for (QueueState state : queues.values()) {
            state.consumers.removeIf(consumer -> consumer.owner == channel);
            if (state.owner == channel) {
                deleted.add(state.name);
            }
        }
        for (String name : deleted) {
            queues.remove(name);
            exchanges.values().forEach(bindings -> bindings.values().forEach(targets -> targets.remove(name)));
        }
        if (!deleted.isEmpty()) {
            log.debug("Channel {} closed, deleted exclusive queues {}", channel.getId(), deleted);
        }
    }

    private void route(String queue, OutboundMessage message) {
        QueueState state = queues.get(queue);
        if (state == null) {
            log.warn("Dropping message for missing queue {}", queue);
            return;
        }
        if (state.consumers.isEmpty()) {
            state.backlog.add(message);
            return;
        }
        deliver(state, message);
    }

    private void deliver(QueueState state, OutboundMessage message) {
        ConsumerRegistration consumer = state.consumers.get(Math.floorMod(state.nextConsumer++, state.consumers.size()));
        InboundMessage inbound = new InboundMessage(message.body().clone(), message.properties());
        dispatcher.execute(() -> {
            try {
                consumer.handler.handle(inbound);
            } catch (RuntimeException e) {
                log.error("Consumer {} on queue {} threw while handling a delivery", consumer.tag, state.name, e);
            }
        });
    }

    // ============================================================
    // Inspection (tests)
    // ============================================================

    /**
     * How many times a queue has been declared, including redeclarations of an existing queue.
     *
     * @param queue queue name
     * @return declaration count
     */
    public synchronized int declareCount(String queue) {
        AtomicInteger count = declareCounts.get(queue);
        return count == null ? 0 : count.get();
    }

    public synchronized boolean queueExists(String queue) {
        return queues.containsKey(queue);
    }

    /**
     * Messages waiting in a queue because it has no consumer.
     *
     * @param queue queue name
     * @return backlog size (0 when the queue does not exist)
     */
    public synchronized int backlogSize(String queue) {
        QueueState state = queues.get(queue);
        return state == null ? 0 : state.backlog.size();
    }

    public synchronized int consumerCount(String queue) {
        QueueState state = queues.get(queue);
        return state == null ? 0 : state.consumers.size();
    }

    /**
     * Every accepted publish in order.
     *
     * @return snapshot of the journal
     */
    public List<PublishedMessage> published() {
        return List.copyOf(journal);
    }

    /**
     * Accepted publishes that targeted a queue.
     *
     * @param queue queue name
     * @return matching journal entries in order
     */
    public List<PublishedMessage> published(String queue) {
        return journal.stream()
            .filter(entry -> queue.equals(entry.queue()))
            .toList();
    }

    /**
     * Waits until every delivery scheduled so far has been handed to its consumer.
     *
     * @param timeoutMs maximum wait
     * @return true if the dispatcher drained in time
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitDeliveries(long timeoutMs) throws InterruptedException {
        CountDownLatch drained = new CountDownLatch(1);
        dispatcher.execute(drained::countDown);
        return drained.await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Stops the dispatcher. Deliveries not yet handed to consumers are discarded.
     */
    @Override
    public void close() {
        dispatcher.shutdownNow();
    }

    private static final class QueueState {
        private final String name;
        private final InMemoryChannel owner;
        private final List<ConsumerRegistration> consumers = new ArrayList<>();
        private final Deque<OutboundMessage> backlog = new ArrayDeque<>();
        private int nextConsumer;

        private QueueState(String name, InMemoryChannel owner) {
            this.name = name;
            this.owner = owner;
        }
    }

    private record ConsumerRegistration(String tag, InMemoryChannel owner, DeliveryHandler handler) {
    }
}

package com.ryuqq.producer.adapter.inmemory.broker;

import com.ryuqq.producer.core.contract.OutboundMessage;
import com.ryuqq.producer.core.contract.QueueOptions;
import com.ryuqq.producer.core.exception.BrokerException;
import com.ryuqq.producer.core.spi.BrokerChannel;
import com.ryuqq.producer.core.spi.DeliveryHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of {@link BrokerChannel}.
 *
 * <p>Every operation on a closed channel fails with {@link BrokerException}. A channel-level error
 * (publishing to a missing exchange) closes the channel, as an AMQP broker would.</p>
 *
 * <p><strong>Fault injection:</strong></p>
 * <ul>
 *   <li>{@link #failNextSends(int)}: the next N sends/publishes fail without reaching the broker</li>
 *   <li>{@link #failNextDeclares(int)}: the next N queue declarations fail</li>
 *   <li>{@link #close()}: simulates a connection drop, firing every close listener</li>
 * </ul>
 *
 * @author Producer Team
 * @since 1.0.0
 */
public class InMemoryChannel implements BrokerChannel {

    private static final Logger log = LoggerFactory.getLogger(InMemoryChannel.class);

    private final InMemoryBroker broker;
    private final int id;
    private final AtomicBoolean open = new AtomicBoolean(true);
    private final List<Runnable> closeListeners = new CopyOnWriteArrayList<>();
    private final AtomicInteger sendFailures = new AtomicInteger();
    private final AtomicInteger declareFailures = new AtomicInteger();

    InMemoryChannel(InMemoryBroker broker, int id) {
        this.broker = broker;
        this.id = id;
    }

    @Override
    public String declareQueue(String queueName, QueueOptions options) {
        ensureOpen();
        if (takeOne(declareFailures)) {
            throw new BrokerException("Injected declare failure on channel " + id);
        }
        return broker.declareQueue(this, queueName, options);
    }

    @Override
    public String consume(String queueName, boolean noAck, DeliveryHandler handler) {
        ensureOpen();
        if (!noAck) {
            throw new UnsupportedOperationException("in-memory broker only supports noAck consumers");
        }
        return broker.consume(this, queueName, handler);
    }

    @Override
    public boolean sendToQueue(String queueName, OutboundMessage message) {
        ensureSendable(message);
        return broker.sendToQueue(queueName, message);
    }

    @Override
    public boolean publish(String exchange, String routingKey, OutboundMessage message) {
        ensureSendable(message);
        try {
            return broker.publish(exchange, routingKey, message);
        } catch (BrokerException e) {
            close();
            throw e;
        }
    }

    /**
     * Registers a close listener. If the channel is already closed the listener runs immediately.
     */
    @Override
    public void addCloseListener(Runnable listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        closeListeners.add(listener);
        if (!open.get() && closeListeners.remove(listener)) {
            listener.run();
        }
    }

    @Override
    public boolean isOpen() {
        return open.get();
    }

    /**
     * Closes the channel: exclusive queues and consumers are dropped, then close listeners run
     * on the calling thread. Idempotent.
     */
    public void close() {
        if (!open.compareAndSet(true, false)) {
            return;
        }
        broker.channelClosed(this);
        for (Runnable listener : closeListeners) {
            if (closeListeners.remove(listener)) {
                runListener(listener);
            }
        }
    }

    public void failNextSends(int count) {
        sendFailures.set(requireNonNegative(count));
    }

    public void failNextDeclares(int count) {
        declareFailures.set(requireNonNegative(count));
    }

    public int getId() {
        return id;
    }

    private void ensureOpen() {
        if (!open.get()) {
            throw new BrokerException("Channel " + id + " is closed");
        }
    }

    private void ensureSendable(OutboundMessage message) {
        ensureOpen();
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (takeOne(sendFailures)) {
            throw new BrokerException("Injected send failure on channel " + id);
        }
    }

    private void runListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.error("Close listener failed on channel {}", id, e);
        }
    }

    private static boolean takeOne(AtomicInteger budget) {
        return budget.getAndUpdate(remaining -> remaining > 0 ? remaining - 1 : 0) > 0;
    }

    private static int requireNonNegative(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative, but was: " + count);
        }
        return count;
    }

    @Override
    public String toString() {
        return "InMemoryChannel{" + id + (open.get() ? "" : ", closed") + '}';
    }
}

package com.ryuqq.producer.adapter.rabbitmq;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.CancelCallback;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DeliverCallback;
import com.rabbitmq.client.ShutdownSignalException;
import com.ryuqq.producer.core.contract.InboundMessage;
import com.ryuqq.producer.core.contract.MessageProperties;
import com.ryuqq.producer.core.contract.OutboundMessage;
import com.ryuqq.producer.core.contract.QueueOptions;
import com.ryuqq.producer.core.exception.BrokerException;
import com.ryuqq.producer.core.spi.BrokerChannel;
import com.ryuqq.producer.core.spi.DeliveryHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * RabbitMQ Java client 기반 {@link BrokerChannel} 구현체.
 *
 * <p><strong>매핑:</strong></p>
 * <ul>
 *   <li>declareQueue → {@code queueDeclare(name, durable, exclusive, autoDelete, null)}</li>
 *   <li>consume → {@code basicConsume(queue, noAck, DeliverCallback, CancelCallback)}</li>
 *   <li>sendToQueue → 기본 exchange({@code ""})로 {@code basicPublish}</li>
 *   <li>publish → {@code basicPublish(exchange, routingKey, ...)}</li>
 *   <li>addCloseListener → {@code addShutdownListener} (이미 닫힌 채널이면 클라이언트가 즉시 호출)</li>
 * </ul>
 *
 * <p>{@link IOException}과 닫힌 채널에서 발생하는 {@link ShutdownSignalException}은
 * {@link BrokerException}으로 감싸서 던집니다.</p>
 *
 * <p><strong>스레드 안전성:</strong> 하나의 채널을 여러 워커 스레드가 공유합니다. 클라이언트 {@link Channel}은
 * 동시 publish를 지원하지 않으므로 {@link #publish}는 인스턴스 단위로 직렬화됩니다.
 * 배달 콜백은 클라이언트 consumer 스레드에서 실행되며, null 헤더 값(AMQP void)도 그대로 전달됩니다.</p>
 *
 * <p>Java 클라이언트의 {@code basicPublish}는 흐름 제어 신호를 반환하지 않으므로
 * 전송 메서드는 예외가 없으면 항상 true를 반환합니다.</p>
 *
 * @author Producer Team
 * @since 1.0.0
 */
public final class RabbitBrokerChannel implements BrokerChannel {

    private static final Logger log = LoggerFactory.getLogger(RabbitBrokerChannel.class);

    private static final String DEFAULT_EXCHANGE = "";
    private static final int DELIVERY_MODE_TRANSIENT = 1;
    private static final int DELIVERY_MODE_PERSISTENT = 2;

    private final Channel channel;

    public RabbitBrokerChannel(Channel channel) {
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        this.channel = channel;
    }

    @Override
    public String declareQueue(String queueName, QueueOptions options) {
        try {
            AMQP.Queue.DeclareOk ok = channel.queueDeclare(
                queueName, options.durable(), options.exclusive(), options.autoDelete(), null);
            return ok.getQueue();
        } catch (IOException | ShutdownSignalException e) {
            throw new BrokerException("Failed to declare queue " + queueName, e);
        }
    }

    @Override
    public String consume(String queueName, boolean noAck, DeliveryHandler handler) {
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        DeliverCallback onDelivery = (consumerTag, delivery) ->
            handler.handle(new InboundMessage(delivery.getBody(), fromBasicProperties(delivery.getProperties())));
        CancelCallback onCancel = consumerTag ->
            log.warn("Consumer {} on queue {} was cancelled by the broker", consumerTag, queueName);

        try {
            return channel.basicConsume(queueName, noAck, onDelivery, onCancel);
        } catch (IOException | ShutdownSignalException e) {
            throw new BrokerException("Failed to consume from queue " + queueName, e);
        }
    }

    @Override
    public boolean sendToQueue(String queueName, OutboundMessage message) {
        return publish(DEFAULT_EXCHANGE, queueName, message);
    }

    @Override
    public synchronized boolean publish(String exchange, String routingKey, OutboundMessage message) {
        try {
            channel.basicPublish(exchange, routingKey, toBasicProperties(message.properties()), message.body());
            return true;
        } catch (IOException | ShutdownSignalException e) {
            throw new BrokerException("Failed to publish to exchange '" + exchange + "' with routing key " + routingKey, e);
        }
    }

    @Override
    public void addCloseListener(Runnable listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        channel.addShutdownListener(cause -> listener.run());
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen();
    }

    /**
     * 래핑한 클라이언트 채널 번호.
     */
    public int getChannelNumber() {
        return channel.getChannelNumber();
    }

    static AMQP.BasicProperties toBasicProperties(MessageProperties properties) {
        return new AMQP.BasicProperties.Builder()
            .contentType(properties.contentType())
            .contentEncoding(properties.contentEncoding())
            .deliveryMode(properties.persistent() ? DELIVERY_MODE_PERSISTENT : DELIVERY_MODE_TRANSIENT)
            .correlationId(properties.correlationId())
            .replyTo(properties.replyTo())
            .headers(properties.headers().isEmpty() ? null : properties.headers())
            .build();
    }

    static MessageProperties fromBasicProperties(AMQP.BasicProperties properties) {
        if (properties == null) {
            return MessageProperties.ofContentType(null);
        }
        Integer deliveryMode = properties.getDeliveryMode();
        return new MessageProperties(
            properties.getContentType(),
            properties.getContentEncoding(),
            deliveryMode != null && deliveryMode == DELIVERY_MODE_PERSISTENT,
            properties.getCorrelationId(),
            properties.getReplyTo(),
            properties.getHeaders()
        );
    }

    @Override
    public String toString() {
        return "RabbitBrokerChannel{" + channel.getChannelNumber() + '}';
    }
}

package com.ryuqq.producer.adapter.rabbitmq;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.ryuqq.producer.core.exception.BrokerException;
import com.ryuqq.producer.core.spi.ChannelProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URISyntaxException;
import java.security.GeneralSecurityException;
import java.util.concurrent.TimeoutException;

/**
 * RabbitMQ 연결 / 채널 관리자.
 *
 * <p>연결과 채널을 처음 요청될 때 열고, 닫혀 있으면 다음 {@link #get()}에서 새로 엽니다.
 * 클라이언트의 자동 복구는 끄고, 복구 시점은 producer의 재시도 루프가 결정합니다.</p>
 *
 * <pre>
 * get()
 *   ├─ connection 없음/닫힘 → factory.newConnection(connectionName)
 *   ├─ channel 없음/닫힘   → connection.createChannel()
 *   └─ 현재 채널 반환
 * </pre>
 *
 * @author Producer Team
 * @since 1.0.0
 */
public final class RabbitChannelProvider implements ChannelProvider, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RabbitChannelProvider.class);

    private final ConnectionFactory connectionFactory;
    private final RabbitConnectionConfig config;

    private Connection connection;
    private RabbitBrokerChannel channel;

    /**
     * 생성자.
     *
     * @param config 연결 설정
     */
    public RabbitChannelProvider(RabbitConnectionConfig config) {
        this(new ConnectionFactory(), config);
    }

    /**
     * 생성자 (ConnectionFactory 주입).
     *
     * @param connectionFactory RabbitMQ connection factory (설정이 덮어써짐)
     * @param config 연결 설정
     * @throws IllegalArgumentException 인자가 null이거나 URI가 올바르지 않은 경우
     */
    public RabbitChannelProvider(ConnectionFactory connectionFactory, RabbitConnectionConfig config) {
        if (connectionFactory == null) {
            throw new IllegalArgumentException("connectionFactory cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        try {
            connectionFactory.setUri(config.uri());
        } catch (URISyntaxException | GeneralSecurityException e) {
            throw new IllegalArgumentException("Invalid AMQP uri: " + config.uri(), e);
        }
        connectionFactory.setRequestedHeartbeat(config.requestedHeartbeatSeconds());
        connectionFactory.setConnectionTimeout(config.connectionTimeoutMs());
        connectionFactory.setAutomaticRecoveryEnabled(false);

        this.connectionFactory = connectionFactory;
        this.config = config;
    }

    /**
     * {@inheritDoc}
     *
     * @throws BrokerException 연결 또는 채널을 열지 못한 경우
     */
    @Override
    public synchronized RabbitBrokerChannel get() {
        if (channel != null && channel.isOpen()) {
            return channel;
        }
        try {
            if (connection == null || !connection.isOpen()) {
                connection = connectionFactory.newConnection(config.connectionName());
                log.info("Opened RabbitMQ connection {} to {}:{}",
                    config.connectionName(), connectionFactory.getHost(), connectionFactory.getPort());
            }
            Channel created = connection.createChannel();
            if (created == null) {
                throw new BrokerException("No channel number available on connection " + config.connectionName());
            }
            channel = new RabbitBrokerChannel(created);
            log.info("Opened RabbitMQ channel {}", created.getChannelNumber());
            return channel;
        } catch (IOException | TimeoutException e) {
            throw new BrokerException("Failed to open RabbitMQ channel: " + e.getMessage(), e);
        }
    }

    /**
     * 연결 종료 (열려 있는 경우).
     *
     * @throws BrokerException 연결 종료 중 I/O 오류
     */
    @Override
    public synchronized void close() {
        channel = null;
        if (connection == null || !connection.isOpen()) {
            return;
        }
        try {
            connection.close();
            log.info("Closed RabbitMQ connection {}", config.connectionName());
        } catch (IOException e) {
            throw new BrokerException("Failed to close RabbitMQ connection " + config.connectionName(), e);
        } finally {
            connection = null;
        }
    }

    public RabbitConnectionConfig getConfig() {
        return config;
    }
}

package com.ryuqq.producer.adapter.rabbitmq;

import com.ryuqq.producer.codec.jackson.JacksonMessageCodec;
import com.ryuqq.producer.core.config.ProducerConfig;
import com.ryuqq.producer.core.spi.MessageCodec;
import com.ryuqq.producer.runtime.producer.ResilientProducer;

/**
 * RabbitMQ + Jackson + SLF4J 조합으로 {@link ResilientProducer}를 구성하는 팩토리.
 *
 * <p>연결 하나에 producer 하나. 같은 hostname의 producer가 한 연결을 공유하면
 * 하나의 응답 큐에 consumer가 둘 붙습니다.</p>
 *
 * <pre>
 * try (RabbitProducerFactory factory = new RabbitProducerFactory(new RabbitConnectionConfig(), new ProducerConfig())) {
 *     Producer producer = factory.getProducer();
 *     producer.produce("service-x", Map.of("op", "ping"), ProduceOptions.rpcDefaults());
 * }
 * </pre>
 *
 * @author Producer Team
 * @since 1.0.0
 */
public final class RabbitProducerFactory implements AutoCloseable {

    private final RabbitChannelProvider channelProvider;
    private final MessageCodec codec;
    private final ProducerConfig producerConfig;

    private ResilientProducer producer;
    private boolean closed;

    public RabbitProducerFactory(RabbitConnectionConfig connectionConfig, ProducerConfig producerConfig) {
        this(new RabbitChannelProvider(connectionConfig), new JacksonMessageCodec(), producerConfig);
    }

    /**
     * 생성자 (구성 요소 주입).
     *
     * @param channelProvider 연결 관리자
     * @param codec 메시지 codec
     * @param producerConfig producer 설정
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public RabbitProducerFactory(RabbitChannelProvider channelProvider, MessageCodec codec, ProducerConfig producerConfig) {
        if (channelProvider == null) {
            throw new IllegalArgumentException("channelProvider cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (producerConfig == null) {
            throw new IllegalArgumentException("producerConfig cannot be null");
        }
        this.channelProvider = channelProvider;
        this.codec = codec;
        this.producerConfig = producerConfig;
    }

    /**
     * 공유 producer 조회 (처음 호출 시 생성). 연결은 첫 produce 시도에서 열립니다.
     *
     * @return producer
     * @throws IllegalStateException 팩토리가 이미 닫힌 경우
     */
    public synchronized ResilientProducer getProducer() {
        if (closed) {
            throw new IllegalStateException("RabbitProducerFactory is closed");
        }
        if (producer == null) {
            producer = new ResilientProducer(channelProvider, codec, producerConfig);
        }
        return producer;
    }

    public RabbitChannelProvider getChannelProvider() {
        return channelProvider;
    }

    /**
     * producer 워커 풀을 먼저 멈추고 연결을 닫습니다.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (producer != null) {
            producer.close();
        }
        channelProvider.close();
    }
}

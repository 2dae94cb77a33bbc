/**
 * Resilient Producer 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.producer.runtime.producer.ResilientProducer} - 무제한 재시도 + RPC 응답 대기</li>
 *   <li>{@link com.ryuqq.producer.runtime.producer.MessageRouter} - 큐 직접 전송 / exchange publish 분기</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * producer-runtime (ResilientProducer, ResponseQueueRegistry)
 *   ↓ implements
 * core/api (Producer interface)
 *   ↓ depends on
 * core/spi (ChannelProvider, BrokerChannel, MessageCodec, ProducerTransport, Delayer)
 * </pre>
 *
 * @author Producer Team
 * @since 1.0.0
 */
package com.ryuqq.producer.runtime.producer;

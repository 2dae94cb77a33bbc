package com.ryuqq.producer.core.contract;

import com.ryuqq.producer.core.model.CorrelationId;

/**
 * 인코딩이 끝난 송신 메시지 (본문 + 속성).
 *
 * @param body 인코딩된 본문
 * @param properties 메시지 속성
 *
 * @author Producer Team
 * @since 1.0.0
 */
public record OutboundMessage(
    byte[] body,
    MessageProperties properties
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException body 또는 properties가 null인 경우
     */
    public OutboundMessage {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }
    }

    /**
     * RPC 요청용 correlationId / replyTo를 찍은 사본.
     *
     * @param correlationId correlation id
     * @param replyTo 응답 큐 이름
     * @return 새 OutboundMessage (본문 공유)
     */
    public OutboundMessage withReply(CorrelationId correlationId, String replyTo) {
        return new OutboundMessage(body, properties.withReply(correlationId, replyTo));
    }
}

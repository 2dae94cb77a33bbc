package com.ryuqq.producer.core.contract;

/**
 * 브로커에서 전달받은 수신 메시지 (RPC 응답).
 *
 * @param body 본문 (null이면 빈 배열)
 * @param properties 메시지 속성
 *
 * @author Producer Team
 * @since 1.0.0
 */
public record InboundMessage(
    byte[] body,
    MessageProperties properties
) {

    public InboundMessage {
        if (body == null) {
            body = new byte[0];
        }
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }
    }

    /**
     * correlationId 조회 (없으면 null).
     */
    public String correlationId() {
        return properties.correlationId();
    }
}

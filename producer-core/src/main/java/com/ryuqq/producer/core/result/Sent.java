package com.ryuqq.producer.core.result;

import com.ryuqq.producer.core.model.Destination;

/**
 * 일반(비 RPC) 전송 완료.
 *
 * @param destination 전송 대상
 * @param accepted 브로커 채널이 메시지를 받아들였는지 여부 (write buffer 여유 등)
 *
 * @author Producer Team
 * @since 1.0.0
 */
public record Sent(
    Destination destination,
    boolean accepted
) implements ProduceResult {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException destination이 null인 경우
     */
    public Sent {
        if (destination == null) {
            throw new IllegalArgumentException("destination cannot be null");
        }
    }
}

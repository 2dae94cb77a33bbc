package com.ryuqq.producer.core.result;

import com.ryuqq.producer.core.model.CorrelationId;
import com.ryuqq.producer.core.model.Destination;

/**
 * RPC 응답 수신 완료.
 *
 * @param destination 요청을 보낸 대상
 * @param correlationId 요청에 발급된 correlation id
 * @param payload 디코딩된 응답 payload (null 가능)
 *
 * @author Producer Team
 * @since 1.0.0
 */
public record Replied(
    Destination destination,
    CorrelationId correlationId,
    Object payload
) implements ProduceResult {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException destination 또는 correlationId가 null인 경우
     */
    public Replied {
        if (destination == null) {
            throw new IllegalArgumentException("destination cannot be null");
        }
        if (correlationId == null) {
            throw new IllegalArgumentException("correlationId cannot be null");
        }
        // payload는 null 허용 (응답이 null 마커인 경우)
    }
}

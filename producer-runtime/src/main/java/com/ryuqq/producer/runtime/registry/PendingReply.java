package com.ryuqq.producer.runtime.registry;

import com.ryuqq.producer.core.model.CorrelationId;

import java.util.concurrent.CompletableFuture;

/**
 * 응답을 기다리는 RPC 요청 하나.
 *
 * @param correlationId 요청에 발급된 correlation id
 * @param createdAt 등록 시각 (epoch millis)
 * @param future 응답 payload로 한 번만 완료되는 future
 *
 * @author Producer Team
 * @since 1.0.0
 */
record PendingReply(
    CorrelationId correlationId,
    long createdAt,
    CompletableFuture<Object> future
) {

    static PendingReply now(CorrelationId correlationId) {
        return new PendingReply(correlationId, System.currentTimeMillis(), new CompletableFuture<>());
    }
}

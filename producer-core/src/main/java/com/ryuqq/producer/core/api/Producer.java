package com.ryuqq.producer.core.api;

import com.ryuqq.producer.core.contract.ProduceOptions;
import com.ryuqq.producer.core.result.ProduceResult;

import java.util.concurrent.CompletableFuture;

/**
 * 메시지 전송 facade.
 *
 * <p>일반 전송(fire-and-forget)과 RPC(요청/응답)를 같은 진입점으로 제공하며,
 * 채널 장애 시 내부에서 재시도합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * // 일반 전송: persistent + durable 기본값
 * producer.produce("queueName", Map.of("message", "hello world!"));
 *
 * // RPC: 응답이 올 때까지 완료되지 않음
 * ProduceResult result = producer.produce("service-x", Map.of("op", "ping"), ProduceOptions.rpcDefaults()).join();
 * Object reply = result.replyOrNull();
 *
 * // exchange + routingKey
 * producer.produce("events", payload, ProduceOptions.defaults().withRoutingKey("order.created"));
 * </pre>
 *
 * @author Producer Team
 * @since 1.0.0
 */
public interface Producer {

    /**
     * 기본 옵션으로 메시지 전송.
     *
     * @param destination 큐 이름
     * @param payload 전송할 값 (null 가능)
     * @return 전송 완료 시 {@link com.ryuqq.producer.core.result.Sent}로 완료되는 future
     * @throws IllegalArgumentException destination이 유효하지 않은 경우
     */
    default CompletableFuture<ProduceResult> produce(String destination, Object payload) {
        return produce(destination, payload, null);
    }

    /**
     * 메시지 전송.
     *
     * <p><strong>완료 조건:</strong></p>
     * <ul>
     *   <li>일반 전송: 브로커 전송 성공 시 {@link com.ryuqq.producer.core.result.Sent}</li>
     *   <li>RPC: 같은 correlation id의 응답 수신 시 {@link com.ryuqq.producer.core.result.Replied}</li>
     * </ul>
     *
     * <p>일시적 실패로는 future가 실패하지 않습니다 (무제한 재시도 기본값).
     * 입력 검증 실패만 즉시 예외로 던집니다.</p>
     *
     * @param destination 큐 이름 또는 (routingKey 지정 시) exchange 이름
     * @param payload 전송할 값 (null 가능)
     * @param options 전송 옵션 (null이면 기본값)
     * @return 결과 future
     * @throws IllegalArgumentException destination이 유효하지 않은 경우
     */
    CompletableFuture<ProduceResult> produce(String destination, Object payload, ProduceOptions options);
}

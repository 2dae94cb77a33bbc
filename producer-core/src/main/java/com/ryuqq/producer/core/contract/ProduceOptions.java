package com.ryuqq.producer.core.contract;

import java.util.Map;

/**
 * 메시지 전송 옵션 (불변 record).
 *
 * <p><strong>옵션 항목:</strong></p>
 * <ul>
 *   <li>rpc: 요청/응답 모드 활성화. 결과가 전송 확인 대신 디코딩된 응답 payload로 완료됨</li>
 *   <li>routingKey: 지정 시 destination을 exchange로 보고 routingKey로 publish (없으면 큐 직접 전송)</li>
 *   <li>persistent: 브로커 측 영속 메시지 여부 (기본 true)</li>
 *   <li>durable: 대상 큐/exchange의 durable 여부 (기본 true). producer는 대상을 선언하지 않으므로
 *       전송에는 쓰이지 않고 메시지 속성에도 실리지 않음. 대상을 직접 선언하는 호출자가 같은 옵션 객체로
 *       선언 값을 맞출 때 사용 (응답 큐의 durable은 {@link QueueOptions#replyQueue()}가 결정)</li>
 *   <li>contentType: codec의 content-type 협상 힌트 (null이면 codec 기본값)</li>
 *   <li>correlationId / replyTo: 비 RPC 전송 시 그대로 메시지 속성에 실림 (RPC 응답 회신용)</li>
 *   <li>headers: 메시지 헤더</li>
 * </ul>
 *
 * <p>빈 routingKey는 없는 것으로 취급합니다.</p>
 *
 * @author Producer Team
 * @since 1.0.0
 * @param rpc RPC 모드 여부
 * @param routingKey exchange routing key (null 가능)
 * @param persistent 영속 메시지 여부
 * @param durable durable 대상 여부 (전송 동작에는 영향 없음)
 * @param contentType content-type 힌트 (null 가능)
 * @param correlationId 비 RPC 전송에 실을 correlation id (null 가능)
 * @param replyTo 비 RPC 전송에 실을 reply-to 큐 (null 가능)
 * @param headers 메시지 헤더 (null이면 빈 맵)
 */
public record ProduceOptions(
    boolean rpc,
    String routingKey,
    boolean persistent,
    boolean durable,
    String contentType,
    String correlationId,
    String replyTo,
    Map<String, Object> headers
) {

    /**
     * Compact constructor (정규화).
     */
    public ProduceOptions {
        if (routingKey != null && routingKey.isEmpty()) {
            routingKey = null;
        }
        headers = MessageProperties.copyHeaders(headers);
    }

    /**
     * 기본 옵션: persistent=true, durable=true, RPC 비활성.
     *
     * @return 기본 옵션
     */
    public static ProduceOptions defaults() {
        return new ProduceOptions(false, null, true, true, null, null, null, Map.of());
    }

    /**
     * 기본 옵션에 RPC 모드만 켠 옵션.
     *
     * @return RPC 옵션
     */
    public static ProduceOptions rpcDefaults() {
        return defaults().withRpc(true);
    }

    /**
     * routingKey 존재 여부.
     *
     * @return routingKey가 있으면 true (exchange publish 경로)
     */
    public boolean hasRoutingKey() {
        return routingKey != null;
    }

    public ProduceOptions withRpc(boolean rpc) {
        return new ProduceOptions(rpc, routingKey, persistent, durable, contentType, correlationId, replyTo, headers);
    }

    public ProduceOptions withRoutingKey(String routingKey) {
        return new ProduceOptions(rpc, routingKey, persistent, durable, contentType, correlationId, replyTo, headers);
    }

    public ProduceOptions withPersistent(boolean persistent) {
        return new ProduceOptions(rpc, routingKey, persistent, durable, contentType, correlationId, replyTo, headers);
    }

    public ProduceOptions withDurable(boolean durable) {
        return new ProduceOptions(rpc, routingKey, persistent, durable, contentType, correlationId, replyTo, headers);
    }

    public ProduceOptions withContentType(String contentType) {
        return new ProduceOptions(rpc, routingKey, persistent, durable, contentType, correlationId, replyTo, headers);
    }

    /**
     * 응답 회신용 correlation 필드 지정.
     *
     * <p>RPC 서버 측에서 요청의 {@code replyTo} 큐로 응답을 보낼 때 사용합니다.</p>
     */
    public ProduceOptions withCorrelation(String correlationId, String replyTo) {
        return new ProduceOptions(rpc, routingKey, persistent, durable, contentType, correlationId, replyTo, headers);
    }

    public ProduceOptions withHeaders(Map<String, Object> headers) {
        return new ProduceOptions(rpc, routingKey, persistent, durable, contentType, correlationId, replyTo, headers);
    }
}

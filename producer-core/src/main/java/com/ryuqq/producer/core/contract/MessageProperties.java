package com.ryuqq.producer.core.contract;

import com.ryuqq.producer.core.model.CorrelationId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * wire 수준 메시지 속성 (AMQP basic properties 중 이 라이브러리가 다루는 부분).
 *
 * <p>RPC 요청에는 {@code correlationId}와 {@code replyTo}가 반드시 실리고,
 * 응답 메시지는 같은 {@code correlationId}를 돌려줘야 합니다.</p>
 *
 * @param contentType content type (null 가능)
 * @param contentEncoding content encoding (null 가능)
 * @param persistent 영속 메시지 여부 (AMQP deliveryMode 2)
 * @param correlationId correlation id (null 가능)
 * @param replyTo 응답 큐 이름 (null 가능)
 * @param headers 헤더 (null이면 빈 맵, 값은 null 가능: AMQP void field)
 *
 * @author Producer Team
 * @since 1.0.0
 */
public record MessageProperties(
    String contentType,
    String contentEncoding,
    boolean persistent,
    String correlationId,
    String replyTo,
    Map<String, Object> headers
) {

    public MessageProperties {
        headers = copyHeaders(headers);
    }

    /**
     * 전송 옵션으로부터 속성 생성.
     *
     * <p>options의 correlationId / replyTo / headers / persistent를 그대로 옮깁니다.</p>
     *
     * @param options 전송 옵션
     * @param contentType codec이 결정한 content type
     * @param contentEncoding codec이 결정한 encoding (null 가능)
     * @return MessageProperties
     * @throws IllegalArgumentException options가 null인 경우
     */
    public static MessageProperties from(ProduceOptions options, String contentType, String contentEncoding) {
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        return new MessageProperties(
            contentType,
            contentEncoding,
            options.persistent(),
            options.correlationId(),
            options.replyTo(),
            options.headers()
        );
    }

    /**
     * 속성 없이 content type만 가진 인스턴스 (수신 메시지 테스트 등).
     */
    public static MessageProperties ofContentType(String contentType) {
        return new MessageProperties(contentType, null, false, null, null, Map.of());
    }

    /**
     * RPC 요청용 correlationId / replyTo를 찍은 사본.
     *
     * @param correlationId 새 correlation id
     * @param replyTo 응답 큐 이름
     * @return 새 MessageProperties
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public MessageProperties withReply(CorrelationId correlationId, String replyTo) {
        if (correlationId == null) {
            throw new IllegalArgumentException("correlationId cannot be null");
        }
        if (replyTo == null || replyTo.isBlank()) {
            throw new IllegalArgumentException("replyTo cannot be null or blank");
        }
        return new MessageProperties(contentType, contentEncoding, persistent, correlationId.getValue(), replyTo, headers);
    }

    /**
     * 헤더 불변 복사본. {@link Map#copyOf}와 달리 null 값을 허용합니다.
     */
    static Map<String, Object> copyHeaders(Map<String, Object> headers) {
        if (headers == null || headers.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }
}

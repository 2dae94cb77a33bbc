package com.ryuqq.producer.core.model;

import java.util.UUID;

/**
 * RPC 요청과 응답을 연결하는 불투명(opaque) 식별자.
 *
 * <p>요청 메시지의 {@code correlationId} 속성에 실리고, 응답 메시지가 같은 값을 돌려주면
 * 해당 요청의 대기자에게 응답이 전달됩니다.</p>
 *
 * <p><strong>생성 규칙:</strong></p>
 * <ul>
 *   <li>{@link #random()}: 요청마다 새 UUID v4 발급</li>
 *   <li>{@link #of(String)}: 수신 메시지에서 읽은 값 복원</li>
 * </ul>
 *
 * @author Producer Team
 * @since 1.0.0
 */
public final class CorrelationId {

    private final String value;

    private CorrelationId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("CorrelationId cannot be null or blank");
        }
        this.value = value;
    }

    /**
     * CorrelationId 생성.
     *
     * @param value correlation id 문자열
     * @return CorrelationId 인스턴스
     * @throws IllegalArgumentException 값이 null이거나 빈 문자열인 경우
     */
    public static CorrelationId of(String value) {
        return new CorrelationId(value);
    }

    /**
     * 무작위 CorrelationId 발급 (UUID 기반).
     *
     * @return 새 CorrelationId
     */
    public static CorrelationId random() {
        return new CorrelationId(UUID.randomUUID().toString());
    }

    /**
     * CorrelationId 값 조회.
     *
     * @return correlation id 문자열
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CorrelationId that = (CorrelationId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "CorrelationId{" + value + '}';
    }
}

package com.ryuqq.producer.core.model;

/**
 * 메시지 전송 대상 (큐 이름 또는 exchange 이름).
 *
 * <p>routingKey가 없으면 큐 이름으로, routingKey가 있으면 exchange 이름으로 해석됩니다.
 * RPC 응답 큐 레지스트리의 키로도 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자 (AMQP short string 제한)</li>
 * </ul>
 *
 * @author Producer Team
 * @since 1.0.0
 */
public final class Destination {

    private static final int MAX_LENGTH = 255;

    private final String value;

    private Destination(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Destination cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("Destination length cannot exceed " + MAX_LENGTH + " characters");
        }
        this.value = value;
    }

    /**
     * Destination 생성.
     *
     * @param value 큐 또는 exchange 이름
     * @return Destination 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static Destination of(String value) {
        return new Destination(value);
    }

    /**
     * Destination 값 조회.
     *
     * @return 큐 또는 exchange 이름
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Destination that = (Destination) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Destination{" + value + '}';
    }
}

package com.ryuqq.producer.core.contract;

import com.ryuqq.producer.core.model.Destination;

/**
 * 한 번의 produce 호출을 나타내는 불변 요청.
 *
 * <p>재시도 루프는 이 객체 하나를 붙잡고 매 시도마다 그대로 다시 사용하므로,
 * 모든 시도에서 동일한 destination / payload / options가 전송됩니다.</p>
 *
 * <p><strong>정규화:</strong></p>
 * <ul>
 *   <li>빈 payload (null, 빈 문자열) → 명시적 null 마커 (wire 포맷은 "값 없음"을 표현할 수 없음)</li>
 *   <li>options가 null → {@link ProduceOptions#defaults()}</li>
 * </ul>
 *
 * <p>payload 객체 자체는 복사하지 않습니다. 호출자는 produce 이후 payload를 변경하지 않아야 합니다.</p>
 *
 * @param destination 전송 대상
 * @param payload 전송할 값 (null 가능)
 * @param options 전송 옵션
 *
 * @author Producer Team
 * @since 1.0.0
 */
public record ProduceRequest(
    Destination destination,
    Object payload,
    ProduceOptions options
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException destination이 null인 경우
     */
    public ProduceRequest {
        if (destination == null) {
            throw new IllegalArgumentException("destination cannot be null");
        }
        if (payload instanceof CharSequence && ((CharSequence) payload).length() == 0) {
            payload = null;
        }
        if (options == null) {
            options = ProduceOptions.defaults();
        }
    }

    /**
     * ProduceRequest 생성.
     *
     * @param destination 대상 이름
     * @param payload 전송할 값
     * @param options 전송 옵션 (null이면 기본값)
     * @return ProduceRequest
     * @throws IllegalArgumentException destination이 유효하지 않은 경우
     */
    public static ProduceRequest of(String destination, Object payload, ProduceOptions options) {
        return new ProduceRequest(Destination.of(destination), payload, options);
    }

    /**
     * RPC 요청 여부.
     *
     * @return options.rpc
     */
    public boolean isRpc() {
        return options.rpc();
    }
}

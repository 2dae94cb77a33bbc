package com.ryuqq.producer.core.result;

/**
 * produce 호출 결과.
 *
 * <p>ProduceResult는 두 가지 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Sent}: 일반 전송 완료 (브로커 전송 확인 결과 포함)</li>
 *   <li>{@link Replied}: RPC 응답 수신 완료 (디코딩된 응답 payload 포함)</li>
 * </ul>
 *
 * <p>실패 결과는 없습니다. 일시적 실패는 produce 내부에서 재시도되며,
 * 호출자에게는 지연으로만 드러납니다.</p>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.</p>
 *
 * @author Producer Team
 * @since 1.0.0
 */
public sealed interface ProduceResult permits Sent, Replied {

    /**
     * RPC 응답 결과인지 확인.
     *
     * @return Replied이면 true
     */
    default boolean isReplied() {
        return this instanceof Replied;
    }

    /**
     * 응답 payload 조회.
     *
     * @return Replied이면 디코딩된 응답, Sent이면 null
     */
    default Object replyOrNull() {
        return this instanceof Replied ? ((Replied) this).payload() : null;
    }
}

package com.ryuqq.producer.core.stage;

/**
 * produce 한 번의 시도(attempt) 안에서 거치는 단계.
 *
 * <p><strong>단계 흐름:</strong></p>
 * <pre>
 * ACQUIRE (채널 획득)
 *    │
 *    ▼
 * PREPARE (payload 정규화 + 인코딩)
 *    │
 *    ├─► (rpc) REPLY_QUEUE (응답 큐 확보 + correlation id 발급)
 *    │            │
 *    ▼            ▼
 * ROUTE (exchange publish 또는 큐 직접 전송)
 *    │
 *    ├─► SENT (일반 전송 종료)
 *    │
 *    └─► AWAITING_REPLY (rpc, 응답 대기)
 * </pre>
 *
 * <p>ACQUIRE ~ ROUTE 중 어느 단계에서 실패해도 시도 전체가 ACQUIRE부터 다시 시작됩니다.
 * AWAITING_REPLY 이후에는 재시도하지 않습니다.</p>
 *
 * @author Producer Team
 * @since 1.0.0
 */
public enum ProduceStage {

    /**
     * 연결 관리자에서 채널 획득.
     */
    ACQUIRE,

    /**
     * payload 정규화 및 codec 인코딩.
     */
    PREPARE,

    /**
     * RPC 응답 큐 확보 및 대기자 등록.
     */
    REPLY_QUEUE,

    /**
     * 브로커로 전송.
     */
    ROUTE,

    /**
     * 일반 전송 완료.
     */
    SENT,

    /**
     * RPC 응답 대기 중.
     */
    AWAITING_REPLY;

    /**
     * 이 단계에서의 실패가 재시도 대상인지 확인.
     *
     * @return ACQUIRE, PREPARE, REPLY_QUEUE, ROUTE인 경우 true
     */
    public boolean isRetryable() {
        return this != SENT && this != AWAITING_REPLY;
    }

    /**
     * 시도가 끝난 단계인지 확인.
     *
     * @return SENT 또는 AWAITING_REPLY인 경우 true
     */
    public boolean isTerminal() {
        return this == SENT || this == AWAITING_REPLY;
    }
}

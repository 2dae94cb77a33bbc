package com.ryuqq.producer.core.contract;

/**
 * 큐 선언 옵션.
 *
 * @param durable 브로커 재시작 후에도 큐 유지
 * @param exclusive 선언한 채널(연결)만 사용 가능, 연결 종료 시 삭제
 * @param autoDelete 마지막 consumer 해제 시 삭제
 *
 * @author Producer Team
 * @since 1.0.0
 */
public record QueueOptions(
    boolean durable,
    boolean exclusive,
    boolean autoDelete
) {

    /**
     * RPC 응답 큐 옵션: durable + exclusive.
     *
     * @return 응답 큐 선언 옵션
     */
    public static QueueOptions replyQueue() {
        return new QueueOptions(true, true, false);
    }

    /**
     * 일반 durable 큐 옵션.
     *
     * @return durable, non-exclusive 옵션
     */
    public static QueueOptions durableQueue() {
        return new QueueOptions(true, false, false);
    }
}

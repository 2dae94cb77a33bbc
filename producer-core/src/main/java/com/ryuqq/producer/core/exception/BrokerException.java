package com.ryuqq.producer.core.exception;

/**
 * 브로커 채널 작업 실패.
 *
 * <p>채널 어댑터는 I/O 오류, 닫힌 채널, 존재하지 않는 exchange, 잠긴 exclusive 큐 등을
 * 이 예외로 감싸서 던집니다. produce 재시도 루프는 이 예외를 일시적 실패로 취급합니다.</p>
 *
 * @author Producer Team
 * @since 1.0.0
 */
public class BrokerException extends RuntimeException {

    public BrokerException(String message) {
        super(message);
    }

    public BrokerException(String message, Throwable cause) {
        super(message, cause);
    }
}

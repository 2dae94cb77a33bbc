package com.ryuqq.producer.core.exception;

import com.ryuqq.producer.core.model.Destination;

/**
 * 설정된 최대 시도 횟수를 모두 소진함.
 *
 * <p>{@code ProducerConfig.maxAttempts}가 0(무제한, 기본값)이면 발생하지 않습니다.</p>
 *
 * @author Producer Team
 * @since 1.0.0
 */
public class RetryExhaustedException extends RuntimeException {

    private final Destination destination;
    private final int attempts;

    public RetryExhaustedException(Destination destination, int attempts, Throwable lastFailure) {
        super("Produce to " + destination.getValue() + " gave up after " + attempts + " attempts", lastFailure);
        this.destination = destination;
        this.attempts = attempts;
    }

    public Destination getDestination() {
        return destination;
    }

    public int getAttempts() {
        return attempts;
    }
}

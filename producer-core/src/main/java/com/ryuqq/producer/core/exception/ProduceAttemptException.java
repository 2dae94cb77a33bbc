package com.ryuqq.producer.core.exception;

import com.ryuqq.producer.core.model.Destination;
import com.ryuqq.producer.core.stage.ProduceStage;

/**
 * 한 번의 produce 시도 실패.
 *
 * <p>어느 단계({@link ProduceStage})에서 몇 번째 시도가 실패했는지를 원인과 함께 담아
 * transport 로그로 전달됩니다. 호출자에게 직접 던져지지 않습니다.</p>
 *
 * @author Producer Team
 * @since 1.0.0
 */
public class ProduceAttemptException extends RuntimeException {

    private final Destination destination;
    private final ProduceStage stage;
    private final int attempt;

    /**
     * 생성자.
     *
     * @param destination 전송 대상
     * @param stage 실패한 단계
     * @param attempt 시도 번호 (1부터 시작)
     * @param cause 원인
     */
    public ProduceAttemptException(Destination destination, ProduceStage stage, int attempt, Throwable cause) {
        super("Produce to " + destination.getValue() + " failed at " + stage + " (attempt " + attempt + "): "
            + (cause == null ? "unknown" : cause.getMessage()), cause);
        this.destination = destination;
        this.stage = stage;
        this.attempt = attempt;
    }

    public Destination getDestination() {
        return destination;
    }

    public ProduceStage getStage() {
        return stage;
    }

    public int getAttempt() {
        return attempt;
    }
}

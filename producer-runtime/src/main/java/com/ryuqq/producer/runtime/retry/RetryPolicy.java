package com.ryuqq.producer.runtime.retry;

import com.ryuqq.producer.core.config.ProducerConfig;

/**
 * 고정 간격 재시도 정책 (불변 record).
 *
 * <p>produce 시도가 실패하면 항상 같은 시간만큼 기다린 뒤 처음(채널 획득)부터 다시 시도합니다.
 * 지수 백오프나 jitter는 적용하지 않습니다.</p>
 *
 * <p><strong>예시 (delayMs=1000, maxAttempts=0):</strong></p>
 * <ul>
 *   <li>attempt=1 실패 → 1000ms 대기 → attempt=2</li>
 *   <li>attempt=2 실패 → 1000ms 대기 → attempt=3</li>
 *   <li>... 성공할 때까지 무한 반복</li>
 * </ul>
 *
 * <p>maxAttempts > 0이면 그 횟수만큼 시도한 뒤 포기합니다.</p>
 *
 * @author Producer Team
 * @since 1.0.0
 * @param delayMs 시도 사이 대기 시간 (밀리초, 양수여야 함)
 * @param maxAttempts 최대 시도 횟수 (0 = 무제한)
 */
public record RetryPolicy(
    long delayMs,
    int maxAttempts
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryPolicy {
        if (delayMs <= 0) {
            throw new IllegalArgumentException(
                "delayMs must be positive (current: " + delayMs + ")"
            );
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be non-negative (current: " + maxAttempts + ")"
            );
        }
    }

    /**
     * 무제한 재시도 정책.
     *
     * @param delayMs 시도 사이 대기 시간
     * @return 무제한 정책
     */
    public static RetryPolicy unbounded(long delayMs) {
        return new RetryPolicy(delayMs, 0);
    }

    /**
     * Producer 설정에서 정책 생성.
     *
     * @param config producer 설정
     * @return retryDelayMs / maxAttempts를 반영한 정책
     */
    public static RetryPolicy from(ProducerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return new RetryPolicy(config.retryDelayMs(), config.maxAttempts());
    }

    /**
     * 다음 시도 전 대기 시간 계산.
     *
     * @param failedAttempt 방금 실패한 시도 번호 (1부터 시작)
     * @return 대기 시간 (밀리초, 항상 delayMs)
     * @throws IllegalArgumentException failedAttempt가 양수가 아닌 경우
     */
    public long delayAfter(int failedAttempt) {
        if (failedAttempt <= 0) {
            throw new IllegalArgumentException(
                "failedAttempt must be positive (current: " + failedAttempt + ")"
            );
        }
        return delayMs;
    }

    /**
     * 시도 예산 소진 여부.
     *
     * @param attemptsMade 지금까지 시도한 횟수
     * @return 더 시도하면 안 되면 true (무제한이면 항상 false)
     */
    public boolean isExhausted(int attemptsMade) {
        return maxAttempts > 0 && attemptsMade >= maxAttempts;
    }
}

package com.ryuqq.producer.core.config;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Producer 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>hostname: 응답 큐 이름 구분자 (기본: 로컬 호스트 이름)</li>
 *   <li>retryDelayMs: 재시도 사이 고정 대기 시간 (기본 1000ms)</li>
 *   <li>maxAttempts: 최대 시도 횟수 (기본 0 = 무제한)</li>
 *   <li>replyTimeoutMs: RPC 응답 대기 제한 (기본 0 = 무기한 대기)</li>
 *   <li>workerThreads: produce 루프를 실행할 스레드 수 (기본 4)</li>
 * </ul>
 *
 * <p><strong>응답 큐 이름:</strong> {@code <destination>:<hostname>:res}.
 * 같은 destination으로 RPC를 보내는 프로세스마다 hostname이 달라야 응답 큐가 충돌하지 않습니다.</p>
 *
 * <p>maxAttempts와 replyTimeoutMs는 확장 지점입니다. 기본값에서는 일시적 실패를 끝없이 재시도하고
 * 응답을 끝없이 기다립니다.</p>
 *
 * @author Producer Team
 * @since 1.0.0
 * @param hostname 응답 큐 구분자 (빈 문자열, ':' 포함 불가)
 * @param retryDelayMs 재시도 대기 시간 (밀리초, 양수여야 함)
 * @param maxAttempts 최대 시도 횟수 (0 = 무제한, 음수 불가)
 * @param replyTimeoutMs RPC 응답 제한 시간 (밀리초, 0 = 무제한, 음수 불가)
 * @param workerThreads 워커 스레드 수 (1 이상이어야 함)
 */
public record ProducerConfig(
    String hostname,
    long retryDelayMs,
    int maxAttempts,
    long replyTimeoutMs,
    int workerThreads
) {

    private static final String LOCALHOST = "localhost";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: hostname=로컬 호스트 이름, retryDelayMs=1000ms, maxAttempts=0(무제한),
     * replyTimeoutMs=0(무제한), workerThreads=4</p>
     */
    public ProducerConfig() {
        this(localHostname(), 1000, 0, 0, 4);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ProducerConfig {
        if (hostname == null || hostname.isBlank()) {
            throw new IllegalArgumentException("hostname cannot be null or blank");
        }
        if (hostname.contains(":")) {
            throw new IllegalArgumentException("hostname cannot contain ':' (current: " + hostname + ")");
        }
        if (retryDelayMs <= 0) {
            throw new IllegalArgumentException(
                "retryDelayMs must be positive (current: " + retryDelayMs + ")"
            );
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be non-negative (current: " + maxAttempts + ")"
            );
        }
        if (replyTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "replyTimeoutMs must be non-negative (current: " + replyTimeoutMs + ")"
            );
        }
        if (workerThreads <= 0) {
            throw new IllegalArgumentException(
                "workerThreads must be positive (current: " + workerThreads + ")"
            );
        }
    }

    /**
     * 시도 횟수 제한이 없는지 확인.
     *
     * @return maxAttempts == 0이면 true
     */
    public boolean isUnboundedRetry() {
        return maxAttempts == 0;
    }

    /**
     * 응답 대기 제한이 있는지 확인.
     *
     * @return replyTimeoutMs > 0이면 true
     */
    public boolean hasReplyTimeout() {
        return replyTimeoutMs > 0;
    }

    /**
     * hostname만 변경한 새 인스턴스 생성.
     */
    public ProducerConfig withHostname(String hostname) {
        return new ProducerConfig(hostname, retryDelayMs, maxAttempts, replyTimeoutMs, workerThreads);
    }

    /**
     * retryDelayMs만 변경한 새 인스턴스 생성.
     */
    public ProducerConfig withRetryDelayMs(long retryDelayMs) {
        return new ProducerConfig(hostname, retryDelayMs, maxAttempts, replyTimeoutMs, workerThreads);
    }

    /**
     * maxAttempts만 변경한 새 인스턴스 생성.
     */
    public ProducerConfig withMaxAttempts(int maxAttempts) {
        return new ProducerConfig(hostname, retryDelayMs, maxAttempts, replyTimeoutMs, workerThreads);
    }

    /**
     * replyTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public ProducerConfig withReplyTimeoutMs(long replyTimeoutMs) {
        return new ProducerConfig(hostname, retryDelayMs, maxAttempts, replyTimeoutMs, workerThreads);
    }

    /**
     * workerThreads만 변경한 새 인스턴스 생성.
     */
    public ProducerConfig withWorkerThreads(int workerThreads) {
        return new ProducerConfig(hostname, retryDelayMs, maxAttempts, replyTimeoutMs, workerThreads);
    }

    private static String localHostname() {
        try {
            String name = InetAddress.getLocalHost().getHostName();
            if (name != null && !name.isBlank()) {
                return name.replace(':', '-');
            }
            return LOCALHOST;
        } catch (UnknownHostException e) {
            // 호스트 이름 조회 불가 → localhost
            return LOCALHOST;
        }
    }
}

package com.ryuqq.producer.runtime.retry;

import com.ryuqq.producer.core.spi.Delayer;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 스레드를 점유하지 않는 기본 Delayer.
 *
 * <p>대기는 스케줄러에 맡기고, 대기가 끝나면 future를 완료합니다.
 * 재시도 중인 produce 호출은 대기하는 동안 워커 스레드를 반납합니다.</p>
 *
 * <ul>
 *   <li>기본 생성자: JDK 공용 지연 스케줄러 ({@link CompletableFuture#delayedExecutor}) 사용</li>
 *   <li>스케줄러 주입: 호출자가 스케줄러의 생명주기를 관리</li>
 * </ul>
 *
 * @author Producer Team
 * @since 1.0.0
 */
public final class ScheduledDelayer implements Delayer {

    private final ScheduledExecutorService scheduler;

    /**
     * JDK 공용 지연 스케줄러를 사용하는 생성자.
     */
    public ScheduledDelayer() {
        this.scheduler = null;
    }

    /**
     * 주입된 스케줄러를 사용하는 생성자.
     *
     * @param scheduler 공유 스케줄러 (종료는 호출자 책임)
     * @throws IllegalArgumentException scheduler가 null인 경우
     */
    public ScheduledDelayer(ScheduledExecutorService scheduler) {
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        this.scheduler = scheduler;
    }

    @Override
    public CompletableFuture<Void> delay(long millis) {
        if (millis < 0) {
            throw new IllegalArgumentException("millis must be non-negative (current: " + millis + ")");
        }
        if (scheduler == null) {
            return CompletableFuture.runAsync(() -> { },
                CompletableFuture.delayedExecutor(millis, TimeUnit.MILLISECONDS));
        }

        CompletableFuture<Void> elapsed = new CompletableFuture<>();
        try {
            scheduler.schedule(() -> elapsed.complete(null), millis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            elapsed.completeExceptionally(e);
        }
        return elapsed;
    }
}

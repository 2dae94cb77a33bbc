package com.ryuqq.producer.runtime.retry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScheduledDelayer 테스트.
 *
 * @author Producer Team
 * @since 1.0.0
 */
class ScheduledDelayerTest {

    @Test
    @DisplayName("대기는 호출 스레드를 막지 않고 지정 시간 후 완료")
    void shouldCompleteAfterDelayWithoutBlocking() throws Exception {
        // Given
        ScheduledDelayer delayer = new ScheduledDelayer();
        long startedAt = System.nanoTime();

        // When
        CompletableFuture<Void> elapsed = delayer.delay(100);

        // Then
        assertFalse(elapsed.isDone(), "delay() returns before the delay elapses");
        elapsed.get(5, TimeUnit.SECONDS);
        assertTrue(System.nanoTime() - startedAt >= TimeUnit.MILLISECONDS.toNanos(100));
    }

    @Test
    @DisplayName("주입된 스케줄러로 대기")
    void shouldUseInjectedScheduler() throws Exception {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            ScheduledDelayer delayer = new ScheduledDelayer(scheduler);

            delayer.delay(10).get(5, TimeUnit.SECONDS);
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    @DisplayName("종료된 스케줄러면 예외 대신 실패한 future 반환")
    void shouldFailFutureWhenSchedulerShutDown() {
        // Given
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        scheduler.shutdown();
        ScheduledDelayer delayer = new ScheduledDelayer(scheduler);

        // When
        CompletableFuture<Void> elapsed = delayer.delay(10);

        // Then
        ExecutionException failure = assertThrows(ExecutionException.class, () -> elapsed.get(5, TimeUnit.SECONDS));
        assertInstanceOf(RejectedExecutionException.class, failure.getCause());
    }

    @Test
    @DisplayName("음수 대기 시간 거부")
    void shouldRejectNegativeDelay() {
        assertThrows(IllegalArgumentException.class, () -> new ScheduledDelayer().delay(-1));
    }

    @Test
    @DisplayName("null 스케줄러 거부")
    void shouldRejectNullScheduler() {
        assertThrows(IllegalArgumentException.class, () -> new ScheduledDelayer(null));
    }
}

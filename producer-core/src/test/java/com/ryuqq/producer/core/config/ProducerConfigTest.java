package com.ryuqq.producer.core.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ProducerConfig 테스트.
 *
 * @author Producer Team
 * @since 1.0.0
 */
class ProducerConfigTest {

    @Test
    void 기본값_무제한_재시도_무제한_응답대기() {
        ProducerConfig config = new ProducerConfig();

        assertThat(config.hostname()).isNotBlank().doesNotContain(":");
        assertThat(config.retryDelayMs()).isEqualTo(1000);
        assertThat(config.maxAttempts()).isZero();
        assertThat(config.isUnboundedRetry()).isTrue();
        assertThat(config.replyTimeoutMs()).isZero();
        assertThat(config.hasReplyTimeout()).isFalse();
        assertThat(config.workerThreads()).isEqualTo(4);
    }

    @Test
    void with_메서드는_해당_필드만_변경() {
        ProducerConfig config = new ProducerConfig()
            .withHostname("gateway-http")
            .withRetryDelayMs(50)
            .withMaxAttempts(3)
            .withReplyTimeoutMs(2000)
            .withWorkerThreads(2);

        assertThat(config.hostname()).isEqualTo("gateway-http");
        assertThat(config.retryDelayMs()).isEqualTo(50);
        assertThat(config.maxAttempts()).isEqualTo(3);
        assertThat(config.isUnboundedRetry()).isFalse();
        assertThat(config.replyTimeoutMs()).isEqualTo(2000);
        assertThat(config.hasReplyTimeout()).isTrue();
        assertThat(config.workerThreads()).isEqualTo(2);
    }

    @Test
    void retryDelayMs가_양수가_아니면_예외() {
        assertThatThrownBy(() -> new ProducerConfig("host", 0, 0, 0, 1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("retryDelayMs must be positive");
    }

    @Test
    void hostname에_콜론이_있으면_예외() {
        assertThatThrownBy(() -> new ProducerConfig("a:b", 100, 0, 0, 1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("hostname");
    }

    @Test
    void 음수_maxAttempts_replyTimeout_예외() {
        assertThatThrownBy(() -> new ProducerConfig("host", 100, -1, 0, 1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ProducerConfig("host", 100, 0, -1, 1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void workerThreads가_0이면_예외() {
        assertThatThrownBy(() -> new ProducerConfig("host", 100, 0, 0, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("workerThreads");
    }
}

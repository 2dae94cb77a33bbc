package com.ryuqq.producer.core.contract;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ProduceOptions 테스트.
 *
 * @author Producer Team
 * @since 1.0.0
 */
class ProduceOptionsTest {

    @Test
    void defaults_persistent_durable_이고_rpc_아님() {
        ProduceOptions options = ProduceOptions.defaults();

        assertThat(options.persistent()).isTrue();
        assertThat(options.durable()).isTrue();
        assertThat(options.rpc()).isFalse();
        assertThat(options.hasRoutingKey()).isFalse();
        assertThat(options.headers()).isEmpty();
    }

    @Test
    void rpcDefaults_rpc만_켜짐() {
        ProduceOptions options = ProduceOptions.rpcDefaults();

        assertThat(options.rpc()).isTrue();
        assertThat(options.persistent()).isTrue();
        assertThat(options.durable()).isTrue();
    }

    @Test
    void 빈_routingKey는_없는_것으로_취급() {
        ProduceOptions options = ProduceOptions.defaults().withRoutingKey("");

        assertThat(options.routingKey()).isNull();
        assertThat(options.hasRoutingKey()).isFalse();
    }

    @Test
    void with_메서드는_나머지_필드를_유지함() {
        // given
        ProduceOptions options = ProduceOptions.rpcDefaults()
            .withRoutingKey("order.created")
            .withContentType("text/plain");

        // when
        ProduceOptions changed = options.withPersistent(false);

        // then
        assertThat(changed.persistent()).isFalse();
        assertThat(changed.rpc()).isTrue();
        assertThat(changed.routingKey()).isEqualTo("order.created");
        assertThat(changed.contentType()).isEqualTo("text/plain");
        assertThat(options.persistent()).isTrue();
    }

    @Test
    void headers는_방어적으로_복사됨() {
        // given
        Map<String, Object> headers = new HashMap<>();
        headers.put("x-trace", "t-1");
        ProduceOptions options = ProduceOptions.defaults().withHeaders(headers);

        // when
        headers.put("x-other", "o");

        // then
        assertThat(options.headers()).containsOnlyKeys("x-trace");
        assertThatThrownBy(() -> options.headers().put("x", "y"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void withCorrelation_응답_회신_필드_설정() {
        ProduceOptions options = ProduceOptions.defaults().withCorrelation("corr-1", "service-x:host:res");

        assertThat(options.correlationId()).isEqualTo("corr-1");
        assertThat(options.replyTo()).isEqualTo("service-x:host:res");
        assertThat(options.rpc()).isFalse();
    }

    @Test
    void null_헤더_값을_허용함() {
        // given
        Map<String, Object> headers = new HashMap<>();
        headers.put("x-void", null);

        // when
        ProduceOptions options = ProduceOptions.defaults().withHeaders(headers);

        // then
        assertThat(options.headers()).containsEntry("x-void", null);
    }

    @Test
    void durable은_메시지_속성에_영향을_주지_않음() {
        // given
        ProduceOptions durable = ProduceOptions.defaults();
        ProduceOptions transientTarget = ProduceOptions.defaults().withDurable(false);

        // when
        MessageProperties fromDurable = MessageProperties.from(durable, "application/json", "utf-8");
        MessageProperties fromTransient = MessageProperties.from(transientTarget, "application/json", "utf-8");

        // then
        assertThat(transientTarget.durable()).isFalse();
        assertThat(fromTransient).isEqualTo(fromDurable);
    }
}

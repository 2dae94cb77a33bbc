package com.ryuqq.producer.codec.jackson;

import com.ryuqq.producer.core.contract.InboundMessage;
import com.ryuqq.producer.core.contract.MessageProperties;
import com.ryuqq.producer.core.contract.OutboundMessage;
import com.ryuqq.producer.core.contract.ProduceOptions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * JacksonMessageCodec tests.
 *
 * @author Producer Team
 * @since 1.0.0
 */
class JacksonMessageCodecTest {

    private final JacksonMessageCodec codec = new JacksonMessageCodec();

    private Object roundTrip(Object payload, ProduceOptions options) {
        OutboundMessage encoded = codec.serialize(payload, options);
        return codec.deserialize(new InboundMessage(encoded.body(), encoded.properties()));
    }

    @Test
    void 객체는_JSON으로_직렬화() {
        // given
        Map<String, Object> payload = Map.of("op", "ping");

        // when
        OutboundMessage message = codec.serialize(payload, ProduceOptions.defaults());

        // then
        assertThat(new String(message.body(), StandardCharsets.UTF_8)).isEqualTo("{\"op\":\"ping\"}");
        assertThat(message.properties().contentType()).isEqualTo(JacksonMessageCodec.APPLICATION_JSON);
        assertThat(message.properties().contentEncoding()).isEqualTo("utf-8");
        assertThat(message.properties().persistent()).isTrue();
    }

    @Test
    void 문자열은_text_plain으로_직렬화() {
        OutboundMessage message = codec.serialize("hello world", ProduceOptions.defaults());

        assertThat(message.body()).isEqualTo("hello world".getBytes(StandardCharsets.UTF_8));
        assertThat(message.properties().contentType()).isEqualTo(JacksonMessageCodec.TEXT_PLAIN);
    }

    @Test
    void 바이트_배열은_그대로_octet_stream으로_전송() {
        byte[] payload = {0x01, 0x02, (byte) 0xff};

        OutboundMessage message = codec.serialize(payload, ProduceOptions.defaults());

        assertThat(message.body()).isEqualTo(payload);
        assertThat(message.properties().contentType()).isEqualTo(JacksonMessageCodec.OCTET_STREAM);
    }

    @Test
    void JSON_content_type을_지정하면_문자열도_JSON으로_인코딩() {
        OutboundMessage message = codec.serialize("hi", ProduceOptions.defaults().withContentType("application/json"));

        assertThat(new String(message.body(), StandardCharsets.UTF_8)).isEqualTo("\"hi\"");
    }

    @Test
    void 옵션이_메시지_속성으로_전달됨() {
        // given
        ProduceOptions options = ProduceOptions.defaults()
            .withPersistent(false)
            .withCorrelation("corr-9", "service-x:gateway-http:res")
            .withHeaders(Map.of("x-trace", "abc"));

        // when
        MessageProperties properties = codec.serialize(Map.of(), options).properties();

        // then
        assertThat(properties.persistent()).isFalse();
        assertThat(properties.correlationId()).isEqualTo("corr-9");
        assertThat(properties.replyTo()).isEqualTo("service-x:gateway-http:res");
        assertThat(properties.headers()).containsEntry("x-trace", "abc");
    }

    @Test
    void 옵션이_null이면_기본값_사용() {
        assertThat(codec.serialize(1, null).properties().persistent()).isTrue();
    }

    @Test
    void 객체_문자열_숫자_null은_인코딩_후_디코딩해도_유지() {
        assertThat(roundTrip(Map.of("op", "pong", "items", List.of(1, 2)), ProduceOptions.defaults()))
            .isEqualTo(Map.of("op", "pong", "items", List.of(1, 2)));
        assertThat(roundTrip("pong", ProduceOptions.defaults())).isEqualTo("pong");
        assertThat(roundTrip(42, ProduceOptions.defaults())).isEqualTo(42);
        assertThat(roundTrip(false, ProduceOptions.defaults())).isEqualTo(false);
        assertThat(roundTrip(null, ProduceOptions.defaults())).isNull();
    }

    @Test
    void 빈_본문은_null로_디코딩() {
        InboundMessage message = new InboundMessage(new byte[0], MessageProperties.ofContentType("application/json"));

        assertThat(codec.deserialize(message)).isNull();
    }

    @Test
    void content_type이_없으면_JSON으로_읽음() {
        InboundMessage message = new InboundMessage(
            "{\"op\":\"pong\"}".getBytes(StandardCharsets.UTF_8), MessageProperties.ofContentType(null));

        assertThat(codec.deserialize(message)).isEqualTo(Map.of("op", "pong"));
    }

    @Test
    void content_type_파라미터는_무시() {
        InboundMessage message = new InboundMessage(
            "[1,2]".getBytes(StandardCharsets.UTF_8), MessageProperties.ofContentType("application/json; charset=utf-8"));

        assertThat(codec.deserialize(message)).isEqualTo(List.of(1, 2));
    }

    @Test
    void 알_수_없는_content_type은_바이트로_디코딩() {
        byte[] body = {9, 8, 7};
        InboundMessage message = new InboundMessage(body, MessageProperties.ofContentType("application/x-protobuf"));

        assertThat(codec.deserialize(message)).isEqualTo(body);
    }

    @Test
    void 잘못된_JSON은_IllegalArgumentException으로_실패() {
        InboundMessage message = new InboundMessage(
            "{oops".getBytes(StandardCharsets.UTF_8), MessageProperties.ofContentType("application/json"));

        assertThatThrownBy(() -> codec.deserialize(message))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Cannot decode JSON");
    }

    @Test
    void 직렬화할_수_없는_payload는_IllegalArgumentException으로_실패() {
        assertThatThrownBy(() -> codec.serialize(new Object(), ProduceOptions.defaults()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("java.lang.Object");
    }
}

package com.ryuqq.producer.codec.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.producer.core.contract.InboundMessage;
import com.ryuqq.producer.core.contract.MessageProperties;
import com.ryuqq.producer.core.contract.OutboundMessage;
import com.ryuqq.producer.core.contract.ProduceOptions;
import com.ryuqq.producer.core.spi.MessageCodec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Jackson based {@link MessageCodec}.
 *
 * <p>Content type is chosen per payload unless the caller sets {@code ProduceOptions.contentType}:</p>
 * <ul>
 *   <li>{@code byte[]} is sent as is with {@code application/octet-stream}</li>
 *   <li>{@code String} is sent as UTF-8 text with {@code text/plain}</li>
 *   <li>anything else (maps, beans, numbers, booleans, {@code null}) is JSON with {@code application/json}</li>
 * </ul>
 *
 * <p>Incoming messages are decoded by their content type. JSON (or a missing content type) is read
 * into plain Java types ({@code Map}, {@code List}, {@code String}, {@code Number}, {@code Boolean}, {@code null});
 * {@code text/*} becomes a {@code String}; anything else is returned as {@code byte[]}.
 * An empty body always decodes to {@code null}.</p>
 *
 * @author Producer Team
 * @since 1.0.0
 */
public final class JacksonMessageCodec implements MessageCodec {

    public static final String APPLICATION_JSON = "application/json";
    public static final String TEXT_PLAIN = "text/plain";
    public static final String OCTET_STREAM = "application/octet-stream";
    private static final String UTF_8 = "utf-8";

    private final ObjectMapper objectMapper;

    public JacksonMessageCodec() {
        this(new ObjectMapper());
    }

    public JacksonMessageCodec(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    @Override
    public OutboundMessage serialize(Object payload, ProduceOptions options) {
        ProduceOptions effective = options == null ? ProduceOptions.defaults() : options;
        String contentType = effective.contentType() != null ? effective.contentType() : contentTypeOf(payload);

        byte[] body;
        String encoding = null;
        if (payload instanceof byte[] && !isJson(contentType)) {
            body = (byte[]) payload;
        } else if (payload instanceof String && !isJson(contentType)) {
            body = ((String) payload).getBytes(StandardCharsets.UTF_8);
            encoding = UTF_8;
        } else {
            body = writeJson(payload);
            encoding = UTF_8;
        }

        return new OutboundMessage(body, MessageProperties.from(effective, contentType, encoding));
    }

    @Override
    public Object deserialize(InboundMessage message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        byte[] body = message.body();
        if (body.length == 0) {
            return null;
        }

        String contentType = message.properties().contentType();
        if (contentType == null || isJson(contentType)) {
            return readJson(body);
        }
        if (isText(contentType)) {
            return new String(body, StandardCharsets.UTF_8);
        }
        return body.clone();
    }

    private static String contentTypeOf(Object payload) {
        if (payload instanceof byte[]) {
            return OCTET_STREAM;
        }
        if (payload instanceof String) {
            return TEXT_PLAIN;
        }
        return APPLICATION_JSON;
    }

    private byte[] writeJson(Object payload) {
        try {
            return objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                "Cannot encode payload of type " + payload.getClass().getName() + " as JSON", e);
        }
    }

    private Object readJson(byte[] body) {
        try {
            return objectMapper.readValue(body, Object.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot decode JSON message body: " + e.getMessage(), e);
        }
    }

    private static boolean isJson(String contentType) {
        return normalized(contentType).endsWith("json");
    }

    private static boolean isText(String contentType) {
        return normalized(contentType).startsWith("text/");
    }

    // "application/json; charset=utf-8" → "application/json"
    private static String normalized(String contentType) {
        int parameters = contentType.indexOf(';');
        String mediaType = parameters >= 0 ? contentType.substring(0, parameters) : contentType;
        return mediaType.trim().toLowerCase(Locale.ROOT);
    }
}

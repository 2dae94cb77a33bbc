package com.ryuqq.producer.core.spi;

import com.ryuqq.producer.core.contract.InboundMessage;
import com.ryuqq.producer.core.contract.OutboundMessage;
import com.ryuqq.producer.core.contract.ProduceOptions;

/**
 * Message codec SPI.
 *
 * <p>Pure, synchronous transform between payload objects and wire messages. Content-type
 * negotiation happens here: {@code serialize} picks the content type (honouring
 * {@link ProduceOptions#contentType()} when set) and {@code deserialize} decodes according to
 * the content type carried by the message.</p>
 *
 * <p><strong>Contract:</strong> {@code deserialize(serialize(p))} equals {@code p} for objects,
 * strings, numbers and {@code null}.</p>
 *
 * @author Producer Team
 * @since 1.0.0
 */
public interface MessageCodec {

    /**
     * Encodes a payload into an outbound message whose properties are derived from the options.
     *
     * @param payload the payload ({@code null} is encoded as an explicit null marker)
     * @param options the produce options
     * @return the encoded message
     * @throws IllegalArgumentException if the payload cannot be encoded
     */
    OutboundMessage serialize(Object payload, ProduceOptions options);

    /**
     * Decodes a delivered message into a payload.
     *
     * @param message the raw message
     * @return the decoded payload (may be {@code null})
     * @throws IllegalArgumentException if the body cannot be decoded
     */
    Object deserialize(InboundMessage message);
}

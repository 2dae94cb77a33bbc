package com.ryuqq.producer.testkit.support;

import com.ryuqq.producer.adapter.inmemory.broker.InMemoryBroker;
import com.ryuqq.producer.adapter.inmemory.broker.InMemoryChannel;
import com.ryuqq.producer.core.contract.InboundMessage;
import com.ryuqq.producer.core.contract.OutboundMessage;
import com.ryuqq.producer.core.contract.ProduceOptions;
import com.ryuqq.producer.core.contract.QueueOptions;
import com.ryuqq.producer.core.spi.MessageCodec;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Service-side RPC stand-in on an {@link InMemoryBroker}.
 *
 * <p>Consumes a request queue and answers every message that carries {@code replyTo} by sending
 * the handler's result to that queue with the request's {@code correlationId}. When the handler
 * returns {@link #NO_REPLY} the request is recorded but left unanswered.</p>
 *
 * <pre>
 * ReplyingResponder responder = ReplyingResponder.start(broker, codec, "service-x",
 *     request -&gt; Map.of("op", "pong"));
 * </pre>
 *
 * @author Producer Team
 * @since 1.0.0
 */
public class ReplyingResponder implements AutoCloseable {

    /**
     * Handler result meaning "do not answer this request".
     */
    public static final Object NO_REPLY = new Object();

    /**
     * A request as seen by the service.
     *
     * @param payload decoded request payload
     * @param correlationId correlation id of the request
     * @param replyTo reply queue named by the request
     * @param replyQueueExisted whether the reply queue existed when the request arrived
     */
    public record ReceivedRequest(Object payload, String correlationId, String replyTo, boolean replyQueueExisted) {
    }

    private final InMemoryBroker broker;
    private final MessageCodec codec;
    private final Function<Object, Object> handler;
    private final InMemoryChannel channel;
    private final List<ReceivedRequest> received = new CopyOnWriteArrayList<>();

    private ReplyingResponder(InMemoryBroker broker, MessageCodec codec, Function<Object, Object> handler) {
        this.broker = broker;
        this.codec = codec;
        this.handler = handler;
        this.channel = broker.newChannel();
    }

    /**
     * Declares the request queue (shared, durable) and starts answering it.
     *
     * @param broker broker
     * @param codec codec used for both requests and replies
     * @param queue request queue
     * @param handler request payload → reply payload (or {@link #NO_REPLY})
     * @return running responder
     */
    public static ReplyingResponder start(InMemoryBroker broker, MessageCodec codec, String queue,
                                          Function<Object, Object> handler) {
        if (broker == null || codec == null || handler == null) {
            throw new IllegalArgumentException("broker, codec and handler cannot be null");
        }
        ReplyingResponder responder = new ReplyingResponder(broker, codec, handler);
        responder.channel.declareQueue(queue, QueueOptions.durableQueue());
        responder.channel.consume(queue, true, responder::onRequest);
        return responder;
    }

    private void onRequest(InboundMessage request) {
        String correlationId = request.correlationId();
        String replyTo = request.properties().replyTo();
        Object payload = codec.deserialize(request);
        received.add(new ReceivedRequest(payload, correlationId, replyTo,
            replyTo != null && broker.queueExists(replyTo)));

        if (replyTo == null) {
            return;
        }
        Object reply = handler.apply(payload);
        if (reply == NO_REPLY) {
            return;
        }
        sendReply(replyTo, correlationId, reply);
    }

    /**
     * Sends a reply directly, bypassing the handler (duplicate or stray replies).
     *
     * @param replyTo reply queue
     * @param correlationId correlation id to stamp (may be {@code null})
     * @param reply reply payload
     */
    public void sendReply(String replyTo, String correlationId, Object reply) {
        OutboundMessage message = codec.serialize(reply, ProduceOptions.defaults()
            .withPersistent(false)
            .withCorrelation(correlationId, null));
        channel.sendToQueue(replyTo, message);
    }

    public List<ReceivedRequest> received() {
        return List.copyOf(received);
    }

    @Override
    public void close() {
        channel.close();
    }
}

package com.ryuqq.producer.testkit.contract;

import com.ryuqq.producer.adapter.inmemory.broker.InMemoryChannel;
import com.ryuqq.producer.core.contract.ProduceOptions;
import com.ryuqq.producer.core.model.Destination;
import com.ryuqq.producer.core.result.ProduceResult;
import com.ryuqq.producer.runtime.producer.ResilientProducer;
import com.ryuqq.producer.testkit.support.ReplyingResponder;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for Scenario 3: Channel Recovery.
 *
 * <p>When the channel that owns a reply queue closes, the exclusive queue is gone with it.
 * The next RPC must redeclare it on a fresh channel instead of trusting the stale name.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Channel closed between RPCs → reply queue redeclared on the new channel</li>
 *   <li>Channel closed while an RPC waits → caller keeps waiting (no reply timeout)</li>
 *   <li>Channel closed while an RPC waits → reply timeout fails the caller when configured</li>
 * </ul>
 *
 * @author Producer Team
 * @since 1.0.0
 */
class ChannelRecoveryContractTest extends AbstractProducerContractTest {

    private static final String SERVICE = "service-x";

    @Test
    void testChannelClosedBetweenRpcs_ReplyQueueRedeclared() throws Exception {
        // Given
        startResponder(SERVICE, request -> "pong");
        await(producer.produce(SERVICE, "ping", ProduceOptions.rpcDefaults()));
        InMemoryChannel first = channelProvider.current();

        // When: connection drop
        first.close();

        // Then
        assertFalse(broker.queueExists(replyQueueOf(SERVICE)), "Exclusive reply queue dies with its channel");
        assertTrue(producer.getRegistry().responseQueueName(Destination.of(SERVICE)).isEmpty(),
            "Cached reply queue name should be cleared on close");

        assertEquals("pong", await(producer.produce(SERVICE, "ping", ProduceOptions.rpcDefaults())).replyOrNull());
        assertReplyQueueDeclarations(SERVICE, 2);
        assertEquals(2, channelProvider.channelsOpened());
        assertNotSame(first, channelProvider.current());
        assertEquals(1, broker.consumerCount(replyQueueOf(SERVICE)), "Exactly one consumer on the new reply queue");
    }

    @Test
    void testRepeatedChannelLoss_EveryRpcRecovers() throws Exception {
        // Given
        startResponder(SERVICE, request -> request);

        for (int i = 0; i < 3; i++) {
            // When
            Object reply = await(producer.produce(SERVICE, Map.of("round", i), ProduceOptions.rpcDefaults())).replyOrNull();
            channelProvider.current().close();

            // Then
            assertEquals(Map.of("round", i), reply);
        }
        assertReplyQueueDeclarations(SERVICE, 3);
        assertTrue(transport.errors().isEmpty(), "Closing between calls needs no retry");
    }

    @Test
    void testChannelClosedWhileWaiting_CallerKeepsWaiting() throws Exception {
        // Given
        ReplyingResponder responder = startResponder(SERVICE, request -> ReplyingResponder.NO_REPLY);
        CompletableFuture<ProduceResult> future = producer.produce(SERVICE, "ping", ProduceOptions.rpcDefaults());
        awaitUntil(() -> responder.received().size() == 1, "request to arrive");

        // When
        channelProvider.current().close();
        assertTrue(broker.awaitDeliveries(1000));

        // Then
        assertFalse(future.isDone(), "Without a reply timeout the caller waits indefinitely");
        assertEquals(1, producer.getRegistry().pendingCount(Destination.of(SERVICE)));
        assertTrue(transport.errors().isEmpty());
    }

    @Test
    void testChannelClosedWhileWaiting_ReplyTimeoutFailsCaller() throws Exception {
        // Given
        ResilientProducer bounded = newProducer(producerConfig().withReplyTimeoutMs(200));
        ReplyingResponder responder = startResponder(SERVICE, request -> ReplyingResponder.NO_REPLY);
        CompletableFuture<ProduceResult> future = bounded.produce(SERVICE, "ping", ProduceOptions.rpcDefaults());
        awaitUntil(() -> responder.received().size() == 1, "request to arrive");

        // When
        channelProvider.current().close();

        // Then
        ExecutionException failure = assertThrows(ExecutionException.class, () -> await(future));
        assertInstanceOf(TimeoutException.class, failure.getCause());
        assertEquals(0, bounded.getRegistry().pendingCount(Destination.of(SERVICE)), "Timed out waiter is removed");
    }

    @Test
    void testLateReplyAfterTimeout_Ignored() throws Exception {
        // Given
        ResilientProducer bounded = newProducer(producerConfig().withReplyTimeoutMs(100));
        ReplyingResponder responder = startResponder(SERVICE, request -> ReplyingResponder.NO_REPLY);
        CompletableFuture<ProduceResult> future = bounded.produce(SERVICE, "ping", ProduceOptions.rpcDefaults());
        awaitUntil(() -> responder.received().size() == 1, "request to arrive");
        assertThrows(ExecutionException.class, () -> await(future));

        // When
        ReplyingResponder.ReceivedRequest request = responder.received().get(0);
        responder.sendReply(request.replyTo(), request.correlationId(), "too late");
        assertTrue(broker.awaitDeliveries(1000));

        // Then
        assertTrue(transport.inbound(SERVICE).isEmpty(), "Late reply is dropped");
        assertTrue(transport.errors().isEmpty());
    }
}

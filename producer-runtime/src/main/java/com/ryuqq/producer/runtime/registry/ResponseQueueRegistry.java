package com.ryuqq.producer.runtime.registry;

import com.ryuqq.producer.core.contract.InboundMessage;
import com.ryuqq.producer.core.contract.QueueOptions;
import com.ryuqq.producer.core.model.CorrelationId;
import com.ryuqq.producer.core.model.Destination;
import com.ryuqq.producer.core.spi.BrokerChannel;
import com.ryuqq.producer.core.spi.MessageCodec;
import com.ryuqq.producer.core.spi.ProducerTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * RPC 응답 큐 레지스트리.
 *
 * <p>destination마다 채널당 정확히 하나의 exclusive, durable 응답 큐를 보장하고,
 * 들어오는 응답을 correlation id로 올바른 대기자에게 전달합니다.</p>
 *
 * <p><strong>응답 큐 이름:</strong> {@code <destination>:<hostname>:res}</p>
 * <pre>
 * hostname=gateway-http, destination=service-oauth
 *   → service-oauth:gateway-http:res
 * </pre>
 *
 * <p><strong>생명주기:</strong></p>
 * <pre>
 * ensureResponseQueue(channel, D)
 *   ├─ 같은 채널에 캐시된 큐 있음 → 즉시 반환 (네트워크 호출 없음)
 *   └─ 없음 (또는 다른 채널이 선언한 stale 큐)
 *        1. declareQueue(durable, exclusive)
 *        2. consume(noAck) → dispatch
 *        3. queueName 저장
 *        4. channel close 시 queueName 초기화 (다음 RPC에서 재선언)
 * </pre>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>큐 선언은 destination entry 단위로 직렬화되어 중복 선언 없음</li>
 *   <li>대기자 맵은 동시 맵이며, 응답 매칭은 {@code remove}로 원자적으로 한 번만 수행</li>
 *   <li>대기자 등록은 전송 전에 이루어지므로 즉시 도착한 응답도 놓치지 않음</li>
 * </ul>
 *
 * <p>채널이 닫혀도 대기 중인 요청은 실패시키지 않습니다. 응답 제한 시간은 producer 설정으로만 적용됩니다.</p>
 *
 * @author Producer Team
 * @since 1.0.0
 */
public final class ResponseQueueRegistry {

    private static final Logger log = LoggerFactory.getLogger(ResponseQueueRegistry.class);

    static final String TAG = "amqp:producer";
    private static final String RESPONSE_QUEUE_SUFFIX = ":res";

    private final String hostname;
    private final MessageCodec codec;
    private final ProducerTransport transport;
    private final ConcurrentMap<Destination, ResponseQueueEntry> entries = new ConcurrentHashMap<>();

    /**
     * 생성자.
     *
     * @param hostname 응답 큐 구분자
     * @param codec 응답 디코딩용 codec
     * @param transport 수신 로그 sink
     * @throws IllegalArgumentException 인자가 null이거나 hostname이 빈 문자열인 경우
     */
    public ResponseQueueRegistry(String hostname, MessageCodec codec, ProducerTransport transport) {
        if (hostname == null || hostname.isBlank()) {
            throw new IllegalArgumentException("hostname cannot be null or blank");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        this.hostname = hostname;
        this.codec = codec;
        this.transport = transport;
    }

    /**
     * destination의 응답 큐 이름 계산.
     *
     * @param destination 요청 대상
     * @param hostname 호출자 구분자
     * @return {@code <destination>:<hostname>:res}
     */
    public static String responseQueueName(Destination destination, String hostname) {
        return destination.getValue() + ":" + hostname + RESPONSE_QUEUE_SUFFIX;
    }

    /**
     * 응답 큐 확보 (멱등).
     *
     * @param channel 현재 채널
     * @param destination 요청 대상
     * @return 브로커가 보고한 응답 큐 이름
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws com.ryuqq.producer.core.exception.BrokerException 큐 선언 또는 consumer 시작 실패 시
     */
    public String ensureResponseQueue(BrokerChannel channel, Destination destination) {
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        if (destination == null) {
            throw new IllegalArgumentException("destination cannot be null");
        }

        ResponseQueueEntry entry = entryFor(destination);
        synchronized (entry.declareLock()) {
            String cached = entry.queueNameFor(channel);
            if (cached != null) {
                return cached;
            }
            if (entry.isBound()) {
                log.info("Discarding stale response queue {} for {}: owning channel was replaced",
                    entry.queueName(), destination.getValue());
                entry.reset();
            }

            String declared = channel.declareQueue(responseQueueName(destination, hostname), QueueOptions.replyQueue());
            channel.consume(declared, true, message -> dispatch(entry, message));

            // consumer가 붙은 뒤에만 캐시 (실패 시 다음 시도에서 처음부터 재선언)
            entry.bind(channel, declared);
            channel.addCloseListener(() -> onChannelClosed(entry, channel));

            log.info("Response queue {} ready for {}", declared, destination.getValue());
            return declared;
        }
    }

    /**
     * 응답 대기자 등록.
     *
     * <p>반드시 요청 전송 전에 호출해야 합니다.</p>
     *
     * @param destination 요청 대상
     * @param correlationId 요청에 발급한 correlation id
     * @return 응답 payload로 완료되는 future
     * @throws IllegalStateException 같은 correlation id가 이미 대기 중인 경우
     */
    public CompletableFuture<Object> register(Destination destination, CorrelationId correlationId) {
        if (destination == null) {
            throw new IllegalArgumentException("destination cannot be null");
        }
        if (correlationId == null) {
            throw new IllegalArgumentException("correlationId cannot be null");
        }

        PendingReply pending = PendingReply.now(correlationId);
        PendingReply existing = entryFor(destination).pending().putIfAbsent(correlationId.getValue(), pending);
        if (existing != null) {
            throw new IllegalStateException("correlationId already pending: " + correlationId.getValue());
        }
        return pending.future();
    }

    /**
     * 대기자 제거 (전송 실패, 응답 제한 시간 초과).
     *
     * <p>future는 완료시키지 않습니다.</p>
     *
     * @param destination 요청 대상
     * @param correlationId correlation id
     * @return 제거했으면 true
     */
    public boolean cancel(Destination destination, CorrelationId correlationId) {
        ResponseQueueEntry entry = entries.get(destination);
        return entry != null && entry.pending().remove(correlationId.getValue()) != null;
    }

    /**
     * 현재 채널 기준으로 캐시된 응답 큐 이름 조회.
     *
     * @param destination 요청 대상
     * @return 응답 큐 이름 (없으면 empty)
     */
    public Optional<String> responseQueueName(Destination destination) {
        ResponseQueueEntry entry = entries.get(destination);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.queueName());
    }

    /**
     * 대기 중인 요청 수 조회.
     *
     * @param destination 요청 대상
     * @return 대기 중인 요청 수
     */
    public int pendingCount(Destination destination) {
        ResponseQueueEntry entry = entries.get(destination);
        return entry == null ? 0 : entry.pending().size();
    }

    public String getHostname() {
        return hostname;
    }

    private ResponseQueueEntry entryFor(Destination destination) {
        return entries.computeIfAbsent(destination, ResponseQueueEntry::new);
    }

    /**
     * 응답 큐 consumer 콜백.
     *
     * <p>알 수 없거나 이미 처리된 correlation id의 메시지는 조용히 버립니다 (noAck 모드라 별도 ack 없음).</p>
     */
    private void dispatch(ResponseQueueEntry entry, InboundMessage message) {
        String correlationId = message.correlationId();
        if (correlationId == null) {
            log.debug("Dropping reply without correlationId on {}", entry.destination().getValue());
            return;
        }

        PendingReply pending = entry.pending().remove(correlationId);
        if (pending == null) {
            log.debug("Dropping reply for unknown correlationId {} on {}", correlationId, entry.destination().getValue());
            return;
        }

        Object payload;
        try {
            payload = codec.deserialize(message);
        } catch (RuntimeException e) {
            transport.error(TAG, e);
            pending.future().completeExceptionally(e);
            return;
        }

        pending.future().complete(payload);
        transport.info(TAG, "[" + entry.destination().getValue() + "] < ", payload);
    }

    private void onChannelClosed(ResponseQueueEntry entry, BrokerChannel channel) {
        if (entry.resetIfOwnedBy(channel)) {
            log.info("Channel closed, response queue for {} will be redeclared on next RPC", entry.destination().getValue());
        }
    }
}

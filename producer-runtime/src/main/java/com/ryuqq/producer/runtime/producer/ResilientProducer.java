package com.ryuqq.producer.runtime.producer;

import com.ryuqq.producer.core.api.Producer;
import com.ryuqq.producer.core.config.ProducerConfig;
import com.ryuqq.producer.core.contract.OutboundMessage;
import com.ryuqq.producer.core.contract.ProduceOptions;
import com.ryuqq.producer.core.contract.ProduceRequest;
import com.ryuqq.producer.core.exception.ProduceAttemptException;
import com.ryuqq.producer.core.exception.RetryExhaustedException;
import com.ryuqq.producer.core.model.CorrelationId;
import com.ryuqq.producer.core.model.Destination;
import com.ryuqq.producer.core.result.ProduceResult;
import com.ryuqq.producer.core.result.Replied;
import com.ryuqq.producer.core.result.Sent;
import com.ryuqq.producer.core.spi.BrokerChannel;
import com.ryuqq.producer.core.spi.ChannelProvider;
import com.ryuqq.producer.core.spi.Delayer;
import com.ryuqq.producer.core.spi.MessageCodec;
import com.ryuqq.producer.core.spi.ProducerTransport;
import com.ryuqq.producer.core.stage.ProduceStage;
import com.ryuqq.producer.runtime.registry.ResponseQueueRegistry;
import com.ryuqq.producer.runtime.retry.RetryPolicy;
import com.ryuqq.producer.runtime.retry.ScheduledDelayer;
import com.ryuqq.producer.runtime.transport.Slf4jProducerTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * 채널 장애에 자가 복구하는 Producer 구현체.
 *
 * <p>일반 전송과 RPC를 처리하고, 시도 중 어떤 실패가 나도 고정 간격으로 전체 시도를 다시 수행합니다.</p>
 *
 * <p><strong>처리 흐름 (시도 1회):</strong></p>
 * <pre>
 * ACQUIRE     channelProvider.get()
 *   ↓
 * PREPARE     transport.info("[dest] > ", payload) → codec.serialize(payload, options)
 *   ↓
 * (rpc) REPLY_QUEUE
 *             registry.ensureResponseQueue(channel, dest)
 *             correlationId = random
 *             registry.register(dest, correlationId)   ← 전송 전에 등록
 *   ↓
 * ROUTE       MessageRouter.route(...) (rpc면 correlationId / replyTo 부착)
 *   ↓
 * 일반: Sent(accepted) 로 즉시 완료
 * rpc : 응답 수신 시 Replied(payload) 로 완료
 * </pre>
 *
 * <p><strong>재시도:</strong></p>
 * <ul>
 *   <li>ACQUIRE ~ ROUTE 단계 실패 → transport.error → retryDelayMs 대기 → 같은 ProduceRequest로 재시도</li>
 *   <li>기본값은 무제한 재시도 (maxAttempts=0), 지수 백오프 없음</li>
 *   <li>ProduceRequest는 불변이므로 모든 시도에서 같은 내용이 전송됨</li>
 *   <li>응답 대기(AWAITING_REPLY)는 재시도하지 않음</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 각 시도는 워커 스레드 풀에서 실행됩니다. 재시도 대기는 {@link Delayer}의
 * future에 다음 시도를 연결하는 방식이라 대기 중에는 워커 스레드를 점유하지 않습니다.
 * 계속 실패하는 호출이 있어도 다른 호출은 지연되지 않습니다. RPC 응답은 브로커 consumer 스레드에서 완료됩니다.</p>
 *
 * @author Producer Team
 * @since 1.0.0
 */
public final class ResilientProducer implements Producer, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResilientProducer.class);

    public static final String TAG = "amqp:producer";
    private static final long SHUTDOWN_GRACE_SECONDS = 5;

    private final ChannelProvider channelProvider;
    private final MessageCodec codec;
    private final ResponseQueueRegistry registry;
    private final ProducerConfig config;
    private final ProducerTransport transport;
    private final Delayer delayer;
    private final RetryPolicy retryPolicy;
    private final ExecutorService workerExecutor;

    /**
     * 생성자 (SLF4J transport, 스케줄러 기반 delayer 사용).
     *
     * @param channelProvider 연결 관리자
     * @param codec 메시지 codec
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ResilientProducer(ChannelProvider channelProvider, MessageCodec codec, ProducerConfig config) {
        this(channelProvider, codec, config, new Slf4jProducerTransport(), new ScheduledDelayer());
    }

    /**
     * 생성자 (transport / delayer 주입, 레지스트리는 내부 생성).
     *
     * @param channelProvider 연결 관리자
     * @param codec 메시지 codec
     * @param config 설정
     * @param transport 로그 sink
     * @param delayer 재시도 대기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ResilientProducer(ChannelProvider channelProvider, MessageCodec codec, ProducerConfig config,
                             ProducerTransport transport, Delayer delayer) {
        this(channelProvider, codec, newRegistry(config, codec, transport), config, transport, delayer);
    }

    /**
     * 생성자 (모든 의존성 주입).
     *
     * @param channelProvider 연결 관리자
     * @param codec 메시지 codec
     * @param registry 응답 큐 레지스트리
     * @param config 설정
     * @param transport 로그 sink
     * @param delayer 재시도 대기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ResilientProducer(ChannelProvider channelProvider, MessageCodec codec, ResponseQueueRegistry registry,
                             ProducerConfig config, ProducerTransport transport, Delayer delayer) {
        if (channelProvider == null) {
            throw new IllegalArgumentException("channelProvider cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        if (delayer == null) {
            throw new IllegalArgumentException("delayer cannot be null");
        }

        this.channelProvider = channelProvider;
        this.codec = codec;
        this.registry = registry;
        this.config = config;
        this.transport = transport;
        this.delayer = delayer;
        this.retryPolicy = RetryPolicy.from(config);
        this.workerExecutor = Executors.newFixedThreadPool(config.workerThreads());
    }

    @Override
    public CompletableFuture<ProduceResult> produce(String destination, Object payload, ProduceOptions options) {
        return produce(ProduceRequest.of(destination, payload, options));
    }

    /**
     * 이미 만들어진 요청 전송.
     *
     * @param request 전송 요청
     * @return 결과 future
     * @throws IllegalArgumentException request가 null인 경우
     * @throws java.util.concurrent.RejectedExecutionException producer가 닫힌 경우
     */
    public CompletableFuture<ProduceResult> produce(ProduceRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        return CompletableFuture
            .supplyAsync(() -> deliverWithRetry(request, 1), workerExecutor)
            .thenCompose(Function.identity());
    }

    /**
     * 응답 큐 레지스트리 조회.
     *
     * @return 이 producer가 사용하는 레지스트리
     */
    public ResponseQueueRegistry getRegistry() {
        return registry;
    }

    /**
     * Producer 종료 (리소스 정리).
     *
     * <p>워커 스레드 풀을 종료합니다. 재시도 대기 중인 호출은 대기가 끝나면
     * {@link java.util.concurrent.RejectedExecutionException}으로 실패하고,
     * 이미 전송된 RPC의 응답 대기는 영향을 받지 않습니다.</p>
     */
    @Override
    public void close() {
        workerExecutor.shutdown();
        try {
            if (!workerExecutor.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                workerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * 재시도 루프.
     *
     * <p>request는 루프 밖에서 고정되어 모든 시도에 그대로 전달됩니다. 실패하면 delayer의 future가
     * 완료된 뒤 다음 시도를 워커 풀에 다시 제출합니다.</p>
     *
     * @param request 전송 요청
     * @param attempt 이번 시도 번호 (1부터)
     * @return 일반 전송이면 완료된 future, RPC면 응답 대기 future,
     *         maxAttempts가 설정되고 모두 실패하면 RetryExhaustedException으로 실패한 future
     */
    private CompletableFuture<ProduceResult> deliverWithRetry(ProduceRequest request, int attempt) {
        try {
            return attempt(request, attempt);
        } catch (ProduceAttemptException e) {
            transport.error(TAG, e);

            if (retryPolicy.isExhausted(attempt)) {
                log.warn("Giving up on {} after {} attempts", request.destination().getValue(), attempt);
                return CompletableFuture.failedFuture(
                    new RetryExhaustedException(request.destination(), attempt, e.getCause()));
            }
            return delayer.delay(retryPolicy.delayAfter(attempt))
                .thenComposeAsync(elapsed -> deliverWithRetry(request, attempt + 1), workerExecutor);
        }
    }

    /**
     * 시도 1회 (ACQUIRE → PREPARE → [REPLY_QUEUE] → ROUTE).
     *
     * @param request 전송 요청
     * @param attempt 시도 번호
     * @return 결과 future
     * @throws ProduceAttemptException 어느 단계에서든 실패한 경우
     */
    private CompletableFuture<ProduceResult> attempt(ProduceRequest request, int attempt) {
        Destination destination = request.destination();
        ProduceOptions options = request.options();
        ProduceStage stage = ProduceStage.ACQUIRE;

        try {
            BrokerChannel channel = channelProvider.get();

            stage = ProduceStage.PREPARE;
            transport.info(TAG, "[" + destination.getValue() + "] > ", request.payload());
            OutboundMessage message = codec.serialize(request.payload(), options);

            if (!request.isRpc()) {
                stage = ProduceStage.ROUTE;
                boolean accepted = MessageRouter.route(channel, destination, options, message);
                return CompletableFuture.completedFuture(new Sent(destination, accepted));
            }

            stage = ProduceStage.REPLY_QUEUE;
            String replyQueue = registry.ensureResponseQueue(channel, destination);
            CorrelationId correlationId = CorrelationId.random();
            CompletableFuture<Object> reply = registry.register(destination, correlationId);

            stage = ProduceStage.ROUTE;
            try {
                MessageRouter.route(channel, destination, options, message.withReply(correlationId, replyQueue));
            } catch (RuntimeException e) {
                registry.cancel(destination, correlationId);
                throw e;
            }
            return awaitReply(destination, correlationId, reply);

        } catch (RuntimeException e) {
            throw new ProduceAttemptException(destination, stage, attempt, e);
        }
    }

    /**
     * 응답 future를 Replied로 변환 (replyTimeoutMs 설정 시 제한 시간 적용).
     */
    private CompletableFuture<ProduceResult> awaitReply(Destination destination, CorrelationId correlationId,
                                                        CompletableFuture<Object> reply) {
        CompletableFuture<Object> awaited = reply;
        if (config.hasReplyTimeout()) {
            // 대기자 정리가 호출자에게 결과가 전달되기 전에 끝나도록 체인으로 연결
            awaited = reply
                .orTimeout(config.replyTimeoutMs(), TimeUnit.MILLISECONDS)
                .whenComplete((payload, error) -> {
                    if (error != null && registry.cancel(destination, correlationId)) {
                        log.warn("No reply for {} on {} within {}ms",
                            correlationId.getValue(), destination.getValue(), config.replyTimeoutMs());
                    }
                });
        }
        return awaited.thenApply(payload -> new Replied(destination, correlationId, payload));
    }

    private static ResponseQueueRegistry newRegistry(ProducerConfig config, MessageCodec codec, ProducerTransport transport) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return new ResponseQueueRegistry(config.hostname(), codec, transport);
    }
}

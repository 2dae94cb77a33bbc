package com.ryuqq.producer.runtime.registry;

import com.ryuqq.producer.core.model.Destination;
import com.ryuqq.producer.core.spi.BrokerChannel;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * destination 하나의 응답 큐 상태.
 *
 * <p><strong>구성:</strong></p>
 * <ul>
 *   <li>binding: 응답 큐를 선언한 채널과 그 큐 이름 (원자적 참조)</li>
 *   <li>declareLock: 큐 선언 직렬화용 모니터</li>
 *   <li>pending: correlation id → 대기 중인 요청 (동시 맵, 응답 스레드와 공유)</li>
 * </ul>
 *
 * <p>close 콜백은 브로커 I/O 스레드에서 호출되므로 declareLock을 잡지 않고
 * compare-and-set으로만 binding을 비웁니다.</p>
 *
 * <p>binding은 owner 채널이 살아있는 동안 한 번만 설정되고, 채널이 닫히거나 교체되면 비워집니다.
 * entry 자체는 제거되지 않습니다.</p>
 *
 * @author Producer Team
 * @since 1.0.0
 */
final class ResponseQueueEntry {

    private final Destination destination;
    private final Object declareLock = new Object();
    private final AtomicReference<Binding> binding = new AtomicReference<>();
    private final ConcurrentMap<String, PendingReply> pending = new ConcurrentHashMap<>();

    ResponseQueueEntry(Destination destination) {
        this.destination = destination;
    }

    Destination destination() {
        return destination;
    }

    Object declareLock() {
        return declareLock;
    }

    ConcurrentMap<String, PendingReply> pending() {
        return pending;
    }

    /**
     * 주어진 채널이 선언한 응답 큐 이름.
     *
     * @param channel 현재 채널
     * @return 같은 채널이 선언한 큐가 있으면 그 이름, 없으면 null
     */
    String queueNameFor(BrokerChannel channel) {
        Binding current = binding.get();
        return current != null && current.owner() == channel ? current.queueName() : null;
    }

    String queueName() {
        Binding current = binding.get();
        return current == null ? null : current.queueName();
    }

    boolean isBound() {
        return binding.get() != null;
    }

    void bind(BrokerChannel channel, String declaredQueueName) {
        binding.set(new Binding(channel, declaredQueueName));
    }

    /**
     * owner가 주어진 채널일 때만 binding을 비움.
     *
     * <p>이미 새 채널로 다시 선언된 뒤에 도착한 옛 채널의 close 이벤트는 무시됩니다.</p>
     *
     * @param channel 닫힌 채널
     * @return 비웠으면 true
     */
    boolean resetIfOwnedBy(BrokerChannel channel) {
        Binding current = binding.get();
        return current != null && current.owner() == channel && binding.compareAndSet(current, null);
    }

    void reset() {
        binding.set(null);
    }

    private record Binding(BrokerChannel owner, String queueName) {
    }
}

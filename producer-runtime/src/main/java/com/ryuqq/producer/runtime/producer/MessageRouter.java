package com.ryuqq.producer.runtime.producer;

import com.ryuqq.producer.core.contract.OutboundMessage;
import com.ryuqq.producer.core.contract.ProduceOptions;
import com.ryuqq.producer.core.model.Destination;
import com.ryuqq.producer.core.spi.BrokerChannel;

/**
 * 큐 직접 전송 / exchange publish 분기.
 *
 * <p><strong>라우팅 규칙:</strong></p>
 * <ul>
 *   <li>routingKey 있음 → {@code publish(exchange = destination, routingKey)}</li>
 *   <li>routingKey 없음 → {@code sendToQueue(destination)}</li>
 * </ul>
 *
 * <p>재시도 로직 없음. 실패는 그대로 호출자(재시도 루프)에게 전파됩니다.</p>
 *
 * @author Producer Team
 * @since 1.0.0
 */
public final class MessageRouter {

    private MessageRouter() {
    }

    /**
     * 메시지 전송.
     *
     * @param channel 채널
     * @param destination 큐 또는 exchange
     * @param options 전송 옵션 (routingKey 판단용)
     * @param message 인코딩된 메시지
     * @return 채널의 전송 확인 결과
     * @throws com.ryuqq.producer.core.exception.BrokerException 전송 실패 시
     */
    public static boolean route(BrokerChannel channel, Destination destination, ProduceOptions options, OutboundMessage message) {
        if (options.hasRoutingKey()) {
            return channel.publish(destination.getValue(), options.routingKey(), message);
        }
        return channel.sendToQueue(destination.getValue(), message);
    }
}

package com.ryuqq.producer.runtime.producer;

import com.ryuqq.producer.core.contract.MessageProperties;
import com.ryuqq.producer.core.contract.OutboundMessage;
import com.ryuqq.producer.core.contract.ProduceOptions;
import com.ryuqq.producer.core.exception.BrokerException;
import com.ryuqq.producer.core.model.Destination;
import com.ryuqq.producer.core.spi.BrokerChannel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * MessageRouter 유닛 테스트.
 *
 * @author Producer Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class MessageRouterTest {

    @Mock
    private BrokerChannel channel;

    private final OutboundMessage message = new OutboundMessage(
        new byte[] {1, 2, 3},
        MessageProperties.ofContentType("application/octet-stream")
    );

    @Test
    void routingKey_없으면_destination_큐로_직접_전송() {
        // given
        when(channel.sendToQueue("orders", message)).thenReturn(true);

        // when
        boolean accepted = MessageRouter.route(channel, Destination.of("orders"), ProduceOptions.defaults(), message);

        // then
        assertThat(accepted).isTrue();
        verify(channel, never()).publish(anyString(), anyString(), any());
    }

    @Test
    void routingKey_있으면_destination_exchange로_publish() {
        // given
        ProduceOptions options = ProduceOptions.defaults().withRoutingKey("user.created");
        when(channel.publish("events", "user.created", message)).thenReturn(false);

        // when
        boolean accepted = MessageRouter.route(channel, Destination.of("events"), options, message);

        // then
        assertThat(accepted).isFalse();
        verify(channel, never()).sendToQueue(anyString(), any());
    }

    @Test
    void 빈_routingKey는_없는_것으로_취급() {
        // given
        ProduceOptions options = ProduceOptions.defaults().withRoutingKey("");
        when(channel.sendToQueue("orders", message)).thenReturn(true);

        // when
        MessageRouter.route(channel, Destination.of("orders"), options, message);

        // then
        verify(channel).sendToQueue("orders", message);
    }

    @Test
    void 채널_예외는_그대로_전파() {
        // given
        when(channel.sendToQueue("orders", message)).thenThrow(new BrokerException("channel closed"));

        // when & then
        assertThatThrownBy(() -> MessageRouter.route(channel, Destination.of("orders"), ProduceOptions.defaults(), message))
            .isInstanceOf(BrokerException.class)
            .hasMessage("channel closed");
    }
}

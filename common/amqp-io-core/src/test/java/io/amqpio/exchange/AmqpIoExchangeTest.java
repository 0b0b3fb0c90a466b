package io.amqpio.exchange;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import io.amqpio.DeclareFlag;
import io.amqpio.messaging.MessageAttributes;
import io.amqpio.messaging.MessagePublisher;
import io.amqpio.messaging.PayloadCodec;
import io.amqpio.messaging.PublishFlag;
import io.amqpio.naming.NamespaceResolver;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.EnumSet;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class AmqpIoExchangeTest {

    private final Channel channel = mock(Channel.class);
    private final MessagePublisher publisher =
        new MessagePublisher(() -> channel, new PayloadCodec(), false, () -> Duration.ofSeconds(1));

    @Test
    void sendsUnderNamespacedRoutingKey() throws Exception {
        AmqpIoExchange exchange = new AmqpIoExchange(
            "amq.direct", ExchangeKind.DIRECT, DeclareFlag.durable(), new NamespaceResolver("svc-A"), publisher);

        exchange.sendMessage("example-data", "example-route");

        ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
        verify(channel).basicPublish(eq("amq.direct"), eq("svc-A.example-route"), eq(false), eq(false),
            any(AMQP.BasicProperties.class), body.capture());
        assertThat(new String(body.getValue(), StandardCharsets.UTF_8)).isEqualTo("example-data");
    }

    @Test
    void forwardsFlagsAndAttributes() throws Exception {
        AmqpIoExchange exchange = new AmqpIoExchange(
            "amq.topic", ExchangeKind.TOPIC, DeclareFlag.durable(), new NamespaceResolver("svc-B"), publisher);

        exchange.sendMessage("x", "orders.eu", EnumSet.of(PublishFlag.MANDATORY),
            MessageAttributes.builder().messageId("m-9").build());

        ArgumentCaptor<AMQP.BasicProperties> props = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
        verify(channel).basicPublish(eq("amq.topic"), eq("svc-B.orders.eu"), eq(true), eq(false),
            props.capture(), any(byte[].class));
        assertThat(props.getValue().getMessageId()).isEqualTo("m-9");
    }
}

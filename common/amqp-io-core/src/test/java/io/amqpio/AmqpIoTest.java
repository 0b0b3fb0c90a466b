package io.amqpio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.BuiltinExchangeType;
import io.amqpio.config.AmqpIoConfig;
import io.amqpio.config.ConnectionOptions;
import io.amqpio.error.ConnectionException;
import io.amqpio.error.ErrorKind;
import io.amqpio.error.PublishException;
import io.amqpio.exchange.AmqpIoExchange;
import io.amqpio.exchange.ExchangeKind;
import io.amqpio.queue.AmqpIoQueue;
import io.amqpio.queue.Binding;
import io.amqpio.support.BrokerMocks;
import java.io.IOException;
import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class AmqpIoTest {

    private BrokerMocks broker;
    private AmqpIo amqpIo;

    @BeforeEach
    void setUp() {
        broker = new BrokerMocks();
        amqpIo = broker.amqpIo("svc-A");
    }

    @Test
    void startsDisconnectedAndConnectsLazily() throws Exception {
        assertThat(amqpIo.isConnected()).isFalse();

        amqpIo.initQueue("orders");

        assertThat(amqpIo.isConnected()).isTrue();
        verify(broker.factory).newConnection("svc-A");
        verify(broker.channel).confirmSelect();
    }

    @Test
    void connectIsIdempotent() throws Exception {
        amqpIo.connect();
        amqpIo.connect();
        amqpIo.getExchangeDirect();
        amqpIo.initQueue("orders");

        verify(broker.factory, times(1)).newConnection(anyString());
        verify(broker.connection, times(1)).createChannel();
    }

    @Test
    void isConnectedReflectsLiveConnectionState() throws Exception {
        amqpIo.connect();
        broker.connectionOpen.set(false);

        assertThat(amqpIo.isConnected()).isFalse();

        amqpIo.connect();

        verify(broker.factory, times(2)).newConnection("svc-A");
    }

    @Test
    void disconnectIsNoOpWhenNotConnected() throws Exception {
        amqpIo.disconnect();
        amqpIo.close();

        verify(broker.connection, never()).close();
    }

    @Test
    void disconnectClosesConnectionAndNextCallReconnects() throws Exception {
        amqpIo.connect();

        amqpIo.disconnect();

        assertThat(amqpIo.isConnected()).isFalse();
        verify(broker.connection).close();

        amqpIo.getExchangeTopic();

        assertThat(amqpIo.isConnected()).isTrue();
        verify(broker.factory, times(2)).newConnection("svc-A");
    }

    @Test
    void reconnectReusesExplicitlySuppliedOptions() throws Exception {
        ConnectionOptions options = ConnectionOptions.builder().host("rabbit-2").build();
        amqpIo.connect(options);
        amqpIo.disconnect();

        amqpIo.connect();

        verify(broker.factory, times(2)).setHost("rabbit-2");
    }

    @Test
    void connectFailureSurfacesAsConnectionException() throws Exception {
        ConnectException refused = new ConnectException("Connection refused");
        when(broker.factory.newConnection(anyString())).thenThrow(refused);

        assertThatThrownBy(() -> amqpIo.connect())
            .isInstanceOfSatisfying(ConnectionException.class,
                ex -> assertThat(ex.kind()).isEqualTo(ErrorKind.CONNECTION))
            .hasMessageContaining("guest@localhost:5672/")
            .hasCause(refused);
        assertThat(amqpIo.isConnected()).isFalse();
    }

    @Test
    void closeFailureSurfacesAsConnectionException() throws Exception {
        amqpIo.connect();
        doThrow(new IOException("socket closed")).when(broker.connection).close();

        assertThatThrownBy(() -> amqpIo.close()).isInstanceOf(ConnectionException.class);
        assertThat(amqpIo.isConnected()).isFalse();
    }

    @Test
    void reopensChannelClosedByBroker() throws Exception {
        amqpIo.connect();
        broker.channelOpen.set(false);

        amqpIo.initQueue("orders");

        verify(broker.connection, times(2)).createChannel();
        verify(broker.factory, times(1)).newConnection(anyString());
    }

    @Test
    void failsWhenNoChannelIsAvailable() throws Exception {
        when(broker.connection.createChannel()).thenReturn(null);

        assertThatThrownBy(() -> amqpIo.connect())
            .isInstanceOf(ConnectionException.class)
            .hasMessageContaining("No channel available");
    }

    @Test
    void skipsConfirmModeWhenDisabled() throws Exception {
        AmqpIo unconfirmed = broker.amqpIo(
            AmqpIoConfig.builder().instanceName("svc-A").publisherConfirms(false).build());

        unconfirmed.getExchangeDirect().sendMessage("data", "r");

        verify(broker.channel, never()).confirmSelect();
        verify(broker.channel, never()).waitForConfirms(anyLong());
    }

    @Test
    void getExchangeReturnsSameHandleRegardlessOfLaterKind() throws Exception {
        AmqpIoExchange first = amqpIo.getExchange("orders", ExchangeKind.TOPIC);
        AmqpIoExchange second = amqpIo.getExchange("orders", ExchangeKind.FANOUT, DeclareFlag.none());

        assertThat(second).isSameAs(first);
        assertThat(second.kind()).isEqualTo(ExchangeKind.TOPIC);
        verify(broker.channel, times(1))
            .exchangeDeclare("orders", BuiltinExchangeType.TOPIC, true, false, false, null);
    }

    @Test
    void wellKnownExchangesAreDurableAndCached() throws Exception {
        AmqpIoExchange direct = amqpIo.getExchangeDirect();
        AmqpIoExchange topic = amqpIo.getExchangeTopic();
        AmqpIoExchange fanout = amqpIo.getExchangeFanout();

        assertThat(direct.getName()).isEqualTo("amq.direct");
        assertThat(direct.kind()).isEqualTo(ExchangeKind.DIRECT);
        assertThat(topic.getName()).isEqualTo("amq.topic");
        assertThat(topic.kind()).isEqualTo(ExchangeKind.TOPIC);
        assertThat(fanout.getName()).isEqualTo("amq.fanout");
        assertThat(fanout.kind()).isEqualTo(ExchangeKind.FANOUT);
        assertThat(direct.flags()).containsExactly(DeclareFlag.DURABLE);
        assertThat(amqpIo.getExchangeDirect()).isSameAs(direct);
        verify(broker.channel, times(1)).exchangeDeclarePassive("amq.direct");
    }

    @Test
    void initQueueDoesNotDeduplicate() throws Exception {
        AmqpIoQueue first = amqpIo.initQueue("orders");
        AmqpIoQueue second = amqpIo.initQueue("orders");

        assertThat(second).isNotSameAs(first);
        assertThat(second.getName()).isEqualTo(first.getName()).isEqualTo("svc-A.orders");
        verify(broker.channel, times(2)).queueDeclare("svc-A.orders", false, false, false, null);
    }

    @Test
    void initQueueWithFlagsAndArguments() throws Exception {
        amqpIo.initQueue("jobs", DeclareFlag.of(DeclareFlag.DURABLE, DeclareFlag.AUTO_DELETE),
            Map.of("x-max-length", 100));

        verify(broker.channel).queueDeclare("svc-A.jobs", true, false, true, Map.of("x-max-length", 100));
    }

    @Test
    void exposesNameResolution() {
        assertThat(amqpIo.instanceName()).isEqualTo("svc-A");
        assertThat(amqpIo.resolveRouteName("created")).isEqualTo("svc-A.created");
        assertThat(amqpIo.resolveQueueName("orders")).isEqualTo("svc-A.orders");
    }

    @Test
    void declaresBindsAndPublishesWithNamespacedNames() throws Exception {
        AmqpIoQueue queue = amqpIo.initQueue("orders").bindDirect("created");

        amqpIo.getExchangeDirect().sendMessage(Map.of("id", 1), "created");

        assertThat(queue.bindings()).containsExactly(new Binding("amq.direct", "svc-A.created"));
        verify(broker.channel).queueDeclare("svc-A.orders", false, false, false, null);
        verify(broker.channel).queueBind("svc-A.orders", "amq.direct", "svc-A.created");
        ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
        verify(broker.channel).basicPublish(eq("amq.direct"), eq("svc-A.created"), eq(false), eq(false),
            any(AMQP.BasicProperties.class), body.capture());
        assertThat(new String(body.getValue(), StandardCharsets.UTF_8)).isEqualTo("{\"id\":1}");
    }

    @Test
    void publishFailsOnlyWhenBrokerReportsFailure() throws Exception {
        AmqpIoExchange exchange = amqpIo.getExchangeDirect();

        exchange.sendMessage("ok", "created");
        when(broker.channel.waitForConfirms(anyLong())).thenReturn(false);

        assertThatThrownBy(() -> exchange.sendMessage("rejected", "created"))
            .isInstanceOf(PublishException.class);
        verify(broker.channel, times(2)).basicPublish(anyString(), anyString(), anyBoolean(), anyBoolean(), any(),
            any());
    }

    @Test
    void confirmTimeoutFollowsWriteTimeout() throws Exception {
        AmqpIo configured = broker.amqpIo(AmqpIoConfig.builder()
            .instanceName("svc-A")
            .connection(ConnectionOptions.builder().writeTimeout(Duration.ofMillis(1500)).build())
            .build());

        configured.getExchangeFanout().sendMessage("data", "all");

        verify(broker.channel).waitForConfirms(1500L);
    }

    @Test
    void distinctInstancesUseDistinctNames() throws Exception {
        AmqpIo other = broker.amqpIo("svc-B");

        AmqpIoQueue a = amqpIo.initQueue("orders");
        AmqpIoQueue b = other.initQueue("orders");

        assertThat(a.getName()).isNotEqualTo(b.getName());
        assertThat(amqpIo.resolveRouteName("created")).isNotEqualTo(other.resolveRouteName("created"));
    }
}

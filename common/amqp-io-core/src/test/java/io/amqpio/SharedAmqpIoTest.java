package io.amqpio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import io.amqpio.config.AmqpIoConfig;
import io.amqpio.support.BrokerMocks;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SharedAmqpIoTest {

    private BrokerMocks broker;
    private List<AmqpIoConfig> created;

    @BeforeEach
    void setUp() {
        broker = new BrokerMocks();
        created = new ArrayList<>();
        SharedAmqpIo.reset();
        SharedAmqpIo.useFactory(config -> {
            created.add(config);
            AmqpIo amqpIo = broker.amqpIo(config);
            amqpIo.connect();
            return amqpIo;
        });
    }

    @AfterEach
    void tearDown() {
        SharedAmqpIo.reset();
        SharedAmqpIo.useFactory(AmqpIo::open);
    }

    @Test
    void firstAccessCreatesAndConnectsOneInstance() {
        SharedAmqpIo.configure(AmqpIoConfig.builder().instanceName("svc-A").build());

        AmqpIo first = SharedAmqpIo.instance();
        AmqpIo second = SharedAmqpIo.instance();

        assertThat(second).isSameAs(first);
        assertThat(first.instanceName()).isEqualTo("svc-A");
        assertThat(first.isConnected()).isTrue();
        assertThat(created).hasSize(1);
    }

    @Test
    void fallsBackToDefaultsWithoutConfiguration() {
        assertThat(SharedAmqpIo.isInitialised()).isFalse();

        AmqpIo amqpIo = SharedAmqpIo.instance();

        assertThat(amqpIo.instanceName()).isEqualTo(AmqpIoConfig.DEFAULT_INSTANCE_NAME);
        assertThat(SharedAmqpIo.isInitialised()).isTrue();
    }

    @Test
    void rejectsConfigurationAfterFirstAccess() {
        SharedAmqpIo.instance();

        assertThatThrownBy(() -> SharedAmqpIo.configure(AmqpIoConfig.builder().instanceName("late").build()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("unknown");
    }

    @Test
    void shutdownCloseLogsInsteadOfThrowing() throws Exception {
        AmqpIo amqpIo = broker.amqpIo("svc-A");
        amqpIo.connect();
        doThrow(new IOException("socket closed")).when(broker.connection).close();

        assertThatCode(() -> SharedAmqpIo.closeOnShutdown(amqpIo)).doesNotThrowAnyException();
        verify(broker.connection).close();
        assertThat(amqpIo.isConnected()).isFalse();
    }

    @Test
    void resetDisconnectsAndAllowsReconfiguration() {
        SharedAmqpIo.configure(AmqpIoConfig.builder().instanceName("svc-A").build());
        AmqpIo first = SharedAmqpIo.instance();

        SharedAmqpIo.reset();
        SharedAmqpIo.configure(AmqpIoConfig.builder().instanceName("svc-B").build());
        AmqpIo second = SharedAmqpIo.instance();

        assertThat(first.isConnected()).isFalse();
        assertThat(second).isNotSameAs(first);
        assertThat(second.instanceName()).isEqualTo("svc-B");
    }
}

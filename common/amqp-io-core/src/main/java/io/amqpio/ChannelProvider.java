package io.amqpio;

import com.rabbitmq.client.Channel;

/**
 * Hands out the single channel of a connection manager, connecting first when needed.
 */
@FunctionalInterface
public interface ChannelProvider {

    /**
     * Returns an open channel.
     *
     * @throws io.amqpio.error.ConnectionException if the connection or channel cannot be opened
     */
    Channel channel();
}

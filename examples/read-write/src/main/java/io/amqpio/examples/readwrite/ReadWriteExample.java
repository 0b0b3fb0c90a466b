package io.amqpio.examples.readwrite;

import io.amqpio.AmqpIo;
import io.amqpio.SharedAmqpIo;
import io.amqpio.config.AmqpIoConfig;
import io.amqpio.queue.AmqpIoQueue;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Declares a queue, binds it to {@code amq.direct}, publishes one message through the same route
 * and consumes it back.
 */
public final class ReadWriteExample {

    private static final Logger log = LoggerFactory.getLogger(ReadWriteExample.class);

    static final String CONFIG_RESOURCE = "amqpio.properties";
    static final String QUEUE = "example-queue";
    static final String ROUTE = "example-route";

    private final AmqpIo amqpIo;

    public ReadWriteExample(AmqpIo amqpIo) {
        this.amqpIo = Objects.requireNonNull(amqpIo, "amqpIo");
    }

    /**
     * Publishes {@code payload} and returns the body of the first message read from the queue.
     */
    public String run(Object payload) {
        AmqpIoQueue queue = amqpIo.initQueue(QUEUE).bindDirect(ROUTE);
        amqpIo.getExchangeDirect().sendMessage(payload, ROUTE);

        AtomicReference<String> received = new AtomicReference<>();
        queue.consume((delivery, q) -> {
            log.info("We got {}", delivery.bodyAsString());
            q.ack(delivery.deliveryTag());
            received.set(delivery.bodyAsString());
            return false;
        });
        return received.get();
    }

    public static void main(String[] args) {
        SharedAmqpIo.configure(AmqpIoConfig.load(CONFIG_RESOURCE));
        try {
            new ReadWriteExample(SharedAmqpIo.instance()).run(args.length > 0 ? args[0] : "example-data");
        } finally {
            SharedAmqpIo.reset();
        }
    }
}

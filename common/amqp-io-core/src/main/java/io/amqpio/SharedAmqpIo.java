package io.amqpio;

import io.amqpio.config.AmqpIoConfig;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide {@link AmqpIo} for code that cannot pass a manager around.
 *
 * <p>Call {@link #configure(AmqpIoConfig)} once at start-up; the first {@link #instance()} then
 * creates and connects the manager and every later call returns the same one. Without a prior
 * {@code configure} the defaults of {@link AmqpIoConfig#defaults()} apply. Configuring after the
 * instance exists is rejected rather than silently ignored. The shared manager is disconnected by a
 * JVM shutdown hook.
 */
public final class SharedAmqpIo {

    private static final Logger log = LoggerFactory.getLogger(SharedAmqpIo.class);

    private static Function<AmqpIoConfig, AmqpIo> factory = AmqpIo::open;
    private static AmqpIoConfig config;
    private static AmqpIo instance;
    private static Thread shutdownHook;

    private SharedAmqpIo() {
    }

    public static synchronized void configure(AmqpIoConfig newConfig) {
        Objects.requireNonNull(newConfig, "config");
        if (instance != null) {
            throw new IllegalStateException(
                "Shared AmqpIo for instance '" + instance.instanceName() + "' already exists; configure it before first use");
        }
        config = newConfig;
    }

    public static synchronized AmqpIo instance() {
        if (instance == null) {
            AmqpIoConfig effective = config != null ? config : AmqpIoConfig.defaults();
            AmqpIo created = factory.apply(effective);
            Thread hook = new Thread(() -> closeOnShutdown(created), "amqp-io-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);
            instance = created;
            shutdownHook = hook;
            log.info("Created shared AmqpIo for instance {}", effective.instanceName());
        }
        return instance;
    }

    public static synchronized boolean isInitialised() {
        return instance != null;
    }

    /**
     * Closes the shared manager, if any, and forgets it together with its configuration.
     */
    public static synchronized void reset() {
        AmqpIo current = instance;
        Thread hook = shutdownHook;
        instance = null;
        shutdownHook = null;
        config = null;
        if (hook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException ex) {
                log.debug("JVM is shutting down; shutdown hook left in place");
            }
        }
        if (current != null) {
            current.close();
        }
    }

    static void closeOnShutdown(AmqpIo amqpIo) {
        try {
            amqpIo.close();
        } catch (RuntimeException ex) {
            log.warn("Cannot close shared AmqpIo for instance {} on shutdown", amqpIo.instanceName(), ex);
        }
    }

    static synchronized void useFactory(Function<AmqpIoConfig, AmqpIo> newFactory) {
        factory = Objects.requireNonNull(newFactory, "factory");
    }
}

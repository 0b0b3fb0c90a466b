package io.amqpio.error;

import java.util.Objects;

/**
 * Base type for every failure surfaced by the facade. Callers that need to react per category
 * switch on {@link #kind()}.
 */
public abstract class AmqpIoException extends RuntimeException {

    private final ErrorKind kind;

    protected AmqpIoException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    protected AmqpIoException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }
}

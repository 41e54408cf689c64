package com.iterharness.core.error;

/**
 * Structured failure raised by harness components: a kind, a message and an optional cause.
 */
public class HarnessException extends RuntimeException {

    private final ErrorKind kind;

    public HarnessException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public HarnessException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public static HarnessException skip(String reason) {
        return new HarnessException(ErrorKind.ENVIRONMENT_SKIP, reason);
    }

    @Override
    public String toString() {
        return "HarnessException[" + kind + "]: " + getMessage();
    }
}

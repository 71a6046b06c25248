package io.github.drompincen.taskboard.engine.backend;

import java.util.concurrent.CompletionException;

public class BackendException extends RuntimeException {

    private final FailureKind kind;

    public BackendException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public BackendException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }

    /**
     * Unwraps a future's failure into a {@link BackendException}. Anything that is not already one is
     * treated as a network failure.
     */
    public static BackendException from(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof BackendException be) {
            return be;
        }
        return new BackendException(FailureKind.NETWORK_FAILURE,
                cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName(), cause);
    }
}

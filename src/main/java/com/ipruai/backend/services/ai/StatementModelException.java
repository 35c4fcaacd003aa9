package com.ipruai.backend.services.ai;

public class StatementModelException extends RuntimeException {

    private final boolean timedOut;
    private final boolean retryable;

    public StatementModelException(String message, boolean timedOut, boolean retryable, Throwable cause) {
        super(message, cause);
        this.timedOut = timedOut;
        this.retryable = retryable;
    }

    public StatementModelException(String message) {
        this(message, false, false, null);
    }

    public static StatementModelException unavailable(String reason) {
        return new StatementModelException("statement model unavailable: " + reason);
    }

    public static StatementModelException timeout(long timeoutMs) {
        return new StatementModelException("statement model timed out after " + timeoutMs + "ms", true, true, null);
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    public boolean isRetryable() {
        return retryable;
    }
}

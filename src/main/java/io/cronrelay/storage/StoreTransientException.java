package io.cronrelay.storage;

/**
 * A transient store failure that outlasted the bounded retry budget.
 */
public final class StoreTransientException extends StoreException {
    private final int attempts;

    public StoreTransientException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}

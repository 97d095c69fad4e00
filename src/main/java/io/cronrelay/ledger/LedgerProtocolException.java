package io.cronrelay.ledger;

/**
 * The ledger was used out of order, or a freshly written entry could not be read back.
 */
public final class LedgerProtocolException extends RuntimeException {
    public LedgerProtocolException(String message) {
        super(message);
    }
}

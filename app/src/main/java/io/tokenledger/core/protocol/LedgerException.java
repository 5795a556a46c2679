package io.tokenledger.core.protocol;

/**
 * Raised synchronously by every failing ledger operation. A ledger that threw this
 * is in exactly the state it was in before the call.
 */
public final class LedgerException extends RuntimeException {
    private final LedgerError error;

    public LedgerException(LedgerError error, String message) {
        super(message);
        this.error = error;
    }

    public LedgerException(LedgerError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public LedgerError error() { return error; }

    @Override public String toString() {
        return "ERR[" + error + "]: " + getMessage();
    }
}

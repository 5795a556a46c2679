package io.tokenledger.core.protocol;

public enum LedgerError {
    INVALID_TARGET,
    TOKEN_EXISTS,
    NONEXISTENT_TOKEN,
    OWNERSHIP_MISMATCH,
    NOT_AUTHORIZED,
    TRANSFER_REJECTED
}

package io.tokenledger.core.receiver;

import io.tokenledger.core.protocol.TokenId;

/** Ordinary accounts cannot run code, so they take whatever they are sent. */
public enum PlainAccountReceiver implements TokenReceiver {
    INSTANCE;

    @Override
    public boolean onTokenReceived(String operator, String from, TokenId tokenId, byte[] data) {
        return true;
    }
}

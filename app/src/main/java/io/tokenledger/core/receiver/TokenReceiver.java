package io.tokenledger.core.receiver;

import io.tokenledger.core.protocol.TokenId;

/**
 * Recipient-side acceptance hook consulted by safe transfers and safe mints.
 * Returning false, or throwing, refuses the token.
 */
@FunctionalInterface
public interface TokenReceiver {
    boolean onTokenReceived(String operator, String from, TokenId tokenId, byte[] data);
}

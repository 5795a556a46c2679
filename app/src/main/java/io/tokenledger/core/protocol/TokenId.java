package io.tokenledger.core.protocol;

import java.math.BigInteger;

/**
 * Unsigned 256-bit token identifier.
 */
public final class TokenId implements Comparable<TokenId> {
    private final BigInteger value;

    private TokenId(BigInteger value) {
        if (value == null) {
            throw new IllegalArgumentException("Token id required");
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Token id must be >= 0");
        }
        if (value.compareTo(ProtocolLimits.MAX_TOKEN_ID) > 0) {
            throw new IllegalArgumentException("Token id exceeds " + ProtocolLimits.TOKEN_ID_BITS + " bits");
        }
        this.value = value;
    }

    public static TokenId of(long id) { return new TokenId(BigInteger.valueOf(id)); }
    public static TokenId of(BigInteger id) { return new TokenId(id); }

    /** Accepts decimal or 0x-prefixed hex. */
    public static TokenId parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Token id required");
        }
        String t = text.trim();
        try {
            if (t.startsWith("0x") || t.startsWith("0X")) {
                return new TokenId(new BigInteger(t.substring(2), 16));
            }
            return new TokenId(new BigInteger(t));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed token id: " + text, e);
        }
    }

    public BigInteger value() { return value; }

    @Override public int compareTo(TokenId o) { return value.compareTo(o.value); }
    @Override public boolean equals(Object o) { return o instanceof TokenId && value.equals(((TokenId) o).value); }
    @Override public int hashCode() { return value.hashCode(); }
    @Override public String toString() { return value.toString(); }
}

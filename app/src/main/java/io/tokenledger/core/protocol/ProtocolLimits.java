package io.tokenledger.core.protocol;

import java.math.BigInteger;

public final class ProtocolLimits {
    private ProtocolLimits(){}

    public static final int MAX_ADDRESS_LEN = 128;         // sanity cap
    public static final int MIN_ADDRESS_LEN = 3;
    public static final int TOKEN_ID_BITS = 256;           // uint256
    public static final BigInteger MAX_TOKEN_ID = BigInteger.ONE.shiftLeft(TOKEN_ID_BITS).subtract(BigInteger.ONE);
}

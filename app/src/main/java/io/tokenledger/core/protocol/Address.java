package io.tokenledger.core.protocol;

import java.util.Locale;

/**
 * Account identifiers are plain strings. The all-zero address is the "no account" sentinel.
 */
public final class Address {
    private Address(){}

    public static final String ZERO = "0x0000000000000000000000000000000000000000";

    public static boolean isZero(String addr) {
        if (addr == null || addr.isBlank()) return true;
        return ZERO.equals(addr.toLowerCase(Locale.ROOT));
    }

    public static boolean isValid(String addr) {
        if (isZero(addr)) return false;
        int len = addr.length();
        if (len < ProtocolLimits.MIN_ADDRESS_LEN || len > ProtocolLimits.MAX_ADDRESS_LEN) return false;
        // hex-ish guard plus the separators used by aliases
        for (int i = 0; i < len; i++) {
            char c = addr.charAt(i);
            boolean ok = (c >= '0' && c <= '9') || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')
                    || c == '_' || c == '-' || c == ':';
            if (!ok) return false;
        }
        return true;
    }

    /** Maps null/blank onto {@link #ZERO} so queries never hand out null. */
    public static String orZero(String addr) {
        return isZero(addr) ? ZERO : addr;
    }
}

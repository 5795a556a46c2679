package io.tokenledger.core.protocol;

/**
 * Capability identifiers answered by the introspection query.
 * An identifier is the XOR of the 4-byte selectors of the interface's functions.
 */
public final class InterfaceIds {
    private InterfaceIds(){}

    /** Base introspection: supportsInterface(bytes4). */
    public static final int INTROSPECTION = 0x01ffc9a7;

    /** Token ledger: balanceOf, ownerOf, approve, getApproved, setApprovalForAll, isApprovedForAll, transfers. */
    public static final int TOKEN_LEDGER = 0x80ac58cd;

    /** Reserved by the introspection standard, never supported. */
    public static final int INVALID = 0xffffffff;

    public static boolean isSupported(int interfaceId) {
        return interfaceId == INTROSPECTION || interfaceId == TOKEN_LEDGER;
    }

    /**
     * Hex form ("0x80ac58cd"). Anything that is not exactly four bytes of hex is simply unsupported.
     */
    public static boolean isSupported(String interfaceId) {
        if (interfaceId == null) return false;
        String hex = interfaceId.trim();
        if (hex.startsWith("0x") || hex.startsWith("0X")) {
            hex = hex.substring(2);
        }
        if (hex.length() != 8) return false;
        for (int i = 0; i < hex.length(); i++) {
            if (Character.digit(hex.charAt(i), 16) < 0) return false;
        }
        return isSupported((int) Long.parseLong(hex, 16));
    }

    public static String hex(int interfaceId) {
        return String.format("0x%08x", interfaceId);
    }
}

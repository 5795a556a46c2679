package io.tokenledger.core.state;

import io.tokenledger.core.protocol.Address;
import io.tokenledger.core.protocol.TokenId;

import java.util.Objects;

/**
 * One ownership mutation of a single token. Applying a change records the approval it
 * displaced so that {@link OwnershipStore#revert(OwnershipChange)} can restore it exactly.
 */
public final class OwnershipChange {

    public enum Kind { MINT, TRANSFER, BURN }

    private final Kind kind;
    private final TokenId tokenId;
    private final String from;            // ZERO for mint
    private final String to;              // ZERO for burn
    private final String priorApproval;   // null until applied

    private OwnershipChange(Kind kind, TokenId tokenId, String from, String to, String priorApproval) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.tokenId = Objects.requireNonNull(tokenId, "tokenId");
        this.from = Address.orZero(from);
        this.to = Address.orZero(to);
        this.priorApproval = priorApproval;
    }

    public static OwnershipChange mint(TokenId tokenId, String to) {
        return new OwnershipChange(Kind.MINT, tokenId, Address.ZERO, to, null);
    }

    public static OwnershipChange transfer(TokenId tokenId, String from, String to) {
        return new OwnershipChange(Kind.TRANSFER, tokenId, from, to, null);
    }

    public static OwnershipChange burn(TokenId tokenId, String owner) {
        return new OwnershipChange(Kind.BURN, tokenId, owner, Address.ZERO, null);
    }

    OwnershipChange applied(String approvalBefore) {
        return new OwnershipChange(kind, tokenId, from, to, Address.orZero(approvalBefore));
    }

    public Kind kind() { return kind; }
    public TokenId tokenId() { return tokenId; }
    public String from() { return from; }
    public String to() { return to; }
    public boolean isApplied() { return priorApproval != null; }

    /** Approval in force before this change was applied; ZERO if there was none. */
    public String priorApproval() { return priorApproval; }

    @Override public String toString() {
        return kind + "(" + tokenId + ": " + from + " -> " + to + ")";
    }
}

package io.tokenledger.core.state;

import io.tokenledger.core.protocol.TokenId;

import java.util.Map;
import java.util.Optional;

/**
 * Token ownership state: owners, balances, single-token approvals and operator approvals.
 * Callers are expected to have validated a change before applying it; the store only guards
 * its own invariants.
 */
public interface OwnershipStore {
    Optional<String> getOwner(TokenId tokenId);
    long getBalance(String address);

    /** Current approval, or ZERO when none. Caller checks existence first. */
    String getApproval(TokenId tokenId);
    void setApproval(TokenId tokenId, String approved);

    boolean isOperator(String owner, String operator);
    void setOperator(String owner, String operator, boolean approved);

    /** Number of tokens currently in existence. */
    long totalSupply();

    /** Apply a mint/transfer/burn; returns the change with the displaced approval recorded. */
    OwnershipChange apply(OwnershipChange change);

    /** Undo an applied change (inverse of apply). */
    void revert(OwnershipChange applied);

    /** Copy of the token -> owner map (audits). */
    Map<TokenId, String> ownersSnapshot();

    /** Copy of the incrementally maintained balances (audits). */
    Map<String, Long> balancesSnapshot();
}

package io.tokenledger.core.state;

import io.tokenledger.core.protocol.Address;
import io.tokenledger.core.protocol.TokenId;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory implementation of OwnershipStore.
 * Balances are kept incrementally next to the owner map; zero balances are dropped.
 */
public final class InMemoryOwnershipStore implements OwnershipStore {

    private final Map<TokenId, String> owners    = new HashMap<>();
    private final Map<String, Long> balances     = new HashMap<>();
    private final Map<TokenId, String> approvals = new HashMap<>();
    private final Map<String, Set<String>> operators = new HashMap<>();

    @Override
    public synchronized Optional<String> getOwner(TokenId tokenId) {
        return Optional.ofNullable(owners.get(tokenId));
    }

    @Override
    public synchronized long getBalance(String address) {
        return balances.getOrDefault(address, 0L);
    }

    @Override
    public synchronized String getApproval(TokenId tokenId) {
        return approvals.getOrDefault(tokenId, Address.ZERO);
    }

    @Override
    public synchronized void setApproval(TokenId tokenId, String approved) {
        if (!owners.containsKey(tokenId)) {
            throw new IllegalStateException("Approval for unknown token " + tokenId);
        }
        if (Address.isZero(approved)) {
            approvals.remove(tokenId);
        } else {
            approvals.put(tokenId, approved);
        }
    }

    @Override
    public synchronized boolean isOperator(String owner, String operator) {
        Set<String> ops = operators.get(owner);
        return ops != null && ops.contains(operator);
    }

    @Override
    public synchronized void setOperator(String owner, String operator, boolean approved) {
        if (approved) {
            operators.computeIfAbsent(owner, k -> new HashSet<>()).add(operator);
            return;
        }
        Set<String> ops = operators.get(owner);
        if (ops != null) {
            ops.remove(operator);
            if (ops.isEmpty()) operators.remove(owner);
        }
    }

    @Override
    public synchronized long totalSupply() {
        return owners.size();
    }

    @Override
    public synchronized OwnershipChange apply(OwnershipChange change) {
        TokenId id = change.tokenId();
        String current = owners.get(id);
        switch (change.kind()) {
            case MINT:
                if (current != null) {
                    throw new IllegalStateException("Token " + id + " already owned during mint");
                }
                owners.put(id, change.to());
                adjustBalance(change.to(), 1);
                return change.applied(Address.ZERO);
            case TRANSFER: {
                if (!change.from().equals(current)) {
                    throw new IllegalStateException("Token " + id + " not owned by " + change.from());
                }
                String prior = approvals.remove(id);
                owners.put(id, change.to());
                adjustBalance(change.from(), -1);
                adjustBalance(change.to(), 1);
                return change.applied(prior);
            }
            case BURN: {
                if (!change.from().equals(current)) {
                    throw new IllegalStateException("Token " + id + " not owned by " + change.from());
                }
                String prior = approvals.remove(id);
                owners.remove(id);
                adjustBalance(change.from(), -1);
                return change.applied(prior);
            }
            default:
                throw new IllegalArgumentException("Unknown change kind " + change.kind());
        }
    }

    @Override
    public synchronized void revert(OwnershipChange applied) {
        if (!applied.isApplied()) {
            throw new IllegalArgumentException("Change was never applied: " + applied);
        }
        TokenId id = applied.tokenId();
        String current = owners.get(id);
        String expected = applied.kind() == OwnershipChange.Kind.BURN ? null : applied.to();
        if (!Objects.equals(current, expected)) {
            throw new IllegalStateException("Token " + id + " moved since " + applied + " was applied");
        }
        // reverse the apply effect
        switch (applied.kind()) {
            case MINT:
                owners.remove(id);
                approvals.remove(id);
                adjustBalance(applied.to(), -1);
                break;
            case TRANSFER:
                owners.put(id, applied.from());
                adjustBalance(applied.to(), -1);
                adjustBalance(applied.from(), 1);
                restoreApproval(id, applied.priorApproval());
                break;
            case BURN:
                owners.put(id, applied.from());
                adjustBalance(applied.from(), 1);
                restoreApproval(id, applied.priorApproval());
                break;
            default:
                throw new IllegalArgumentException("Unknown change kind " + applied.kind());
        }
    }

    @Override
    public synchronized Map<TokenId, String> ownersSnapshot() {
        return new HashMap<>(owners);
    }

    @Override
    public synchronized Map<String, Long> balancesSnapshot() {
        return new HashMap<>(balances);
    }

    private void restoreApproval(TokenId id, String approval) {
        if (Address.isZero(approval)) {
            approvals.remove(id);
        } else {
            approvals.put(id, approval);
        }
    }

    private void adjustBalance(String address, long delta) {
        long next = getBalance(address) + delta;
        if (next < 0) {
            throw new IllegalStateException("Negative balance for " + address);
        }
        if (next == 0) {
            balances.remove(address);
        } else {
            balances.put(address, next);
        }
    }
}

package io.tokenledger.core.ledger;

import io.tokenledger.core.config.LedgerConfig;
import io.tokenledger.core.metrics.LedgerMetrics;
import io.tokenledger.core.protocol.Address;
import io.tokenledger.core.protocol.InterfaceIds;
import io.tokenledger.core.protocol.LedgerError;
import io.tokenledger.core.protocol.LedgerException;
import io.tokenledger.core.protocol.TokenId;
import io.tokenledger.core.receiver.AcceptanceCheck;
import io.tokenledger.core.receiver.ReceiverDirectory;
import io.tokenledger.core.state.InMemoryOwnershipStore;
import io.tokenledger.core.state.OwnershipChange;
import io.tokenledger.core.state.OwnershipStore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * The single authority over token ownership. Every public operation holds the ledger monitor
 * for its whole duration, so operations never interleave and a failed operation leaves no trace.
 */
public final class TokenLedger {
    private static final Logger LOG = Logger.getLogger(TokenLedger.class.getName());

    static final String INVALID_TOKEN = "invalid token ID";
    static final String NOT_OWNER_OR_APPROVED = "caller is not token owner or approved";
    static final String APPROVE_NOT_OWNER = "approve caller is not token owner or approved for all";
    static final String LOCKED_DURING_CHECK = "ledger is locked while a receiver check runs";

    private final LedgerConfig config;
    private final OwnershipStore store;
    private final AcceptanceCheck acceptance;
    private final LedgerMetrics metrics;

    // set while a receiver hook runs; only the thread holding the monitor can see it true
    private boolean receiverCheckRunning;

    public TokenLedger(LedgerConfig config, OwnershipStore store, ReceiverDirectory receivers, LedgerMetrics metrics) {
        this.config = config != null ? config : LedgerConfig.defaultLocal();
        this.store = store;
        this.metrics = metrics;
        this.acceptance = new AcceptanceCheck(receivers, metrics);
    }

    /** Convenience factory: in-memory store, every account a plain account. */
    public static TokenLedger inMemory(LedgerConfig config) {
        return inMemory(config, ReceiverDirectory.plainAccountsOnly());
    }

    public static TokenLedger inMemory(LedgerConfig config, ReceiverDirectory receivers) {
        return new TokenLedger(config, new InMemoryOwnershipStore(), receivers, new LedgerMetrics());
    }

    // -------------------- metadata --------------------

    public String name() { return config.name; }
    public String symbol() { return config.symbol; }

    public synchronized String tokenURI(TokenId id) {
        requireOwner(id);
        if (config.baseUri.isEmpty()) {
            return "";
        }
        return config.baseUri + id.value().toString();
    }

    public boolean supportsInterface(int interfaceId) {
        return InterfaceIds.isSupported(interfaceId);
    }

    public boolean supportsInterface(String interfaceId) {
        return InterfaceIds.isSupported(interfaceId);
    }

    // -------------------- queries --------------------

    public synchronized String ownerOf(TokenId id) {
        return requireOwner(id);
    }

    public synchronized long balanceOf(String account) {
        if (Address.isZero(account)) {
            throw fail(LedgerError.INVALID_TARGET, "address zero is not a valid owner");
        }
        return store.getBalance(account);
    }

    /** The approved account, or {@link Address#ZERO} when none is set. */
    public synchronized String getApproved(TokenId id) {
        requireOwner(id);
        return store.getApproval(id);
    }

    public synchronized boolean isApprovedForAll(String owner, String operator) {
        if (Address.isZero(owner) || Address.isZero(operator)) {
            return false;
        }
        return store.isOperator(owner, operator);
    }

    public synchronized long totalSupply() {
        return store.totalSupply();
    }

    // -------------------- minting / burning --------------------

    public synchronized void mint(String to, TokenId id) {
        requireNoReceiverCheck();
        applyMint(to, id);
        metrics.incrementMinted();
    }

    public synchronized void safeMint(String to, TokenId id) {
        safeMint(to, id, new byte[0]);
    }

    /** Mint, then ask the recipient; a refusal undoes the mint. */
    public synchronized void safeMint(String to, TokenId id, byte[] data) {
        requireNoReceiverCheck();
        OwnershipChange applied = applyMint(to, id);
        try {
            runReceiverCheck(Address.ZERO, Address.ZERO, to, id, data);
        } catch (RuntimeException e) {
            store.revert(applied);
            if (e instanceof LedgerException) {
                metrics.recordFailure(((LedgerException) e).error());
            }
            throw e;
        }
        metrics.incrementMinted();
    }

    public synchronized void burn(String caller, TokenId id) {
        requireNoReceiverCheck();
        String owner = requireOwner(id);
        if (!isOwnerOrApproved(caller, owner, id)) {
            throw fail(LedgerError.NOT_AUTHORIZED, NOT_OWNER_OR_APPROVED);
        }
        store.apply(OwnershipChange.burn(id, owner));
        metrics.incrementBurned();
        LOG.fine("Burned token " + id + " of " + owner);
    }

    // -------------------- approvals --------------------

    public synchronized void approve(String caller, String to, TokenId id) {
        requireNoReceiverCheck();
        String owner = requireOwner(id);
        if (!owner.equals(caller) && !store.isOperator(owner, caller)) {
            throw fail(LedgerError.NOT_AUTHORIZED, APPROVE_NOT_OWNER);
        }
        store.setApproval(id, to);
        LOG.fine("Approval for token " + id + " -> " + Address.orZero(to));
    }

    public synchronized void setApprovalForAll(String owner, String operator, boolean approved) {
        requireNoReceiverCheck();
        if (Address.isZero(owner) || Address.isZero(operator)) {
            throw fail(LedgerError.INVALID_TARGET, "operator approval requires real accounts");
        }
        if (owner.equals(operator)) {
            throw fail(LedgerError.INVALID_TARGET, "approve to caller");
        }
        store.setOperator(owner, operator, approved);
        LOG.fine("Operator " + operator + " for " + owner + " = " + approved);
    }

    // -------------------- transfers --------------------

    public synchronized void transferFrom(String caller, String from, String to, TokenId id) {
        requireNoReceiverCheck();
        applyTransfer(caller, from, to, id);
        metrics.incrementTransferred();
    }

    public synchronized void safeTransferFrom(String caller, String from, String to, TokenId id) {
        safeTransferFrom(caller, from, to, id, new byte[0]);
    }

    /**
     * Transfer, then ask the recipient. The transfer stays staged in the store while the
     * recipient runs and is reverted if it refuses, throws, or is unreachable. The recipient
     * may read the ledger but every mutating call it makes fails, so the staged transfer is
     * the only change to undo.
     */
    public synchronized void safeTransferFrom(String caller, String from, String to, TokenId id, byte[] data) {
        requireNoReceiverCheck();
        OwnershipChange applied = applyTransfer(caller, from, to, id);
        try {
            runReceiverCheck(caller, from, to, id, data);
        } catch (RuntimeException e) {
            store.revert(applied);
            if (e instanceof LedgerException) {
                metrics.recordFailure(((LedgerException) e).error());
            }
            LOG.fine("Reverted " + applied);
            throw e;
        }
        metrics.incrementTransferred();
    }

    // -------------------- audit --------------------

    /**
     * Recount every balance from the owner map and compare it with the maintained balances.
     * Returns the accounts that disagree; empty when the ledger is consistent.
     */
    public synchronized List<String> auditBalances() {
        Map<String, Long> recount = new HashMap<>();
        for (String owner : store.ownersSnapshot().values()) {
            recount.merge(owner, 1L, Long::sum);
        }
        Map<String, Long> maintained = store.balancesSnapshot();

        Set<String> accounts = new HashSet<>(recount.keySet());
        accounts.addAll(maintained.keySet());
        List<String> mismatched = new ArrayList<>();
        for (String account : accounts) {
            long expected = recount.getOrDefault(account, 0L);
            long actual = maintained.getOrDefault(account, 0L);
            if (expected != actual) {
                mismatched.add(account);
            }
        }
        if (mismatched.isEmpty()) {
            return Collections.emptyList();
        }

        Collections.sort(mismatched);
        StringBuilder sb = new StringBuilder("Balance audit mismatch for ");
        boolean first = true;
        for (String account : mismatched) {
            if (!first) {
                sb.append(", ");
            }
            first = false;
            sb.append(account)
              .append(':').append(maintained.getOrDefault(account, 0L))
              .append("!=").append(recount.getOrDefault(account, 0L));
        }
        LOG.warning(sb.toString());
        return mismatched;
    }

    public LedgerMetrics metrics() { return metrics; }

    // -------------------- helpers --------------------

    private void runReceiverCheck(String operator, String from, String to, TokenId id, byte[] data) {
        receiverCheckRunning = true;
        try {
            acceptance.require(operator, from, to, id, data);
        } finally {
            receiverCheckRunning = false;
        }
    }

    private void requireNoReceiverCheck() {
        if (receiverCheckRunning) {
            throw fail(LedgerError.NOT_AUTHORIZED, LOCKED_DURING_CHECK);
        }
    }

    private OwnershipChange applyMint(String to, TokenId id) {
        requireId(id);
        if (Address.isZero(to)) {
            throw fail(LedgerError.INVALID_TARGET, "mint to the zero address");
        }
        if (store.getOwner(id).isPresent()) {
            throw fail(LedgerError.TOKEN_EXISTS, "token already minted");
        }
        OwnershipChange applied = store.apply(OwnershipChange.mint(id, to));
        LOG.fine("Minted token " + id + " to " + to);
        return applied;
    }

    private OwnershipChange applyTransfer(String caller, String from, String to, TokenId id) {
        String owner = requireOwner(id);
        if (!owner.equals(from)) {
            throw fail(LedgerError.OWNERSHIP_MISMATCH, "transfer from incorrect owner");
        }
        if (Address.isZero(to)) {
            throw fail(LedgerError.INVALID_TARGET, "transfer to the zero address");
        }
        if (!isOwnerOrApproved(caller, owner, id)) {
            throw fail(LedgerError.NOT_AUTHORIZED, NOT_OWNER_OR_APPROVED);
        }
        OwnershipChange applied = store.apply(OwnershipChange.transfer(id, from, to));
        LOG.fine("Transferred token " + id + " " + from + " -> " + to + " by " + caller);
        return applied;
    }

    private boolean isOwnerOrApproved(String caller, String owner, TokenId id) {
        if (Address.isZero(caller)) {
            return false;
        }
        return caller.equals(owner)
                || caller.equals(store.getApproval(id))
                || store.isOperator(owner, caller);
    }

    private String requireOwner(TokenId id) {
        requireId(id);
        return store.getOwner(id)
                .orElseThrow(() -> fail(LedgerError.NONEXISTENT_TOKEN, INVALID_TOKEN));
    }

    private static void requireId(TokenId id) {
        if (id == null) {
            throw new IllegalArgumentException("Token id required");
        }
    }

    private LedgerException fail(LedgerError error, String message) {
        metrics.recordFailure(error);
        return new LedgerException(error, message);
    }
}

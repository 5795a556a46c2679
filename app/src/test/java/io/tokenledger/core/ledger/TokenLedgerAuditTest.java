package io.tokenledger.core.ledger;

import io.tokenledger.core.config.LedgerConfig;
import io.tokenledger.core.metrics.LedgerMetrics;
import io.tokenledger.core.protocol.TokenId;
import io.tokenledger.core.receiver.ReceiverDirectory;
import io.tokenledger.core.state.InMemoryOwnershipStore;
import io.tokenledger.core.state.OwnershipChange;
import io.tokenledger.core.state.OwnershipStore;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TokenLedgerAuditTest {

    @Test
    void consistentLedgerPassesAudit() {
        TokenLedger ledger = TokenLedger.inMemory(LedgerConfig.defaultLocal());
        ledger.mint("alice", TokenId.of(0));
        ledger.mint("bob", TokenId.of(1));
        ledger.transferFrom("alice", "alice", "bob", TokenId.of(0));
        assertTrue(ledger.auditBalances().isEmpty());
    }

    @Test
    void reportsAccountsWhoseBalanceDrifted() {
        TokenLedger ledger = new TokenLedger(LedgerConfig.defaultLocal(), new DriftingStore("bob"),
                ReceiverDirectory.plainAccountsOnly(), new LedgerMetrics());
        ledger.mint("alice", TokenId.of(0));
        ledger.mint("bob", TokenId.of(1));

        List<String> mismatched = ledger.auditBalances();
        assertEquals(List.of("bob"), mismatched);
    }

    /** Reports one extra token for a single account. */
    private static final class DriftingStore implements OwnershipStore {
        private final OwnershipStore delegate = new InMemoryOwnershipStore();
        private final String drifted;

        DriftingStore(String drifted) {
            this.drifted = drifted;
        }

        @Override public Optional<String> getOwner(TokenId tokenId) { return delegate.getOwner(tokenId); }
        @Override public long getBalance(String address) { return delegate.getBalance(address); }
        @Override public String getApproval(TokenId tokenId) { return delegate.getApproval(tokenId); }
        @Override public void setApproval(TokenId tokenId, String approved) { delegate.setApproval(tokenId, approved); }
        @Override public boolean isOperator(String owner, String operator) { return delegate.isOperator(owner, operator); }
        @Override public void setOperator(String owner, String operator, boolean approved) { delegate.setOperator(owner, operator, approved); }
        @Override public long totalSupply() { return delegate.totalSupply(); }
        @Override public OwnershipChange apply(OwnershipChange change) { return delegate.apply(change); }
        @Override public void revert(OwnershipChange applied) { delegate.revert(applied); }
        @Override public Map<TokenId, String> ownersSnapshot() { return delegate.ownersSnapshot(); }

        @Override
        public Map<String, Long> balancesSnapshot() {
            Map<String, Long> balances = delegate.balancesSnapshot();
            balances.merge(drifted, 1L, Long::sum);
            return balances;
        }
    }
}

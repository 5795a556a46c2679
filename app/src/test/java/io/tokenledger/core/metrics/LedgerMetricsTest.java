package io.tokenledger.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.tokenledger.core.config.LedgerConfig;
import io.tokenledger.core.ledger.TokenLedger;
import io.tokenledger.core.protocol.LedgerError;
import io.tokenledger.core.protocol.LedgerException;
import io.tokenledger.core.protocol.TokenId;
import io.tokenledger.core.receiver.ReceiverDirectory;
import io.tokenledger.core.state.InMemoryOwnershipStore;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LedgerMetricsTest {

    @Test
    void countsLedgerActivity() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        LedgerMetrics metrics = new LedgerMetrics(registry);
        TokenLedger ledger = new TokenLedger(LedgerConfig.defaultLocal(), new InMemoryOwnershipStore(),
                ReceiverDirectory.plainAccountsOnly(), metrics);

        ledger.mint("alice", TokenId.of(0));
        ledger.mint("alice", TokenId.of(1));
        ledger.transferFrom("alice", "alice", "bob", TokenId.of(0));
        ledger.burn("alice", TokenId.of(1));
        assertThrows(LedgerException.class, () -> ledger.ownerOf(TokenId.of(1)));

        assertEquals(2.0, registry.counter("ledger.tokens.minted").count());
        assertEquals(1.0, registry.counter("ledger.tokens.transferred").count());
        assertEquals(1.0, registry.counter("ledger.tokens.burned").count());
        assertEquals(1.0, registry.counter("ledger.operations.failed", "error", LedgerError.NONEXISTENT_TOKEN.name()).count());
    }

    @Test
    void scrapeListsMeters() {
        LedgerMetrics metrics = new LedgerMetrics();
        metrics.incrementMinted();
        String scrape = metrics.scrapeMetrics();
        assertTrue(scrape.contains("ledger.tokens.minted{stat=COUNT} 1.0"));
    }

    @Test
    void scrapeSeparatesFailuresByError() {
        LedgerMetrics metrics = new LedgerMetrics();
        metrics.recordFailure(LedgerError.NOT_AUTHORIZED);
        metrics.recordFailure(LedgerError.NOT_AUTHORIZED);
        metrics.recordFailure(LedgerError.TRANSFER_REJECTED);

        String scrape = metrics.scrapeMetrics();
        assertTrue(scrape.contains("ledger.operations.failed{error=NOT_AUTHORIZED,stat=COUNT} 2.0"));
        assertTrue(scrape.contains("ledger.operations.failed{error=TRANSFER_REJECTED,stat=COUNT} 1.0"));
        assertTrue(scrape.contains("ledger.transfers.rejected{stat=COUNT} 1.0"));
    }
}

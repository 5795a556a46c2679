package io.tokenledger.core.receiver;

import io.tokenledger.core.metrics.LedgerMetrics;
import io.tokenledger.core.protocol.Address;
import io.tokenledger.core.protocol.LedgerError;
import io.tokenledger.core.protocol.LedgerException;
import io.tokenledger.core.protocol.TokenId;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryReceiverDirectoryTest {

    @Test
    void unknownAccountsArePlain() {
        InMemoryReceiverDirectory directory = new InMemoryReceiverDirectory();
        assertSame(PlainAccountReceiver.INSTANCE, directory.receiverFor("alice"));
        assertTrue(directory.receiverFor("alice").onTokenReceived("x", "y", TokenId.of(0), new byte[0]));
    }

    @Test
    void registrationRequiresRealAccount() {
        InMemoryReceiverDirectory directory = new InMemoryReceiverDirectory();
        assertThrows(IllegalArgumentException.class, () -> directory.register(Address.ZERO, (o, f, t, d) -> true));
        assertThrows(NullPointerException.class, () -> directory.register("vault", null));
    }

    @Test
    void acceptanceCheckPassesLargeData() {
        InMemoryReceiverDirectory directory = new InMemoryReceiverDirectory();
        int[] seen = new int[1];
        directory.register("vault", (o, f, t, d) -> {
            seen[0] = d.length;
            return true;
        });
        AcceptanceCheck check = new AcceptanceCheck(directory, new LedgerMetrics());
        assertDoesNotThrow(() -> check.require("alice", "alice", "bob", TokenId.of(0), new byte[64 * 1024]));
        check.require("alice", "alice", "vault", TokenId.of(0), new byte[64 * 1024]);
        assertEquals(64 * 1024, seen[0]);
    }

    @Test
    void failedLookupIsRejection() {
        IllegalStateException offline = new IllegalStateException("directory offline");
        ReceiverDirectory broken = account -> { throw offline; };
        LedgerException ex = assertThrows(LedgerException.class,
                () -> new AcceptanceCheck(broken, new LedgerMetrics()).require("alice", "alice", "vault", TokenId.of(0), null));
        assertEquals(LedgerError.TRANSFER_REJECTED, ex.error());
        assertSame(offline, ex.getCause());
    }

    @Test
    void acceptanceCheckGivesReceiverACopy() {
        InMemoryReceiverDirectory directory = new InMemoryReceiverDirectory();
        byte[] data = {1, 2, 3};
        directory.register("vault", (o, f, t, d) -> {
            d[0] = 42;
            return true;
        });
        new AcceptanceCheck(directory, new LedgerMetrics()).require("alice", "alice", "vault", TokenId.of(0), data);
        assertEquals(1, data[0]);
    }

    @Test
    void refusalCarriesConventionalMessage() {
        InMemoryReceiverDirectory directory = new InMemoryReceiverDirectory();
        directory.register("vault", (o, f, t, d) -> false);
        LedgerException ex = assertThrows(LedgerException.class,
                () -> new AcceptanceCheck(directory, new LedgerMetrics()).require("alice", "alice", "vault", TokenId.of(0), null));
        assertEquals(LedgerError.TRANSFER_REJECTED, ex.error());
        assertEquals("transfer to non ERC721Receiver implementer", ex.getMessage());
    }
}

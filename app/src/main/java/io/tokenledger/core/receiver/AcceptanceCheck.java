package io.tokenledger.core.receiver;

import io.tokenledger.core.metrics.LedgerMetrics;
import io.tokenledger.core.protocol.LedgerError;
import io.tokenledger.core.protocol.LedgerException;
import io.tokenledger.core.protocol.TokenId;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a recipient's acceptance hook synchronously and turns refusal into TRANSFER_REJECTED.
 */
public final class AcceptanceCheck {
    private static final Logger LOG = Logger.getLogger(AcceptanceCheck.class.getName());
    static final String REJECTED = "transfer to non ERC721Receiver implementer";

    private final ReceiverDirectory directory;
    private final LedgerMetrics metrics;

    public AcceptanceCheck(ReceiverDirectory directory, LedgerMetrics metrics) {
        this.directory = directory;
        this.metrics = metrics;
    }

    public void require(String operator, String from, String to, TokenId tokenId, byte[] data) {
        byte[] payload = data != null ? data.clone() : new byte[0];
        boolean accepted;
        try {
            TokenReceiver receiver = directory.receiverFor(to);
            accepted = metrics.timeReceiverCheck(() -> receiver.onTokenReceived(operator, from, tokenId, payload));
        } catch (RuntimeException e) {
            // failed lookup, a throwing hook, or a hook that re-entered the ledger and failed there
            LOG.log(Level.WARNING, "Receiver " + to + " unreachable for token " + tokenId, e);
            throw new LedgerException(LedgerError.TRANSFER_REJECTED, REJECTED, e);
        }
        if (!accepted) {
            LOG.warning("Receiver " + to + " refused token " + tokenId);
            throw new LedgerException(LedgerError.TRANSFER_REJECTED, REJECTED);
        }
    }
}

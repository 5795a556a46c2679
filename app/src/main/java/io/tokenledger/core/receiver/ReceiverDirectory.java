package io.tokenledger.core.receiver;

/**
 * Resolves which acceptance variant applies to a recipient.
 */
public interface ReceiverDirectory {

    /** Never null; accounts without a registered hook resolve to {@link PlainAccountReceiver}. */
    TokenReceiver receiverFor(String account);

    /** Directory in which every account is a plain account. */
    static ReceiverDirectory plainAccountsOnly() {
        return account -> PlainAccountReceiver.INSTANCE;
    }
}

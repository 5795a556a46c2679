package io.tokenledger.core.receiver;

import io.tokenledger.core.protocol.Address;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

public final class InMemoryReceiverDirectory implements ReceiverDirectory {

    private final Map<String, TokenReceiver> receivers = new HashMap<>();

    public synchronized void register(String account, TokenReceiver receiver) {
        if (!Address.isValid(account)) {
            throw new IllegalArgumentException("Invalid receiver account: " + account);
        }
        receivers.put(account, Objects.requireNonNull(receiver, "receiver"));
    }

    public synchronized void unregister(String account) {
        receivers.remove(account);
    }

    @Override
    public synchronized TokenReceiver receiverFor(String account) {
        TokenReceiver r = receivers.get(account);
        return r != null ? r : PlainAccountReceiver.INSTANCE;
    }
}

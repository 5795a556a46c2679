package io.tokenledger.core.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.tokenledger.core.protocol.LedgerError;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;

public class LedgerMetrics {
    private final MeterRegistry registry;
    private final Counter minted;
    private final Counter burned;
    private final Counter transferred;
    private final Counter rejected;
    private final Timer receiverCheck;

    public LedgerMetrics() {
        this(new SimpleMeterRegistry());
    }

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.minted = registry.counter("ledger.tokens.minted");
        this.burned = registry.counter("ledger.tokens.burned");
        this.transferred = registry.counter("ledger.tokens.transferred");
        this.rejected = Counter.builder("ledger.transfers.rejected")
                .description("Safe transfers and safe mints refused by the recipient")
                .register(registry);
        this.receiverCheck = Timer.builder("ledger.receiver.check")
                .description("Recipient acceptance hook duration")
                .register(registry);
    }

    public <T> T timeReceiverCheck(Supplier<T> check) {
        return receiverCheck.record(check);
    }

    public void incrementMinted() { minted.increment(); }
    public void incrementBurned() { burned.increment(); }
    public void incrementTransferred() { transferred.increment(); }

    public void recordFailure(LedgerError error) {
        if (error == LedgerError.TRANSFER_REJECTED) {
            rejected.increment();
        }
        registry.counter("ledger.operations.failed", "error", error.name()).increment();
    }

    /** One line per measurement: {@code name{tag=value,...,stat=STAT} value}, sorted by name. */
    public String scrapeMetrics() {
        List<Meter> meters = new ArrayList<>(registry.getMeters());
        meters.sort(Comparator.comparing((Meter m) -> m.getId().getName())
                .thenComparing(m -> m.getId().getTags().toString()));
        StringBuilder sb = new StringBuilder();
        for (Meter m : meters) {
            Meter.Id id = m.getId();
            for (Measurement meas : m.measure()) {
                sb.append(id.getName()).append('{');
                for (Tag tag : id.getTags()) {
                    sb.append(tag.getKey()).append('=').append(tag.getValue()).append(',');
                }
                sb.append("stat=").append(meas.getStatistic())
                  .append("} ")
                  .append(meas.getValue())
                  .append('\n');
            }
        }
        return sb.toString();
    }

    public MeterRegistry registry() {
        return registry;
    }
}

package com.flagship.account_storage.observability;

import com.flagship.account_storage.ledger.memory.InMemoryLedger;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for contract invocations and transfers.
 *
 * Metrics exposed:
 * - contract.invocations: Counter of invocations, tagged by function, mode and outcome
 * - contract.invocation.duration: Timer of invocations, tagged by function and mode
 * - transfer.completed: Counter of committed transfers, tagged by currency
 * - transfer.amount: Distribution of transferred amounts, tagged by currency
 * - ledger.keys / ledger.transactions.committed / ledger.transactions.conflicted: ledger gauges
 */
@Component
public class AccountStorageMetrics {

    private final MeterRegistry registry;

    public AccountStorageMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordInvocation(String function, String mode, String outcome, Duration duration) {
        registry.counter("contract.invocations",
                "function", sanitizeTag(function),
                "mode", mode,
                "outcome", sanitizeTag(outcome)
        ).increment();
        Timer.builder("contract.invocation.duration")
                .tag("function", sanitizeTag(function))
                .tag("mode", mode)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(duration);
    }

    public void recordTransfer(String currency, long amount) {
        registry.counter("transfer.completed", "currency", sanitizeTag(currency)).increment();
        DistributionSummary.builder("transfer.amount")
                .description("Transferred amount in smallest currency units")
                .tag("currency", sanitizeTag(currency))
                .register(registry)
                .record(amount);
    }

    /**
     * Registers gauges that read straight from {@code ledger}. The registry holds the ledger
     * weakly, so it must stay referenced elsewhere (it is a singleton bean).
     */
    public void registerLedgerGauges(InMemoryLedger ledger) {
        Gauge.builder("ledger.keys", ledger, InMemoryLedger::keyCount)
                .description("Number of keys in the committed world state")
                .register(registry);
        Gauge.builder("ledger.transactions.committed", ledger, InMemoryLedger::committedTransactionCount)
                .description("Number of committed ledger transactions")
                .register(registry);
        Gauge.builder("ledger.transactions.conflicted", ledger, InMemoryLedger::conflictCount)
                .description("Number of transactions rejected at commit by version validation")
                .register(registry);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}

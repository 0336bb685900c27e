package com.flagship.account_storage.observability;

import com.flagship.account_storage.ledger.memory.InMemoryLedger;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health of the in-process ledger. Reports WARNING when most recent work ends in conflicts.
 */
@Component("ledgerHealth")
public class LedgerHealthIndicator implements HealthIndicator {

    private static final double CONFLICT_WARNING_RATIO = 0.5;

    private final InMemoryLedger ledger;

    public LedgerHealthIndicator(InMemoryLedger ledger) {
        this.ledger = ledger;
    }

    @Override
    public Health health() {
        long committed = ledger.committedTransactionCount();
        long conflicts = ledger.conflictCount();
        long attempted = committed + conflicts;

        Health.Builder builder = attempted > 0 && (double) conflicts / attempted > CONFLICT_WARNING_RATIO
                ? Health.status("WARNING")
                : Health.up();

        return builder
                .withDetail("keys", ledger.keyCount())
                .withDetail("committedTransactions", committed)
                .withDetail("conflictedTransactions", conflicts)
                .build();
    }
}

package com.flagship.account_storage.config;

import com.flagship.account_storage.ledger.memory.InMemoryLedger;
import com.flagship.account_storage.observability.AccountStorageMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
@Slf4j
public class LedgerConfig {

    @Bean
    public Clock ledgerClock() {
        return Clock.systemUTC();
    }

    @Bean
    public InMemoryLedger inMemoryLedger(Clock ledgerClock, LedgerProperties properties,
                                         AccountStorageMetrics metrics) {
        log.info("Starting in-memory ledger: versionValidation={}", properties.isVersionValidation());
        InMemoryLedger ledger = new InMemoryLedger(ledgerClock, properties.isVersionValidation());
        metrics.registerLedgerGauges(ledger);
        return ledger;
    }
}

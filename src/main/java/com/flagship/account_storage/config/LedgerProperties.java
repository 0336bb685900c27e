package com.flagship.account_storage.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the in-process host ledger, bound from {@code account-storage.ledger.*}.
 */
@ConfigurationProperties(prefix = "account-storage.ledger")
@Getter
@Setter
public class LedgerProperties {

    /**
     * Reject a commit when a key it read was committed by another transaction in the meantime.
     */
    private boolean versionValidation = true;
}

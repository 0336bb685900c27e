package com.flagship.account_storage.ledger;

import lombok.Value;

import java.time.Instant;

/**
 * One version of a key in the ledger's append-only history.
 * {@code value} is {@code null} for tombstones.
 */
@Value
public class KeyModification {
    String txId;
    Instant timestamp;
    byte[] value;
    boolean delete;

    public boolean hasPayload() {
        return value != null && value.length > 0;
    }
}

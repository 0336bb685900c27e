package com.flagship.account_storage.ledger;

import lombok.Value;

/**
 * One committed entry returned by a range scan.
 */
@Value
public class LedgerKeyValue {
    String key;
    byte[] value;
}

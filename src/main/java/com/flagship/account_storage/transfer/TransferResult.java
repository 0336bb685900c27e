package com.flagship.account_storage.transfer;

import com.flagship.account_storage.account.Account;
import lombok.Value;

/**
 * Post-transfer state of both accounts, as written to the ledger.
 */
@Value
public class TransferResult {
    Account sender;
    Account recipient;
    long amount;
}

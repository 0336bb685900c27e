package com.flagship.account_storage.history;

import com.flagship.account_storage.account.Account;
import lombok.Value;

import java.time.Instant;

/**
 * One version of an account in its history.
 */
@Value
public class HistoryEntry {
    String txId;
    Instant timestamp;
    AccountState state;

    public Account getRecord() {
        return state.record();
    }

    public boolean isDelete() {
        return state.isDelete();
    }
}

package com.flagship.account_storage.history;

import com.flagship.account_storage.account.Account;
import lombok.Value;

/**
 * State of an account key at one version: either a decoded snapshot or a deletion marker.
 */
public sealed interface AccountState permits AccountState.Snapshot, AccountState.Tombstone {

    /**
     * The account as stored, or a placeholder carrying only the id for a tombstone.
     */
    Account record();

    boolean isDelete();

    @Value
    final class Snapshot implements AccountState {
        Account account;

        @Override
        public Account record() {
            return account;
        }

        @Override
        public boolean isDelete() {
            return false;
        }
    }

    @Value
    final class Tombstone implements AccountState {
        String accountId;

        @Override
        public Account record() {
            return Account.placeholder(accountId);
        }

        @Override
        public boolean isDelete() {
            return true;
        }
    }
}

package com.flagship.account_storage.history;

import com.flagship.account_storage.account.Account;
import com.flagship.account_storage.codec.LedgerRecordCodec;
import com.flagship.account_storage.ledger.KeyModification;
import com.flagship.account_storage.ledger.LedgerResultsIterator;
import com.flagship.account_storage.ledger.LedgerStub;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds the chain of custody of an account from the ledger's per-key history.
 *
 * Entries come back oldest first, in the order the ledger committed them. Versions without
 * a payload are deletions and become {@link AccountState.Tombstone}s. One undecodable
 * version fails the whole call.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountHistoryService {

    private final LedgerRecordCodec codec;

    public List<HistoryEntry> history(LedgerStub stub, String accountId) {
        if (accountId == null || accountId.isBlank()) {
            throw new IllegalArgumentException("Account id is required");
        }
        log.debug("Reading account history: id={}", accountId);

        List<HistoryEntry> entries = new ArrayList<>();
        try (LedgerResultsIterator<KeyModification> versions = stub.getHistoryForKey(accountId)) {
            while (versions.hasNext()) {
                KeyModification version = versions.next();
                entries.add(new HistoryEntry(version.getTxId(), version.getTimestamp(), stateOf(accountId, version)));
            }
        }
        return entries;
    }

    private AccountState stateOf(String accountId, KeyModification version) {
        if (version.isDelete() || !version.hasPayload()) {
            return new AccountState.Tombstone(accountId);
        }
        return new AccountState.Snapshot(codec.decode(version.getValue(), Account.class, accountId));
    }
}

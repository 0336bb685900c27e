package com.flagship.account_storage.account;

import com.flagship.account_storage.codec.LedgerRecordCodec;
import com.flagship.account_storage.exception.RecordAlreadyExistsException;
import com.flagship.account_storage.exception.RecordNotFoundException;
import com.flagship.account_storage.index.CompositeKeyIndex;
import com.flagship.account_storage.ledger.LedgerStub;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Creates, reads and rewrites accounts.
 *
 * Each account lives at key {@code id}, with an {@code account~email} index entry
 * {@code (email, id)} written alongside it so a participant's accounts can be listed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountRegistry {

    public static final String ACCOUNT_EMAIL_INDEX = "account~email";

    private static final String RECORD_TYPE = "account";

    private final LedgerRecordCodec codec;
    private final CompositeKeyIndex accountEmailIndex = new CompositeKeyIndex(ACCOUNT_EMAIL_INDEX, 1);

    public boolean exists(LedgerStub stub, String id) {
        requireId(id);
        return stub.getState(id) != null;
    }

    /**
     * Opens a new account. The owning participant is not required to exist.
     *
     * @throws RecordAlreadyExistsException if an account with this id exists
     */
    public Account create(LedgerStub stub, String id, String currency, long balance, String email) {
        log.info("Init account: id={}, currency={}, email={}", id, currency, email);
        if (exists(stub, id)) {
            throw new RecordAlreadyExistsException(RECORD_TYPE, id);
        }
        if (email == null) {
            throw new IllegalArgumentException("Account email is required");
        }

        Account account = Account.builder()
                .id(id)
                .currency(currency)
                .balance(balance)
                .email(email)
                .build();

        stub.putState(id, codec.encode(account));
        accountEmailIndex.insert(stub, account.getEmail(), account.getId());
        return account;
    }

    /**
     * @throws RecordNotFoundException if no account is stored at {@code id}
     */
    public Account read(LedgerStub stub, String id) {
        requireId(id);
        byte[] bytes = stub.getState(id);
        if (bytes == null) {
            throw new RecordNotFoundException(RECORD_TYPE, id);
        }
        return codec.decode(bytes, Account.class, id);
    }

    /**
     * Writes a new state of an existing account back to its key.
     * Index entries are untouched: id and email never change.
     */
    public void update(LedgerStub stub, Account account) {
        requireId(account.getId());
        stub.putState(account.getId(), codec.encode(account));
    }

    /**
     * Lists the accounts owned by {@code email}, ordered by account id.
     */
    public List<Account> listForParticipant(LedgerStub stub, String email) {
        if (email == null) {
            throw new IllegalArgumentException("Participant email is required");
        }
        List<Account> accounts = accountEmailIndex.scan(stub, id -> read(stub, id), email);
        log.debug("Listed accounts: email={}, count={}", email, accounts.size());
        return accounts;
    }

    private static void requireId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Account id is required");
        }
    }
}

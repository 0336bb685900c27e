package com.flagship.account_storage.exception;

import lombok.Getter;

/**
 * A key read by the transaction was committed by another transaction before
 * this one could commit. Nothing from the transaction was applied; resubmit.
 */
@Getter
public class TransactionConflictException extends AccountStorageException {

    private final String txId;
    private final String key;

    public TransactionConflictException(String txId, String key) {
        super(ErrorKind.TRANSACTION_CONFLICT,
                String.format("Transaction %s conflicts on key %s", txId, printable(key)));
        this.txId = txId;
        this.key = key;
    }

    private static String printable(String key) {
        return key.replace('\u0000', '~');
    }
}

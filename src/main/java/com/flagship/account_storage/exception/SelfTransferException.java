package com.flagship.account_storage.exception;

/**
 * Sender and recipient of a transfer are the same account.
 */
public class SelfTransferException extends AccountStorageException {

    public SelfTransferException(String accountId) {
        super(ErrorKind.SELF_TRANSFER,
                String.format("Cannot transfer from account %s to itself", accountId));
    }
}

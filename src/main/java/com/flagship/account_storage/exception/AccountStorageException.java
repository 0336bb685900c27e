package com.flagship.account_storage.exception;

import lombok.Getter;

/**
 * Base class for every failure raised by the registries, the transfer engine,
 * the history reconstructor and the ledger they run on.
 *
 * The first failure aborts the running operation. Buffered writes of the
 * surrounding ledger transaction are discarded by the host, never partially committed.
 */
@Getter
public abstract class AccountStorageException extends RuntimeException {

    private final ErrorKind kind;

    protected AccountStorageException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected AccountStorageException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}

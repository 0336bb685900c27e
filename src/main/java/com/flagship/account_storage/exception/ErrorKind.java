package com.flagship.account_storage.exception;

/**
 * Failure categories surfaced by the account storage core and its host.
 */
public enum ErrorKind {
    STORAGE_UNAVAILABLE,
    NOT_FOUND,
    ALREADY_EXISTS,
    CORRUPT,
    CURRENCY_MISMATCH,
    SELF_TRANSFER,
    TRANSACTION_CONFLICT
}

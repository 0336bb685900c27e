package com.flagship.account_storage.exception;

/**
 * The ledger backend failed to serve a read, write, scan or history request.
 * Transient; callers retry at a higher layer.
 */
public class StorageUnavailableException extends AccountStorageException {

    public StorageUnavailableException(String message) {
        super(ErrorKind.STORAGE_UNAVAILABLE, message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(ErrorKind.STORAGE_UNAVAILABLE, message, cause);
    }
}

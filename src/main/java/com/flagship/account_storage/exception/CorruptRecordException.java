package com.flagship.account_storage.exception;

/**
 * Stored bytes do not decode as the expected record shape.
 */
public class CorruptRecordException extends AccountStorageException {

    public CorruptRecordException(String message, Throwable cause) {
        super(ErrorKind.CORRUPT, message, cause);
    }
}

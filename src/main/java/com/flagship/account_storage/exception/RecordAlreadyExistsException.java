package com.flagship.account_storage.exception;

import lombok.Getter;

@Getter
public class RecordAlreadyExistsException extends AccountStorageException {

    private final String recordType;
    private final String key;

    public RecordAlreadyExistsException(String recordType, String key) {
        super(ErrorKind.ALREADY_EXISTS, String.format("%s already exists: %s", recordType, key));
        this.recordType = recordType;
        this.key = key;
    }
}

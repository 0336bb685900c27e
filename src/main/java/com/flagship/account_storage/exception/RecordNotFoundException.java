package com.flagship.account_storage.exception;

import lombok.Getter;

@Getter
public class RecordNotFoundException extends AccountStorageException {

    private final String recordType;
    private final String key;

    public RecordNotFoundException(String recordType, String key) {
        super(ErrorKind.NOT_FOUND, String.format("%s %s does not exist", recordType, key));
        this.recordType = recordType;
        this.key = key;
    }
}

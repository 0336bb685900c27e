package com.flagship.account_storage.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.account_storage.exception.CorruptRecordException;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * JSON encoding of records stored in the ledger.
 *
 * Decoding follows the mapper's record settings ({@link com.flagship.account_storage.config.JacksonConfig}).
 * Anything that is not a JSON object of the expected shape is corrupt.
 */
@Component
public class LedgerRecordCodec {

    private final ObjectMapper objectMapper;

    public LedgerRecordCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public byte[] encode(Object record) {
        try {
            return objectMapper.writeValueAsBytes(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + record.getClass().getSimpleName(), e);
        }
    }

    public <T> T decode(byte[] bytes, Class<T> type, String key) {
        try {
            T record = objectMapper.readValue(bytes, type);
            if (record == null) {
                throw new CorruptRecordException(
                        String.format("Stored %s at %s is empty", type.getSimpleName(), key), null);
            }
            return record;
        } catch (IOException e) {
            throw new CorruptRecordException(
                    String.format("Stored value at %s is not a valid %s", key, type.getSimpleName()), e);
        }
    }
}

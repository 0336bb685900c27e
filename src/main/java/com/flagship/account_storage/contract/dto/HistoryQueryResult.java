package com.flagship.account_storage.contract.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.account_storage.account.Account;
import com.flagship.account_storage.history.HistoryEntry;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Wire shape of one account history version.
 */
@Value
@Builder
public class HistoryQueryResult {

    @JsonProperty("record")
    Account record;

    @JsonProperty("txId")
    String txId;

    @JsonProperty("timestamp")
    Instant timestamp;

    @JsonProperty("isDelete")
    boolean delete;

    public static HistoryQueryResult from(HistoryEntry entry) {
        return HistoryQueryResult.builder()
            .record(entry.getRecord())
            .txId(entry.getTxId())
            .timestamp(entry.getTimestamp())
            .delete(entry.isDelete())
            .build();
    }
}

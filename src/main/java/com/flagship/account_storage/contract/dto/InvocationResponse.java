package com.flagship.account_storage.contract.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.account_storage.contract.InvocationResult;
import lombok.Builder;
import lombok.Value;

/**
 * Response DTO for a contract invocation.
 */
@Value
@Builder
public class InvocationResponse {

    @JsonProperty("txId")
    String txId;

    @JsonProperty("function")
    String function;

    @JsonProperty("committed")
    boolean committed;

    @JsonProperty("payload")
    Object payload;

    public static InvocationResponse from(InvocationResult result) {
        return InvocationResponse.builder()
            .txId(result.getTxId())
            .function(result.getFunction())
            .committed(result.isCommitted())
            .payload(result.getPayload())
            .build();
    }
}

package com.flagship.account_storage.contract.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Request DTO for invoking a contract function.
 */
@Value
@Builder
@Jacksonized
public class InvocationRequest {

    @NotBlank(message = "Function name is required")
    @JsonProperty("function")
    String function;

    @JsonProperty("args")
    List<String> args;
}

package com.flagship.account_storage.account;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Financial record stored at key {@code id}.
 *
 * Balance is a signed amount in the currency's smallest unit; nothing keeps it
 * non-negative. {@code email} points at the owning participant but is not checked.
 */
@Value
@Builder
@Jacksonized
public class Account {

    @JsonProperty("id")
    String id;

    @JsonProperty("currency")
    String currency;

    @With
    @JsonProperty("balance")
    long balance;

    @JsonProperty("email")
    String email;

    /**
     * Stand-in for a deleted version: only the id is known, every other field holds its zero value.
     */
    public static Account placeholder(String id) {
        return Account.builder().id(id).build();
    }
}

package com.flagship.account_storage.participant;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Identity record stored at key {@code email}.
 *
 * The email is the primary key and never changes. The secret supplied at registration is
 * kept only as {@code passwordDigest}.
 */
@Value
@Builder
@Jacksonized
public class Participant {

    public static final String DOC_TYPE = "participant";

    @JsonProperty("docType")
    String docType;

    @JsonProperty("email")
    String email;

    @JsonProperty("name")
    String name;

    @JsonProperty("surname")
    String surname;

    @JsonProperty("phone")
    String phone;

    @JsonProperty("passwordDigest")
    String passwordDigest;
}

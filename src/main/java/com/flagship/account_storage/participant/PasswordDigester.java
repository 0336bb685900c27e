package com.flagship.account_storage.participant;

import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;

/**
 * One-way digest of participant secrets: unsalted MD5, lowercase hex.
 *
 * Deterministic so that existing records stay verifiable.
 */
@Component
public class PasswordDigester {

    public String digest(String secret) {
        if (secret == null) {
            throw new IllegalArgumentException("Secret is required");
        }
        return DigestUtils.md5DigestAsHex(secret.getBytes(StandardCharsets.UTF_8));
    }
}

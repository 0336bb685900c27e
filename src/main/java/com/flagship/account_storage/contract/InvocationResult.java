package com.flagship.account_storage.contract;

import lombok.Value;

/**
 * Outcome of one successful contract invocation.
 */
@Value
public class InvocationResult {
    String txId;
    String function;
    boolean committed;
    Object payload;
}

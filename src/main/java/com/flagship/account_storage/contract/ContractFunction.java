package com.flagship.account_storage.contract;

import com.flagship.account_storage.ledger.LedgerStub;

@FunctionalInterface
public interface ContractFunction {

    /**
     * @return the payload handed back to the caller, or {@code null} when there is none
     */
    Object apply(LedgerStub stub, ContractArguments arguments);
}

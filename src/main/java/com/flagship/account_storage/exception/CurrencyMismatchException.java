package com.flagship.account_storage.exception;

import lombok.Getter;

@Getter
public class CurrencyMismatchException extends AccountStorageException {

    private final String senderCurrency;
    private final String recipientCurrency;

    public CurrencyMismatchException(String senderCurrency, String recipientCurrency) {
        super(ErrorKind.CURRENCY_MISMATCH,
                String.format("currency mismatch %s != %s", senderCurrency, recipientCurrency));
        this.senderCurrency = senderCurrency;
        this.recipientCurrency = recipientCurrency;
    }
}

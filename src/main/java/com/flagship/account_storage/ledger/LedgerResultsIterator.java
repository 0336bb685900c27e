package com.flagship.account_storage.ledger;

import java.util.Iterator;

/**
 * Lazy, finite, single-pass handle over ledger results.
 * Callers must close it on every exit path, normally with try-with-resources.
 */
public interface LedgerResultsIterator<T> extends Iterator<T>, AutoCloseable {

    @Override
    void close();
}

package com.flagship.account_storage.ledger;

import com.flagship.account_storage.exception.StorageUnavailableException;

import java.util.List;

/**
 * Transaction context handed to every account storage operation by the host ledger.
 *
 * All reads and writes issued through one stub belong to one ledger transaction.
 * Whether buffered writes become visible is decided by the host at commit time.
 * Every method may fail with {@link StorageUnavailableException}.
 */
public interface LedgerStub {

    /**
     * @return the committed value at {@code key}, or {@code null} when absent
     */
    byte[] getState(String key);

    void putState(String key, byte[] value);

    default String createCompositeKey(String indexName, List<String> segments) {
        return new CompositeKey(indexName, segments).encode();
    }

    default CompositeKey splitCompositeKey(String key) {
        return CompositeKey.decode(key);
    }

    /**
     * Scans every committed composite key of {@code indexName} whose leading segments equal
     * {@code prefixSegments}, in key byte order.
     */
    LedgerResultsIterator<LedgerKeyValue> getStateByPartialCompositeKey(String indexName, List<String> prefixSegments);

    /**
     * Streams every committed version of {@code key}, oldest first.
     */
    LedgerResultsIterator<KeyModification> getHistoryForKey(String key);
}

package com.flagship.account_storage.ledger.memory;

import com.flagship.account_storage.ledger.CompositeKey;
import com.flagship.account_storage.ledger.KeyModification;
import com.flagship.account_storage.ledger.LedgerKeyValue;
import com.flagship.account_storage.ledger.LedgerResultsIterator;
import com.flagship.account_storage.ledger.LedgerStub;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

/**
 * One transaction against an {@link InMemoryLedger}.
 *
 * Writes are buffered in issue order; a later write to the same key replaces the earlier one.
 * Reads bypass the buffer and return committed state. Closing an active transaction rolls it back.
 */
@Slf4j
public class InMemoryTransaction implements LedgerStub, AutoCloseable {

    private final InMemoryLedger ledger;

    @Getter
    private final String txId;

    @Getter
    private final Instant timestamp;

    private final Map<String, Long> readVersions = new HashMap<>();
    private final Map<String, byte[]> writes = new LinkedHashMap<>();
    private boolean active = true;

    InMemoryTransaction(InMemoryLedger ledger, String txId, Instant timestamp) {
        this.ledger = ledger;
        this.txId = txId;
        this.timestamp = timestamp;
    }

    @Override
    public byte[] getState(String key) {
        ensureActive();
        requireKey(key);
        InMemoryLedger.VersionedValue committed = ledger.read(key);
        readVersions.putIfAbsent(key, committed.getVersion());
        return committed.getValue();
    }

    @Override
    public void putState(String key, byte[] value) {
        ensureActive();
        requireKey(key);
        if (value == null || value.length == 0) {
            throw new IllegalArgumentException("Value for key " + printable(key) + " must not be empty");
        }
        writes.put(key, value.clone());
    }

    /**
     * Buffers a tombstone for {@code key}. Host-side only: the account storage core never deletes.
     */
    public void delete(String key) {
        ensureActive();
        requireKey(key);
        writes.put(key, null);
    }

    @Override
    public LedgerResultsIterator<LedgerKeyValue> getStateByPartialCompositeKey(String indexName,
                                                                             List<String> prefixSegments) {
        ensureActive();
        String prefix = new CompositeKey(indexName, prefixSegments).encode();
        List<InMemoryLedger.VersionedEntry> entries = ledger.scan(prefix);
        entries.forEach(e -> readVersions.putIfAbsent(e.getKeyValue().getKey(), e.getVersion()));
        return new SnapshotIterator<>(entries.stream()
                .map(InMemoryLedger.VersionedEntry::getKeyValue)
                .collect(Collectors.toList()));
    }

    @Override
    public LedgerResultsIterator<KeyModification> getHistoryForKey(String key) {
        ensureActive();
        requireKey(key);
        return new SnapshotIterator<>(ledger.historyOf(key));
    }

    /**
     * Validates read versions and applies the buffered writes atomically.
     * The transaction is finished afterwards whether or not the commit succeeded.
     */
    public void commit() {
        ensureActive();
        active = false;
        ledger.commit(this);
    }

    public void rollback() {
        if (!active) {
            return;
        }
        active = false;
        log.debug("Rolled back transaction: txId={}, discardedWrites={}", txId, writes.size());
        writes.clear();
    }

    public boolean isActive() {
        return active;
    }

    @Override
    public void close() {
        rollback();
    }

    Map<String, Long> readVersions() {
        return Collections.unmodifiableMap(readVersions);
    }

    Map<String, byte[]> pendingWrites() {
        return Collections.unmodifiableMap(writes);
    }

    private void ensureActive() {
        if (!active) {
            throw new IllegalStateException("Transaction " + txId + " is already finished");
        }
    }

    private static void requireKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Ledger key is required");
        }
    }

    private static String printable(String key) {
        return key.replace(CompositeKey.SEPARATOR, '~');
    }

    private static final class SnapshotIterator<T> implements LedgerResultsIterator<T> {

        private final Iterator<T> delegate;
        private boolean closed;

        private SnapshotIterator(List<T> results) {
            this.delegate = results.iterator();
        }

        @Override
        public boolean hasNext() {
            return !closed && delegate.hasNext();
        }

        @Override
        public T next() {
            if (closed) {
                throw new NoSuchElementException("Results iterator is closed");
            }
            return delegate.next();
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}

package com.flagship.account_storage.index;

import com.flagship.account_storage.ledger.CompositeKey;
import com.flagship.account_storage.ledger.LedgerKeyValue;
import com.flagship.account_storage.ledger.LedgerResultsIterator;
import com.flagship.account_storage.ledger.LedgerStub;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * A secondary index emulated with composite keys on the primary-key-only ledger.
 *
 * Entries map {@code (indexName, segments...)} to a one-byte sentinel. They are derived,
 * written in the same transaction as the primary record they point to, and never
 * updated or removed on their own.
 */
@Slf4j
@Getter
public class CompositeKeyIndex {

    private static final byte[] SENTINEL = {0x00};

    private final String name;
    private final int primaryKeySegment;

    /**
     * @param name               index name, e.g. {@code account~email}
     * @param primaryKeySegment  position of the segment holding the primary key of the indexed record
     */
    public CompositeKeyIndex(String name, int primaryKeySegment) {
        this.name = name;
        this.primaryKeySegment = primaryKeySegment;
    }

    public void insert(LedgerStub stub, String... segments) {
        String key = stub.createCompositeKey(name, List.of(segments));
        stub.putState(key, SENTINEL);
        log.debug("Inserted index entry: index={}, segments={}", name, List.of(segments));
    }

    /**
     * Resolves every entry whose leading segments equal {@code prefixSegments} through
     * {@code loader}, in index key order.
     *
     * The scan handle is released on every exit path. The first failure from the scan or the
     * loader aborts the whole call and nothing is returned.
     */
    public <T> List<T> scan(LedgerStub stub, Function<String, T> loader, String... prefixSegments) {
        List<T> results = new ArrayList<>();
        try (LedgerResultsIterator<LedgerKeyValue> entries =
                     stub.getStateByPartialCompositeKey(name, List.of(prefixSegments))) {
            while (entries.hasNext()) {
                CompositeKey key = stub.splitCompositeKey(entries.next().getKey());
                String primaryKey = key.segment(primaryKeySegment);
                if (primaryKey != null) {
                    results.add(loader.apply(primaryKey));
                }
            }
        }
        return results;
    }
}

package com.flagship.account_storage.ledger.memory;

import com.flagship.account_storage.exception.TransactionConflictException;
import com.flagship.account_storage.ledger.KeyModification;
import com.flagship.account_storage.ledger.LedgerKeyValue;
import com.flagship.account_storage.ledger.LedgerStub;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * In-process host ledger: a versioned, ordered key-value store with a per-key history log.
 *
 * Transactions are opened with {@link #begin()} and buffer their writes until commit.
 * Reads always see committed state. On commit, every key the transaction read must
 * still carry the version it had when read (optimistic, multi-version validation),
 * otherwise the whole transaction is rejected with {@link TransactionConflictException}.
 *
 * Commits are serialized; reads and scans run concurrently with each other.
 */
@Slf4j
public class InMemoryLedger {

    /**
     * Keys are ordered by their UTF-8 bytes, unsigned.
     */
    static final Comparator<String> KEY_ORDER = (a, b) -> Arrays.compareUnsigned(
            a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));

    private final Clock clock;
    private final boolean versionValidation;

    private final NavigableMap<String, byte[]> worldState = new TreeMap<>(KEY_ORDER);
    private final Map<String, Long> keyVersions = new HashMap<>();
    private final Map<String, List<KeyModification>> history = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private long commitSequence;
    private final AtomicLong committedTransactions = new AtomicLong();
    private final AtomicLong conflicts = new AtomicLong();

    public InMemoryLedger(Clock clock, boolean versionValidation) {
        this.clock = clock;
        this.versionValidation = versionValidation;
    }

    public InMemoryLedger() {
        this(Clock.systemUTC(), true);
    }

    /**
     * Opens a new transaction stamped with a fresh id and the current time.
     */
    public InMemoryTransaction begin() {
        String txId = UUID.randomUUID().toString().replace("-", "");
        return new InMemoryTransaction(this, txId, clock.instant());
    }

    /**
     * Runs {@code work} in a new transaction, committing on success and rolling back on failure.
     */
    public <T> T execute(Function<LedgerStub, T> work) {
        try (InMemoryTransaction transaction = begin()) {
            T result = work.apply(transaction);
            transaction.commit();
            return result;
        }
    }

    public int keyCount() {
        lock.readLock().lock();
        try {
            return worldState.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public long committedTransactionCount() {
        return committedTransactions.get();
    }

    public long conflictCount() {
        return conflicts.get();
    }

    VersionedValue read(String key) {
        lock.readLock().lock();
        try {
            byte[] value = worldState.get(key);
            return new VersionedValue(value == null ? null : value.clone(), versionOf(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    List<VersionedEntry> scan(String prefix) {
        lock.readLock().lock();
        try {
            List<VersionedEntry> entries = new ArrayList<>();
            for (Map.Entry<String, byte[]> entry : worldState.tailMap(prefix, true).entrySet()) {
                if (!entry.getKey().startsWith(prefix)) {
                    break;
                }
                entries.add(new VersionedEntry(
                        new LedgerKeyValue(entry.getKey(), entry.getValue().clone()),
                        versionOf(entry.getKey())));
            }
            return entries;
        } finally {
            lock.readLock().unlock();
        }
    }

    List<KeyModification> historyOf(String key) {
        lock.readLock().lock();
        try {
            return history.getOrDefault(key, List.of()).stream()
                    .map(m -> new KeyModification(m.getTxId(), m.getTimestamp(),
                            m.getValue() == null ? null : m.getValue().clone(), m.isDelete()))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    void commit(InMemoryTransaction transaction) {
        lock.writeLock().lock();
        try {
            if (versionValidation) {
                for (Map.Entry<String, Long> read : transaction.readVersions().entrySet()) {
                    if (versionOf(read.getKey()) != read.getValue()) {
                        conflicts.incrementAndGet();
                        throw new TransactionConflictException(transaction.getTxId(), read.getKey());
                    }
                }
            }

            Map<String, byte[]> writes = transaction.pendingWrites();
            if (!writes.isEmpty()) {
                long version = ++commitSequence;
                for (Map.Entry<String, byte[]> write : writes.entrySet()) {
                    apply(transaction, write.getKey(), write.getValue(), version);
                }
            }
            committedTransactions.incrementAndGet();
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Committed transaction: txId={}, writes={}",
                transaction.getTxId(), transaction.pendingWrites().size());
    }

    private void apply(InMemoryTransaction transaction, String key, byte[] value, long version) {
        boolean delete = value == null;
        if (delete) {
            worldState.remove(key);
        } else {
            worldState.put(key, value);
        }
        keyVersions.put(key, version);
        history.computeIfAbsent(key, k -> new ArrayList<>())
                .add(new KeyModification(transaction.getTxId(), transaction.getTimestamp(), value, delete));
    }

    private long versionOf(String key) {
        return keyVersions.getOrDefault(key, 0L);
    }

    @Value
    static class VersionedValue {
        byte[] value;
        long version;
    }

    @Value
    static class VersionedEntry {
        LedgerKeyValue keyValue;
        long version;
    }
}

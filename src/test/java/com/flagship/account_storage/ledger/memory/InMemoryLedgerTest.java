package com.flagship.account_storage.ledger.memory;

import com.flagship.account_storage.exception.TransactionConflictException;
import com.flagship.account_storage.ledger.CompositeKey;
import com.flagship.account_storage.ledger.KeyModification;
import com.flagship.account_storage.ledger.LedgerKeyValue;
import com.flagship.account_storage.ledger.LedgerResultsIterator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the in-process host ledger: buffering, atomic commit, history and conflicts.
 */
class InMemoryLedgerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:15:30Z");

    private InMemoryLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryLedger(Clock.fixed(NOW, ZoneOffset.UTC), true);
    }

    @Test
    @DisplayName("Buffered writes are invisible until commit")
    void testWritesVisibleAfterCommit() {
        try (InMemoryTransaction tx = ledger.begin()) {
            tx.putState("k", bytes("v1"));
            assertNull(tx.getState("k"), "Reads must see committed state only");
            tx.commit();
        }

        byte[] stored = ledger.execute(stub -> stub.getState("k"));
        assertEquals("v1", text(stored));
        assertEquals(1, ledger.keyCount());
    }

    @Test
    @DisplayName("Failed work leaves no state and no history behind")
    void testRollbackOnFailure() {
        assertThrows(IllegalStateException.class, () -> ledger.execute(stub -> {
            stub.putState("k", bytes("v1"));
            throw new IllegalStateException("boom");
        }));

        assertEquals(0, ledger.keyCount());
        assertEquals(0, ledger.committedTransactionCount());
        assertTrue(ledger.execute(stub -> drain(stub.getHistoryForKey("k"))).isEmpty());
    }

    @Test
    @DisplayName("Second write to the same key in one transaction replaces the first")
    void testLastWriteWins() {
        ledger.execute(stub -> {
            stub.putState("k", bytes("first"));
            stub.putState("k", bytes("second"));
            return null;
        });

        assertEquals("second", text(ledger.execute(stub -> stub.getState("k"))));
        List<KeyModification> history = ledger.execute(stub -> drain(stub.getHistoryForKey("k")));
        assertEquals(1, history.size());
    }

    @Test
    @DisplayName("History lists every committed version oldest first with transaction id and timestamp")
    void testHistoryOrder() {
        ledger.execute(stub -> {
            stub.putState("k", bytes("v1"));
            return null;
        });
        ledger.execute(stub -> {
            stub.putState("k", bytes("v2"));
            return null;
        });
        try (InMemoryTransaction tx = ledger.begin()) {
            tx.delete("k");
            tx.commit();
        }

        List<KeyModification> history = ledger.execute(stub -> drain(stub.getHistoryForKey("k")));

        assertEquals(3, history.size());
        assertEquals("v1", text(history.get(0).getValue()));
        assertEquals("v2", text(history.get(1).getValue()));
        assertTrue(history.get(2).isDelete());
        assertNull(history.get(2).getValue());
        assertFalse(history.get(2).hasPayload());
        assertEquals(NOW, history.get(0).getTimestamp());
        assertNotEquals(history.get(0).getTxId(), history.get(1).getTxId());
        byte[] value = ledger.execute(stub -> stub.getState("k"));
        assertNull(value);
    }

    @Test
    @DisplayName("Partial composite key scan returns only matching keys in byte order")
    void testPartialCompositeKeyScan() {
        ledger.execute(stub -> {
            stub.putState(CompositeKey.of("account~email", "b@x.com", "B1").encode(), new byte[]{0});
            stub.putState(CompositeKey.of("account~email", "a@x.com", "A2").encode(), new byte[]{0});
            stub.putState(CompositeKey.of("account~email", "a@x.com", "A1").encode(), new byte[]{0});
            stub.putState(CompositeKey.of("account~email", "a@x.com.au", "C1").encode(), new byte[]{0});
            stub.putState(CompositeKey.of("doc~type", "participant", "a@x.com").encode(), new byte[]{0});
            stub.putState("a@x.com", bytes("{}"));
            return null;
        });

        List<String> accountIds = ledger.execute(stub -> {
            List<String> ids = new ArrayList<>();
            try (LedgerResultsIterator<LedgerKeyValue> it =
                         stub.getStateByPartialCompositeKey("account~email", List.of("a@x.com"))) {
                it.forEachRemaining(kv -> ids.add(stub.splitCompositeKey(kv.getKey()).segment(1)));
            }
            return ids;
        });

        assertEquals(List.of("A1", "A2"), accountIds);
    }

    @Test
    @DisplayName("Commit fails when a read key changed after it was read")
    void testVersionConflict() {
        ledger.execute(stub -> {
            stub.putState("k", bytes("v1"));
            return null;
        });

        InMemoryTransaction slow = ledger.begin();
        slow.getState("k");
        slow.putState("k", bytes("slow"));

        ledger.execute(stub -> {
            stub.getState("k");
            stub.putState("k", bytes("fast"));
            return null;
        });

        TransactionConflictException e = assertThrows(TransactionConflictException.class, slow::commit);
        assertEquals("k", e.getKey());
        assertFalse(slow.isActive());
        assertEquals("fast", text(ledger.execute(stub -> stub.getState("k"))));
        assertEquals(1, ledger.conflictCount());
    }

    @Test
    @DisplayName("Version validation can be switched off")
    void testVersionValidationDisabled() {
        InMemoryLedger lenient = new InMemoryLedger(Clock.fixed(NOW, ZoneOffset.UTC), false);
        InMemoryTransaction slow = lenient.begin();
        slow.getState("k");
        slow.putState("k", bytes("slow"));
        lenient.execute(stub -> {
            stub.putState("k", bytes("fast"));
            return null;
        });

        slow.commit();

        assertEquals("slow", text(lenient.execute(stub -> stub.getState("k"))));
    }

    @Test
    @DisplayName("Finished transactions reject further use")
    void testFinishedTransaction() {
        InMemoryTransaction tx = ledger.begin();
        tx.rollback();

        assertThrows(IllegalStateException.class, () -> tx.getState("k"));
        assertThrows(IllegalStateException.class, () -> tx.putState("k", bytes("v")));
        assertThrows(IllegalStateException.class, tx::commit);
    }

    @Test
    @DisplayName("Empty values and blank keys are rejected")
    void testInvalidWrites() {
        try (InMemoryTransaction tx = ledger.begin()) {
            assertThrows(IllegalArgumentException.class, () -> tx.putState("k", new byte[0]));
            assertThrows(IllegalArgumentException.class, () -> tx.putState("", bytes("v")));
        }
    }

    @Test
    @DisplayName("Closed results iterator yields nothing more")
    void testClosedIterator() {
        ledger.execute(stub -> {
            stub.putState("k", bytes("v1"));
            return null;
        });

        try (InMemoryTransaction tx = ledger.begin()) {
            LedgerResultsIterator<KeyModification> it = tx.getHistoryForKey("k");
            assertTrue(it.hasNext());
            it.close();
            assertFalse(it.hasNext());
        }
    }

    private static <T> List<T> drain(LedgerResultsIterator<T> iterator) {
        List<T> results = new ArrayList<>();
        try (iterator) {
            iterator.forEachRemaining(results::add);
        }
        return results;
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private static String text(byte[] value) {
        return value == null ? null : new String(value, StandardCharsets.UTF_8);
    }
}

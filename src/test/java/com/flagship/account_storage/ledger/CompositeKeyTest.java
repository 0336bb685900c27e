package com.flagship.account_storage.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CompositeKeyTest {

    @Test
    @DisplayName("Composite key encodes index name and segments between U+0000 separators")
    void testEncode() {
        String key = CompositeKey.of("account~email", "e@x.com", "A1").encode();

        assertEquals("\u0000account~email\u0000e@x.com\u0000A1\u0000", key);
        assertTrue(CompositeKey.isComposite(key));
    }

    @Test
    @DisplayName("Encoded key splits back into index name and segments")
    void testDecode() {
        CompositeKey key = CompositeKey.decode("\u0000doc~type\u0000participant\u0000e@x.com\u0000");

        assertEquals("doc~type", key.getIndexName());
        assertEquals(List.of("participant", "e@x.com"), key.getSegments());
        assertEquals("e@x.com", key.segment(1));
        assertNull(key.segment(2));
    }

    @Test
    @DisplayName("Prefix key matches longer keys only on whole segments")
    void testPrefixMatchesWholeSegments() {
        String prefix = CompositeKey.of("account~email", "e@x.co").encode();

        assertTrue(CompositeKey.of("account~email", "e@x.co", "A1").encode().startsWith(prefix));
        assertFalse(CompositeKey.of("account~email", "e@x.com", "A1").encode().startsWith(prefix));
    }

    @Test
    @DisplayName("Index name without segments is a valid key")
    void testNoSegments() {
        CompositeKey key = CompositeKey.decode(CompositeKey.of("doc~type").encode());

        assertEquals("doc~type", key.getIndexName());
        assertTrue(key.getSegments().isEmpty());
    }

    @Test
    @DisplayName("Segments and index names containing U+0000 are rejected")
    void testRejectsSeparatorInParts() {
        assertThrows(IllegalArgumentException.class, () -> CompositeKey.of("doc~type", "a\u0000b"));
        assertThrows(IllegalArgumentException.class, () -> CompositeKey.of("doc\u0000type", "a"));
        assertThrows(IllegalArgumentException.class, () -> CompositeKey.of("", "a"));
    }

    @Test
    @DisplayName("Simple keys are not composite keys")
    void testDecodeRejectsSimpleKey() {
        assertFalse(CompositeKey.isComposite("A1"));
        assertThrows(IllegalArgumentException.class, () -> CompositeKey.decode("A1"));
        assertThrows(IllegalArgumentException.class, () -> CompositeKey.decode("\u0000doc~type"));
    }
}

package com.flagship.account_storage.ledger;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * An index name plus ordered string segments, encoded into a single sortable ledger key.
 *
 * Encoding: {@code U+0000 indexName U+0000 (segment U+0000)*}. The leading separator keeps
 * composite keys apart from simple keys, and the trailing separator after every segment
 * makes a key built from a prefix of segments a byte prefix of every longer key.
 */
@Value
public class CompositeKey {

    public static final char SEPARATOR = '\u0000';

    String indexName;
    List<String> segments;

    public CompositeKey(String indexName, List<String> segments) {
        validateIndexName(indexName);
        if (segments == null) {
            throw new IllegalArgumentException("Composite key segments are required");
        }
        segments.forEach(CompositeKey::validateSegment);
        this.indexName = indexName;
        this.segments = List.copyOf(segments);
    }

    public static CompositeKey of(String indexName, String... segments) {
        return new CompositeKey(indexName, List.of(segments));
    }

    /**
     * Renders this key into its ledger representation.
     */
    public String encode() {
        StringBuilder key = new StringBuilder()
                .append(SEPARATOR)
                .append(indexName)
                .append(SEPARATOR);
        for (String segment : segments) {
            key.append(segment).append(SEPARATOR);
        }
        return key.toString();
    }

    /**
     * Parses a key produced by {@link #encode()}.
     *
     * @throws IllegalArgumentException if the key is not a composite key
     */
    public static CompositeKey decode(String key) {
        if (!isComposite(key) || key.charAt(key.length() - 1) != SEPARATOR || key.length() < 3) {
            throw new IllegalArgumentException("Not a composite key: " + key.replace(SEPARATOR, '~'));
        }
        List<String> parts = new ArrayList<>();
        int start = 1;
        for (int i = 1; i < key.length(); i++) {
            if (key.charAt(i) == SEPARATOR) {
                parts.add(key.substring(start, i));
                start = i + 1;
            }
        }
        return new CompositeKey(parts.get(0), parts.subList(1, parts.size()));
    }

    public static boolean isComposite(String key) {
        return key != null && !key.isEmpty() && key.charAt(0) == SEPARATOR;
    }

    /**
     * Returns the segment at {@code index}, or {@code null} when the key has fewer segments.
     */
    public String segment(int index) {
        return index < segments.size() ? segments.get(index) : null;
    }

    private static void validateIndexName(String indexName) {
        if (indexName == null || indexName.isEmpty()) {
            throw new IllegalArgumentException("Composite key index name is required");
        }
        if (indexName.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException("Composite key index name contains U+0000");
        }
    }

    private static void validateSegment(String segment) {
        if (segment == null) {
            throw new IllegalArgumentException("Composite key segment cannot be null");
        }
        if (segment.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException("Composite key segment contains U+0000: " + segment);
        }
    }
}

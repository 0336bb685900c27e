package com.flagship.account_storage.codec;

import com.flagship.account_storage.account.Account;
import com.flagship.account_storage.config.JacksonConfig;
import com.flagship.account_storage.contract.dto.HistoryQueryResult;
import com.flagship.account_storage.exception.CorruptRecordException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class LedgerRecordCodecTest {

    private final LedgerRecordCodec codec = new LedgerRecordCodec(new JacksonConfig().objectMapper());

    @Test
    void testUnknownFieldsAreSkipped() {
        String json = "{\"id\":\"A1\",\"currency\":\"USD\",\"balance\":7,\"email\":\"e@x.com\",\"branch\":\"north\"}";

        Account account = codec.decode(bytes(json), Account.class, "A1");

        assertEquals("A1", account.getId());
        assertEquals(7, account.getBalance());
    }

    @Test
    void testNullBalanceIsCorrupt() {
        String json = "{\"id\":\"A1\",\"currency\":\"USD\",\"balance\":null,\"email\":\"e@x.com\"}";

        CorruptRecordException e = assertThrows(CorruptRecordException.class,
                () -> codec.decode(bytes(json), Account.class, "A1"));
        assertTrue(e.getMessage().contains("A1"));
    }

    @Test
    void testJsonNullIsCorrupt() {
        assertThrows(CorruptRecordException.class, () -> codec.decode(bytes("null"), Account.class, "A1"));
    }

    @Test
    void testTimestampsWrittenAsIsoStrings() {
        HistoryQueryResult result = HistoryQueryResult.builder()
                .record(Account.placeholder("A1"))
                .txId("tx1")
                .timestamp(Instant.parse("2024-01-01T00:00:00Z"))
                .delete(true)
                .build();

        String json = new String(codec.encode(result), StandardCharsets.UTF_8);

        assertTrue(json.contains("\"timestamp\":\"2024-01-01T00:00:00Z\""));
        assertTrue(json.contains("\"isDelete\":true"));
    }

    private static byte[] bytes(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }
}

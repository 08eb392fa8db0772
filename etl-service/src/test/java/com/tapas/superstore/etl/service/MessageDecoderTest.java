package com.tapas.superstore.etl.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tapas.superstore.etl.exception.MalformedRecordException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MessageDecoderTest {

    private final MessageDecoder decoder = new MessageDecoder(new ObjectMapper());

    private static String encode(String json) {
        return Base64.getEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void decodesSingleObject() {
        List<Map<String, Object>> records = decoder.decode(encode("""
                {"Customer ID": "CG-12520", "Sales": 261.96, "Quantity": 2, "Postal Code": 42420}
                """));

        assertEquals(1, records.size());
        Map<String, Object> record = records.get(0);
        assertEquals("CG-12520", record.get("Customer ID"));
        assertEquals(new BigDecimal("261.96"), record.get("Sales"));
        assertEquals(2, ((Number) record.get("Quantity")).intValue());
        assertEquals(List.of("Customer ID", "Sales", "Quantity", "Postal Code"), List.copyOf(record.keySet()));
    }

    @Test
    void decodesArrayOfObjects() {
        List<Map<String, Object>> records = decoder.decode(encode("""
                [{"Order ID": "O1"}, {"Order ID": "O2"}]
                """));

        assertEquals(2, records.size());
        assertEquals("O2", records.get(1).get("Order ID"));
    }

    @Test
    void keepsExplicitNulls() {
        Map<String, Object> record = decoder.decode(encode("{\"Profit\": null}")).get(0);

        assertTrue(record.containsKey("Profit"));
        assertNull(record.get("Profit"));
    }

    @Test
    void rejectsInvalidBase64() {
        var ex = assertThrows(MalformedRecordException.class, () -> decoder.decode("not base64 at all!"));
        assertTrue(ex.getMessage().contains("base64"));
    }

    @Test
    void rejectsInvalidUtf8() {
        String encoded = Base64.getEncoder().encodeToString(new byte[]{'{', (byte) 0xC3, (byte) 0x28, '}'});

        var ex = assertThrows(MalformedRecordException.class, () -> decoder.decode(encoded));
        assertTrue(ex.getMessage().contains("UTF-8"));
    }

    @Test
    void rejectsInvalidJson() {
        var ex = assertThrows(MalformedRecordException.class, () -> decoder.decode(encode("{\"Sales\": ")));
        assertTrue(ex.getMessage().contains("JSON"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"42", "\"text\"", "[]", "[1, 2]", "[{\"a\": 1}, 3]", "null"})
    void rejectsNonRecordJson(String json) {
        assertThrows(MalformedRecordException.class, () -> decoder.decode(encode(json)));
    }

    @Test
    void rejectsEmptyBody() {
        assertThrows(MalformedRecordException.class, () -> decoder.decode(""));
        assertThrows(MalformedRecordException.class, () -> decoder.decode(null));
    }
}

package com.wardensystems.service;

import com.wardensystems.protocol.ErrorCode;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PayloadsTest {

    @Test
    void readsStrings() {
        Map<String, Object> payload = Map.of("username", "ada");

        assertEquals("ada", Payloads.requireString(payload, "username"));
        assertEquals("email", Payloads.optionalString(payload, "type", "email"));
    }

    @Test
    void missingOrBlankStringIsInvalid() {
        ServiceException missing = assertThrows(ServiceException.class, () -> Payloads.requireString(Map.of(), "email"));
        assertEquals(ErrorCode.INVALID_PAYLOAD, missing.getErrorCode());
        assertThrows(ServiceException.class, () -> Payloads.requireString(Map.of("email", "  "), "email"));
    }

    @Test
    void readsNumbersAndNumericStrings() {
        assertEquals(7L, Payloads.requireLong(Map.of("user_id", 7), "user_id"));
        assertEquals(7L, Payloads.requireLong(Map.of("user_id", " 7 "), "user_id"));
        assertEquals(1L, Payloads.optionalLong(Map.of(), "quantity", 1));
    }

    @Test
    void nonNumericValueIsInvalid() {
        ServiceException error = assertThrows(ServiceException.class,
                () -> Payloads.requireLong(Map.of("user_id", "seven"), "user_id"));
        assertEquals(ErrorCode.INVALID_PAYLOAD, error.getErrorCode());
        assertTrue(error.getMessage().contains("seven"));
    }
}

package io.unitledger.core.protocol;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UnitsTest {

    @Test
    void addReportsOverflowAsLedgerError() {
        LedgerException ex = assertThrows(LedgerException.class, () -> Units.add(Long.MAX_VALUE, 1L));
        assertEquals(LedgerError.ARITHMETIC_OVERFLOW, ex.error());
        assertEquals(5L, Units.add(2L, 3L));
    }

    @Test
    void requirePositiveRejectsZeroAndNegatives() {
        assertEquals(LedgerError.INVALID_AMOUNT, assertThrows(LedgerException.class, () -> Units.requirePositive(0L, "units")).error());
        assertEquals(LedgerError.INVALID_AMOUNT, assertThrows(LedgerException.class, () -> Units.requirePositive(-1L, "units")).error());
    }

    @Test
    void addressShapeRules() {
        assertTrue(Address.isValid("asset:usdx"));
        assertTrue(Address.isValid("user_b-1.x"));
        assertFalse(Address.isValid("a"));
        assertFalse(Address.isValid("has space"));
        assertFalse(Address.isValid("x".repeat(ProtocolLimits.MAX_ADDRESS_LEN + 1)));
        assertFalse(Address.isValid(null));
        assertEquals(LedgerError.INVALID_ADDRESS, assertThrows(LedgerException.class, () -> Address.require("", "beneficiary")).error());
    }
}

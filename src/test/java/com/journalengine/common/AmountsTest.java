package com.journalengine.common;

import com.journalengine.common.exception.InvalidAmountException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class AmountsTest {

    @Test
    void testSigns() {
        assertEquals(new BigDecimal("-12.30"), Amounts.negative(new BigDecimal("12.30")));
        assertEquals(new BigDecimal("-12.30"), Amounts.negative(new BigDecimal("-12.30")));
        assertEquals(new BigDecimal("12.30"), Amounts.positive(new BigDecimal("-12.30")));
        assertThrows(IllegalArgumentException.class, () -> Amounts.positive(null));
    }

    @Test
    void testParseAmount() {
        assertEquals(0, new BigDecimal("42.5").compareTo(Amounts.parseAmount(" 42.50 ")));
        assertEquals(0, new BigDecimal("3").compareTo(Amounts.parseAmount(3)));
    }

    @Test
    void testParseAmount_Rejects() {
        assertThrows(InvalidAmountException.class, () -> Amounts.parseAmount(""));
        assertThrows(InvalidAmountException.class, () -> Amounts.parseAmount(null));
        assertThrows(InvalidAmountException.class, () -> Amounts.parseAmount("0.00"));
        assertThrows(InvalidAmountException.class, () -> Amounts.parseAmount("1,5"));
    }

    @Test
    void testParseForeignAmount() {
        assertNull(Amounts.parseForeignAmount(null));
        assertNull(Amounts.parseForeignAmount(""));
        assertNull(Amounts.parseForeignAmount("0"));
        assertNull(Amounts.parseForeignAmount("abc"));
        assertEquals(0, new BigDecimal("9.99").compareTo(Amounts.parseForeignAmount("9.99")));
    }

    @Test
    void testCanonical() {
        assertEquals("100", Amounts.canonical(new BigDecimal("100.000000000000")));
        assertEquals("-0.5", Amounts.canonical(new BigDecimal("-0.50")));
        assertEquals("0", Amounts.canonical(new BigDecimal("0.00")));
        assertEquals("", Amounts.canonical(null));
    }
}

package com.flagship.transaction_engine.transaction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class PositiveAmountTest {

    @Test
    @DisplayName("Positive amounts are accepted and keep their exact value")
    void testPositiveAmount() {
        PositiveAmount amount = PositiveAmount.of(new BigDecimal("5.0001"));

        assertEquals(new BigDecimal("5.0001"), amount.getValue());
        assertEquals("5.0001", amount.toString());
    }

    @Test
    @DisplayName("Zero amount should be rejected")
    void testZeroAmount_ShouldFail() {
        InvalidAmountException exception = assertThrows(
            InvalidAmountException.class,
            () -> PositiveAmount.of(new BigDecimal("0.000"))
        );
        assertTrue(exception.getMessage().contains("zero"));
    }

    @Test
    @DisplayName("Negative amount should be rejected")
    void testNegativeAmount_ShouldFail() {
        InvalidAmountException exception = assertThrows(
            InvalidAmountException.class,
            () -> PositiveAmount.of(new BigDecimal("-5.0"))
        );
        assertTrue(exception.getMessage().contains("negative"));
    }

    @Test
    @DisplayName("Null amount should be rejected")
    void testNullAmount_ShouldFail() {
        assertThrows(InvalidAmountException.class, () -> PositiveAmount.of(null));
    }

    @Test
    @DisplayName("Parsing trims whitespace and rejects non-numbers")
    void testParse() {
        assertEquals(new BigDecimal("1.1"), PositiveAmount.parse(" 1.1 ").getValue());

        assertThrows(InvalidAmountException.class, () -> PositiveAmount.parse("abc"));
        assertThrows(InvalidAmountException.class, () -> PositiveAmount.parse("-1"));
        assertThrows(InvalidAmountException.class, () -> PositiveAmount.parse(""));
    }

    @Test
    @DisplayName("InvalidAmountException is an IllegalArgumentException")
    void testExceptionHierarchy() {
        assertThrows(IllegalArgumentException.class, () -> PositiveAmount.parse("0"));
    }

    @Test
    @DisplayName("Exponent notation is refused when parsing")
    void testParseExponentNotation_ShouldFail() {
        InvalidAmountException exception = assertThrows(
            InvalidAmountException.class,
            () -> PositiveAmount.parse("1e-5000000")
        );
        assertTrue(exception.getMessage().contains("plain decimal"));
        assertThrows(InvalidAmountException.class, () -> PositiveAmount.parse("1E+3"));
    }

    @Test
    @DisplayName("More than 28 decimal places should be rejected")
    void testScaleAboveMaximum_ShouldFail() {
        BigDecimal tooFine = BigDecimal.ONE.movePointLeft(29);

        InvalidAmountException exception = assertThrows(
            InvalidAmountException.class,
            () -> PositiveAmount.of(tooFine)
        );
        assertTrue(exception.getMessage().contains("decimal places"));
        assertThrows(InvalidAmountException.class, () -> PositiveAmount.of(new BigDecimal("1E-5000000")));
    }

    @Test
    @DisplayName("Exactly 28 decimal places are accepted, trailing zeros beyond that are dropped")
    void testScaleAtMaximum() {
        BigDecimal finest = BigDecimal.ONE.movePointLeft(28);
        assertEquals(finest, PositiveAmount.of(finest).getValue());

        PositiveAmount padded = PositiveAmount.parse("1.5" + "0".repeat(40));
        assertEquals(new BigDecimal("1.5"), padded.getValue());
    }

    @Test
    @DisplayName("More than 28 integer digits should be rejected")
    void testMagnitudeAboveMaximum_ShouldFail() {
        assertThrows(InvalidAmountException.class, () -> PositiveAmount.parse("1" + "0".repeat(28)));
        assertThrows(InvalidAmountException.class, () -> PositiveAmount.of(new BigDecimal("1E+5000000")));

        assertEquals(new BigDecimal("9".repeat(28)), PositiveAmount.parse("9".repeat(28)).getValue());
    }

    @Test
    @DisplayName("Negative scales are normalized to whole numbers")
    void testNegativeScaleNormalized() {
        PositiveAmount amount = PositiveAmount.of(new BigDecimal("1E+3"));

        assertEquals(0, amount.getValue().scale());
        assertEquals("1000", amount.toString());
    }
}

package com.flagship.transaction_engine.transaction;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Exact decimal amount that is strictly greater than zero.
 *
 * The positivity check happens once, here. Every deposit and withdrawal carries one of these,
 * so no downstream code re-validates the sign.
 *
 * Precision is bounded: at most {@value #MAX_SCALE} fractional digits and
 * {@value #MAX_INTEGER_DIGITS} integer digits. The scale is never negative.
 */
@Value
public class PositiveAmount {
    public static final int MAX_SCALE = 28;
    public static final int MAX_INTEGER_DIGITS = 28;

    BigDecimal value;

    private PositiveAmount(BigDecimal value) {
        this.value = value;
    }

    /**
     * @throws InvalidAmountException if the value is null, zero, negative or out of the supported precision
     */
    public static PositiveAmount of(BigDecimal value) {
        if (value == null) {
            throw new InvalidAmountException("Amount is required");
        }
        if (value.signum() < 0) {
            throw new InvalidAmountException("Amount must be positive, got negative amount " + value);
        }
        if (value.signum() == 0) {
            throw new InvalidAmountException("Amount must be positive, got zero");
        }

        BigDecimal bounded = value.scale() > MAX_SCALE ? value.stripTrailingZeros() : value;
        if (bounded.scale() > MAX_SCALE) {
            throw new InvalidAmountException(
                String.format("Amount has more than %d decimal places (scale %d)", MAX_SCALE, bounded.scale()));
        }
        // precision - scale is the number of integer digits, also for negative scales
        if ((long) bounded.precision() - bounded.scale() > MAX_INTEGER_DIGITS) {
            throw new InvalidAmountException(
                String.format("Amount has more than %d integer digits", MAX_INTEGER_DIGITS));
        }
        if (bounded.scale() < 0) {
            bounded = bounded.setScale(0);
        }
        return new PositiveAmount(bounded);
    }

    /**
     * Parses a plain decimal string such as {@code "1.2345"}. Exponent notation is refused.
     *
     * @throws InvalidAmountException if the text is not a plain decimal number, is not positive
     *                                or is out of the supported precision
     */
    public static PositiveAmount parse(String text) {
        Objects.requireNonNull(text, "text");
        if (text.indexOf('e') >= 0 || text.indexOf('E') >= 0) {
            throw new InvalidAmountException("Amount must be a plain decimal number: '" + text + "'");
        }
        BigDecimal parsed;
        try {
            parsed = new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            throw new InvalidAmountException("Amount is not a decimal number: '" + text + "'", e);
        }
        return of(parsed);
    }

    @Override
    public String toString() {
        return value.toPlainString();
    }
}

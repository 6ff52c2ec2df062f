package com.example.fulfillment.domain.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Value Object representing a non-negative amount in integer minor units
 * (kopecks, cents) of a single currency.
 */
public final class Money {

    private static final String DEFAULT_CURRENCY = "RUB";
    private static final int MINOR_DIGITS = 2;

    private final long minorUnits;
    private final String currency;

    private Money(long minorUnits, String currency) {
        if (minorUnits < 0) {
            throw new IllegalArgumentException("Amount cannot be negative: " + minorUnits);
        }
        this.minorUnits = minorUnits;
        this.currency = Objects.requireNonNull(currency, "Currency cannot be null");
    }

    /**
     * Creates Money from minor units in the default currency.
     *
     * @param minorUnits amount in minor units
     * @return new Money instance
     * @throws IllegalArgumentException if amount is negative
     */
    public static Money ofMinor(long minorUnits) {
        return new Money(minorUnits, DEFAULT_CURRENCY);
    }

    public static Money ofMinor(long minorUnits, String currency) {
        return new Money(minorUnits, currency);
    }

    public static Money zero() {
        return new Money(0, DEFAULT_CURRENCY);
    }

    public Money add(Money other) {
        requireSameCurrency(other);
        return new Money(Math.addExact(this.minorUnits, other.minorUnits), currency);
    }

    /**
     * @throws IllegalArgumentException if the result would be negative
     */
    public Money subtract(Money other) {
        requireSameCurrency(other);
        return new Money(this.minorUnits - other.minorUnits, currency);
    }

    /**
     * Returns the given percentage of this amount, rounded up to the next
     * minor unit, so that a share never undercharges.
     *
     * @param percent value in [0, 100]
     */
    public Money percentRoundedUp(int percent) {
        if (percent < 0 || percent > 100) {
            throw new IllegalArgumentException("Percent must be within 0..100: " + percent);
        }
        long share = Math.floorDiv(Math.multiplyExact(minorUnits, percent) + 99, 100);
        return new Money(share, currency);
    }

    public boolean isZero() {
        return minorUnits == 0;
    }

    public long getMinorUnits() {
        return minorUnits;
    }

    public String getCurrency() {
        return currency;
    }

    /**
     * Decimal form used on the wire by payment gateways, e.g. {@code 1234.50}.
     */
    public String toDecimalString() {
        return BigDecimal.valueOf(minorUnits, MINOR_DIGITS).toPlainString();
    }

    private void requireSameCurrency(Money other) {
        Objects.requireNonNull(other, "Money cannot be null");
        if (!this.currency.equals(other.currency)) {
            throw new IllegalArgumentException(
                    "Currency mismatch: " + this.currency + " vs " + other.currency);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Money money = (Money) o;
        return minorUnits == money.minorUnits && currency.equals(money.currency);
    }

    @Override
    public int hashCode() {
        return Objects.hash(minorUnits, currency);
    }

    @Override
    public String toString() {
        return toDecimalString() + " " + currency;
    }
}

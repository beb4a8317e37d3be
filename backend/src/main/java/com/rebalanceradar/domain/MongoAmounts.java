package com.rebalanceradar.domain;

import lombok.extern.slf4j.Slf4j;
import org.bson.types.Decimal128;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Decimal128 values for accumulated totals. Raw on-chain amounts are uint256 and can carry up to 78
 * digits, more than Decimal128's 34; those are rounded half-even to 34 significant digits here
 * instead of failing the write. Records keep the exact amount as a decimal string.
 */
@Slf4j
public final class MongoAmounts {

    public static final Decimal128 ZERO = new Decimal128(BigDecimal.ZERO);

    private MongoAmounts() {
    }

    public static Decimal128 decimal(BigDecimal value) {
        return value == null ? ZERO : new Decimal128(fit(value));
    }

    /** The value itself when Decimal128 holds it exactly, else its DECIMAL128 rounding. */
    public static BigDecimal fit(BigDecimal value) {
        if (value.precision() <= MathContext.DECIMAL128.getPrecision()) {
            return value;
        }
        BigDecimal rounded = value.round(MathContext.DECIMAL128);
        log.info("Amount {} exceeds Decimal128 precision; totals use {}", value.toPlainString(), rounded);
        return rounded;
    }
}

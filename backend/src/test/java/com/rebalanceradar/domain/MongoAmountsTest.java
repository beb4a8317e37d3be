package com.rebalanceradar.domain;

import org.bson.types.Decimal128;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

import static org.assertj.core.api.Assertions.assertThat;

class MongoAmountsTest {

    /** 2^256 - 1, the largest uint256: 78 digits. */
    private static final BigInteger MAX_UINT256 = BigInteger.TWO.pow(256).subtract(BigInteger.ONE);

    @Test
    void decimal_uint256Max_isRoundedInsteadOfRejected() {
        BigDecimal amount = new BigDecimal(MAX_UINT256);
        assertThat(amount.precision()).isEqualTo(78);

        Decimal128 stored = MongoAmounts.decimal(amount);

        assertThat(stored.bigDecimalValue()).isEqualByComparingTo(amount.round(MathContext.DECIMAL128));
        assertThat(stored.bigDecimalValue().precision()).isLessThanOrEqualTo(34);
    }

    @Test
    void decimal_thirtySevenDigitAmount_isRounded() {
        BigDecimal amount = new BigDecimal("1234567890123456789012345678901234567");

        assertThat(MongoAmounts.decimal(amount).bigDecimalValue())
                .isEqualByComparingTo(new BigDecimal("1.234567890123456789012345678901235E+36"));
    }

    @Test
    void decimal_amountWithinPrecision_isExact() {
        BigDecimal wei = new BigDecimal("1234567890123456789012345678901234");

        assertThat(MongoAmounts.decimal(wei).bigDecimalValue()).isEqualTo(wei);
        assertThat(MongoAmounts.fit(wei)).isSameAs(wei);
    }

    @Test
    void decimal_null_isZero() {
        assertThat(MongoAmounts.decimal(null)).isEqualTo(MongoAmounts.ZERO);
    }
}

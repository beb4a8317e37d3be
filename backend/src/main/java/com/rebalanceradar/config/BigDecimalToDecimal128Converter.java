package com.rebalanceradar.config;

import com.rebalanceradar.domain.MongoAmounts;
import org.bson.types.Decimal128;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.WritingConverter;

import java.math.BigDecimal;

/**
 * Writes BigDecimal totals as Decimal128 instead of the default string form, rounding values wider
 * than 34 digits.
 */
@WritingConverter
public class BigDecimalToDecimal128Converter implements Converter<BigDecimal, Decimal128> {

    @Override
    public Decimal128 convert(BigDecimal source) {
        return source == null ? null : new Decimal128(MongoAmounts.fit(source));
    }
}

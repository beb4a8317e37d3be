package com.rebalanceradar.config;

import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.WritingConverter;

import java.math.BigInteger;

/**
 * Writes raw uint256 amounts as exact decimal strings.
 */
@WritingConverter
public class BigIntegerToStringConverter implements Converter<BigInteger, String> {

    @Override
    public String convert(BigInteger source) {
        return source == null ? null : source.toString();
    }
}

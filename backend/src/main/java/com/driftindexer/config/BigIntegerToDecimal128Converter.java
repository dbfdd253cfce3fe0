package com.driftindexer.config;

import org.bson.types.Decimal128;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.WritingConverter;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Writes BigInteger as Decimal128. Every u64 fits in Decimal128's 34 significant digits.
 */
@WritingConverter
public class BigIntegerToDecimal128Converter implements Converter<BigInteger, Decimal128> {

    @Override
    public Decimal128 convert(BigInteger source) {
        return source == null ? null : new Decimal128(new BigDecimal(source));
    }
}

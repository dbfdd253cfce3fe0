package com.driftindexer.config;

import org.bson.types.Decimal128;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;

import java.math.BigInteger;

@ReadingConverter
public class Decimal128ToBigIntegerConverter implements Converter<Decimal128, BigInteger> {

    @Override
    public BigInteger convert(Decimal128 source) {
        return source == null ? null : source.bigDecimalValue().toBigIntegerExact();
    }
}

package com.driftindexer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import java.util.Arrays;

/**
 * MongoDB configuration: u64 event fields are held as BigInteger and stored as Decimal128 so they stay
 * numeric and lossless above Long.MAX_VALUE.
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoCustomConversions customConversions() {
        return new MongoCustomConversions(Arrays.asList(
                new BigIntegerToDecimal128Converter(),
                new Decimal128ToBigIntegerConverter()
        ));
    }
}

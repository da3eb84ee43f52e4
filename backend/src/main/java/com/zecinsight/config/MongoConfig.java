package com.zecinsight.config;

import org.bson.types.Decimal128;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * ZEC amounts (payments, earnings, withdrawals) are the only BigDecimal fields and are stored as Decimal128
 * at zatoshi precision, so sums computed by Mongo match sums computed in Java.
 */
@Configuration
public class MongoConfig {

    /** Fraction digits of one zatoshi. */
    public static final int ZEC_SCALE = 8;

    @Bean
    public MongoCustomConversions customConversions() {
        return new MongoCustomConversions(List.of(new ZecAmountWriter(), new ZecAmountReader()));
    }

    @WritingConverter
    static class ZecAmountWriter implements Converter<BigDecimal, Decimal128> {

        @Override
        public Decimal128 convert(BigDecimal amount) {
            return new Decimal128(amount.setScale(ZEC_SCALE, RoundingMode.HALF_EVEN));
        }
    }

    @ReadingConverter
    static class ZecAmountReader implements Converter<Decimal128, BigDecimal> {

        @Override
        public BigDecimal convert(Decimal128 stored) {
            return stored.bigDecimalValue();
        }
    }
}

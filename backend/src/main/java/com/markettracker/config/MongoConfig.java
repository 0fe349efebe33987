package com.markettracker.config;

import org.bson.types.Decimal128;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

/**
 * MongoDB configuration: OHLC prices, volumes and screener ratios are stored as Decimal128.
 * Indexes come from @CompoundIndex / @Indexed on the documents (auto-index-creation).
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoCustomConversions customConversions() {
        return new MongoCustomConversions(List.of(new PriceWriter(), new PriceReader()));
    }

    /**
     * Rounds to 34 significant digits first; Decimal128 rejects anything it cannot hold exactly.
     */
    @WritingConverter
    static class PriceWriter implements Converter<BigDecimal, Decimal128> {

        @Override
        public Decimal128 convert(BigDecimal source) {
            if (source == null) {
                return null;
            }
            BigDecimal value = source.precision() > MathContext.DECIMAL128.getPrecision()
                    ? source.round(MathContext.DECIMAL128)
                    : source;
            return new Decimal128(value);
        }
    }

    @ReadingConverter
    static class PriceReader implements Converter<Decimal128, BigDecimal> {

        @Override
        public BigDecimal convert(Decimal128 source) {
            return source == null ? null : source.bigDecimalValue();
        }
    }
}

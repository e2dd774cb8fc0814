package com.lendguard.config;

import org.bson.types.Decimal128;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;

/**
 * Amounts, prices and health factors are stored as Decimal128. Indexes come from the @CompoundIndex and
 * @Indexed annotations on the documents (spring.data.mongodb.auto-index-creation).
 */
@Configuration
public class MongoConfig {

    /** Decimal128 holds 34 significant digits. */
    static final MathContext DECIMAL128_CONTEXT = new MathContext(34, RoundingMode.DOWN);

    @Bean
    public MongoCustomConversions customConversions() {
        return new MongoCustomConversions(List.of(
                BigDecimalToDecimal128.INSTANCE,
                Decimal128ToBigDecimal.INSTANCE));
    }

    /**
     * Wider values are rounded toward zero, so a stored health factor never exceeds the computed one.
     */
    @WritingConverter
    enum BigDecimalToDecimal128 implements Converter<BigDecimal, Decimal128> {
        INSTANCE;

        @Override
        public Decimal128 convert(BigDecimal source) {
            return new Decimal128(source.precision() > 34 ? source.round(DECIMAL128_CONTEXT) : source);
        }
    }

    @ReadingConverter
    enum Decimal128ToBigDecimal implements Converter<Decimal128, BigDecimal> {
        INSTANCE;

        @Override
        public BigDecimal convert(Decimal128 source) {
            return source.bigDecimalValue();
        }
    }
}

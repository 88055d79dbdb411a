package org.rx.ranges.core;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import org.rx.ranges.bean.Range;

import java.math.BigDecimal;

/**
 * Full ranges of the primitive wrapper types.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class Ranges {
    public static final Range<Byte> BYTE = Range.of(Byte.MIN_VALUE, Byte.MAX_VALUE);
    public static final Range<Short> SHORT = Range.of(Short.MIN_VALUE, Short.MAX_VALUE);
    public static final Range<Integer> INTEGER = Range.of(Integer.MIN_VALUE, Integer.MAX_VALUE);
    public static final Range<Long> LONG = Range.of(Long.MIN_VALUE, Long.MAX_VALUE);
    public static final Range<Character> CHARACTER = Range.of(Character.MIN_VALUE, Character.MAX_VALUE);
    //MIN_VALUE of float and double is the smallest positive value
    public static final Range<Float> FLOAT = Range.of(-Float.MAX_VALUE, Float.MAX_VALUE);
    public static final Range<Double> DOUBLE = Range.of(-Double.MAX_VALUE, Double.MAX_VALUE);

    /**
     * Exact {@code maximum - minimum}, never overflows.
     *
     * @throws NumberFormatException when a bound is NaN or infinite
     */
    public static <T extends Number & Comparable<? super T>> BigDecimal difference(@NonNull Range<T> range) {
        return toDecimal(range.getMaximum()).subtract(toDecimal(range.getMinimum()));
    }

    static BigDecimal toDecimal(Number num) {
        if (num instanceof BigDecimal) {
            return (BigDecimal) num;
        }
        //binary value, not the shortest decimal string
        if (num instanceof Double || num instanceof Float) {
            return new BigDecimal(num.doubleValue());
        }
        return new BigDecimal(num.toString());
    }
}

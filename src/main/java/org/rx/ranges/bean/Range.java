package org.rx.ranges.bean;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import org.rx.ranges.core.Ensure;
import org.rx.ranges.core.EnsureExtensions;

import java.io.Serializable;
import java.util.Map;

/**
 * Closed interval {@code [minimum, maximum]} over an ordered type.
 * <p>Both bounds are inclusive. Instances are immutable, {@code minimum <= maximum} always holds.
 *
 * @param <T> bound type
 */
@Getter
@EqualsAndHashCode
public final class Range<T extends Comparable<? super T>> implements Serializable {
    private static final long serialVersionUID = 1806724508151339052L;

    public static <T extends Comparable<? super T>> Range<T> of(T minimumAndMaximum) {
        return new Range<>(minimumAndMaximum);
    }

    public static <T extends Comparable<? super T>> Range<T> of(T minimum, T maximum) {
        return new Range<>(minimum, maximum);
    }

    /**
     * {@code left} as minimum, {@code right} as maximum.
     */
    public static <T extends Comparable<? super T>> Range<T> of(@NonNull Tuple<T, T> tuple) {
        return new Range<>(tuple.left, tuple.right);
    }

    public static <T extends Comparable<? super T>> Range<T> of(@NonNull Map.Entry<T, T> entry) {
        return new Range<>(entry.getKey(), entry.getValue());
    }

    public static <T extends Comparable<? super T>> boolean eq(Range<T> a, Range<T> b) {
        if (a == b) {
            return true;
        }
        return a != null && a.equals(b);
    }

    public static <T extends Comparable<? super T>> boolean ne(Range<T> a, Range<T> b) {
        return !eq(a, b);
    }

    private final T minimum;
    private final T maximum;

    public Range(@NonNull T minimumAndMaximum) {
        minimum = minimumAndMaximum;
        maximum = minimumAndMaximum;
    }

    /**
     * @throws org.rx.ranges.exception.InvalidArgumentException when {@code maximum < minimum}
     */
    public Range(@NonNull T minimum, @NonNull T maximum) {
        EnsureExtensions.maximumArgumentIsGreaterOrEqualToMinimum(Ensure.ALWAYS, minimum, maximum, "maximum");
        this.minimum = minimum;
        this.maximum = maximum;
    }

    public boolean contains(@NonNull T value) {
        return minimum.compareTo(value) <= 0 && maximum.compareTo(value) >= 0;
    }

    public boolean contains(@NonNull Range<T> range) {
        return contains(range.minimum) && contains(range.maximum);
    }

    public boolean isInside(@NonNull Range<T> range) {
        return range.contains(this);
    }

    public Tuple<T, T> toTuple() {
        return Tuple.of(minimum, maximum);
    }

    public Map.Entry<T, T> toMapEntry() {
        return toTuple().toMapEntry();
    }

    /**
     * Streams bypass the constructor, re-check the bounds here.
     */
    private Object readResolve() {
        return new Range<>(minimum, maximum);
    }

    @Override
    public String toString() {
        return "[" + minimum + ", " + maximum + "]";
    }
}

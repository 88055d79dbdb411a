package org.rx.ranges.core;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.rx.ranges.bean.Range;
import org.rx.ranges.exception.ArgumentOutOfRangeException;
import org.rx.ranges.exception.InvalidArgumentException;

/**
 * Precondition checks over ordered arguments.
 * <p>Every check is a no-op when its {@link Ensure} mode is disabled.
 */
@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class EnsureExtensions {
    static final String MAXIMUM_MESSAGE = "Maximum ({}) must be greater than or equal to the minimum ({}).";
    static final String OUT_OF_RANGE_MESSAGE = "Argument value [{}] is out of range {}.";

    //region maximumArgumentIsGreaterOrEqualToMinimum
    public static <T extends Comparable<? super T>> void maximumArgumentIsGreaterOrEqualToMinimum(Ensure root, T minimum, T maximum) {
        maximumArgumentIsGreaterOrEqualToMinimum(root, minimum, maximum, Constants.DEFAULT_MAXIMUM_ARGUMENT_NAME);
    }

    public static <T extends Comparable<? super T>> void maximumArgumentIsGreaterOrEqualToMinimum(Ensure root, T minimum, T maximum, String argumentName) {
        maximumArgumentIsGreaterOrEqualToMinimum(root, minimum, maximum, argumentName, null);
    }

    /**
     * @param message custom message, {@code null} uses the default one
     * @throws InvalidArgumentException when {@code maximum < minimum}
     */
    public static <T extends Comparable<? super T>> void maximumArgumentIsGreaterOrEqualToMinimum(@NonNull Ensure root, @NonNull T minimum, @NonNull T maximum,
                                                                                                   String argumentName, String message) {
        if (!root.isEnabled() || maximum.compareTo(minimum) >= 0) {
            return;
        }

        log.debug("Ensure {} failed, {}={} minimum={}", root, argumentName, maximum, minimum);
        if (message != null) {
            throw new InvalidArgumentException(argumentName, message);
        }
        throw new InvalidArgumentException(argumentName, MAXIMUM_MESSAGE, maximum, minimum);
    }
    //endregion

    //region argumentInRange
    public static <T extends Comparable<? super T>> void argumentInRange(Ensure root, T argument, Range<T> range) {
        argumentInRange(root, argument, range, Constants.DEFAULT_ARGUMENT_NAME);
    }

    public static <T extends Comparable<? super T>> void argumentInRange(Ensure root, T argument, Range<T> range, String argumentName) {
        argumentInRange(root, argument, range, argumentName, null);
    }

    /**
     * @param message custom message, {@code null} uses the default one
     * @throws ArgumentOutOfRangeException when {@code range} does not contain {@code argument}
     */
    public static <T extends Comparable<? super T>> void argumentInRange(@NonNull Ensure root, @NonNull T argument, @NonNull Range<T> range,
                                                                         String argumentName, String message) {
        if (!root.isEnabled() || range.contains(argument)) {
            return;
        }

        log.debug("Ensure {} failed, {}={} range={}", root, argumentName, argument, range);
        if (message != null) {
            throw new ArgumentOutOfRangeException(argumentName, argument, message);
        }
        throw new ArgumentOutOfRangeException(argumentName, argument, OUT_OF_RANGE_MESSAGE, argument, range);
    }
    //endregion
}

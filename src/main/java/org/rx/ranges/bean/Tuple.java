package org.rx.ranges.bean;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import org.apache.commons.collections4.keyvalue.DefaultMapEntry;

import java.io.Serializable;
import java.util.Map;

/**
 * Immutable ordered pair.
 */
@EqualsAndHashCode
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class Tuple<T1, T2> implements Serializable {
    private static final long serialVersionUID = -3418279436570281960L;

    public static <T1, T2> Tuple<T1, T2> of(T1 left, T2 right) {
        return new Tuple<>(left, right);
    }

    public static <T1, T2> Tuple<T1, T2> of(@NonNull Map.Entry<T1, T2> entry) {
        return new Tuple<>(entry.getKey(), entry.getValue());
    }

    public final T1 left;
    public final T2 right;

    public DefaultMapEntry<T1, T2> toMapEntry() {
        return new DefaultMapEntry<>(left, right);
    }
}

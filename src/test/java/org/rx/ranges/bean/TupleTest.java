package org.rx.ranges.bean;

import org.junit.jupiter.api.Test;

import java.util.AbstractMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TupleTest {
    @Test
    public void equality() {
        assertEquals(Tuple.of(1, "a"), Tuple.of(1, "a"));
        assertEquals(Tuple.of(1, "a").hashCode(), Tuple.of(1, "a").hashCode());
        assertNotEquals(Tuple.of(1, "a"), Tuple.of(1, "b"));
        assertEquals(Tuple.of(null, null), Tuple.of(null, null));
    }

    @Test
    public void mapEntry() {
        Tuple<String, Integer> t = Tuple.of("k", 1);
        Map.Entry<String, Integer> entry = t.toMapEntry();
        assertEquals("k", entry.getKey());
        assertEquals(1, entry.getValue());
        assertEquals(new AbstractMap.SimpleEntry<>("k", 1), entry);

        assertEquals(t, Tuple.of(entry));
    }
}

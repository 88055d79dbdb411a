package org.rx.ranges.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

public class InvalidExceptionTest {
    @Test
    public void formatMessage() {
        InvalidException e = new InvalidException("Config key {} invalid", "a.b");
        assertEquals("Config key a.b invalid", e.getMessage());
        assertEquals(ExceptionLevel.SYSTEM, e.getLevel());
        assertNull(e.getCause());
    }

    @Test
    public void wrap() {
        assertNull(InvalidException.wrap(null));

        InvalidException e = new InvalidException("x");
        assertSame(e, InvalidException.wrap(e));

        IOException io = new IOException("disk");
        InvalidException wrapped = InvalidException.wrap(io);
        assertSame(io, wrapped.getCause());
        assertEquals(ExceptionLevel.SYSTEM, wrapped.getLevel());
    }

    @Test
    public void argumentName() {
        InvalidArgumentException e = new InvalidArgumentException(null, "no name");
        assertEquals("no name", e.getMessage());
        assertEquals(ExceptionLevel.USER_OPERATION, e.getLevel());

        ArgumentOutOfRangeException o = new ArgumentOutOfRangeException("n", 3, "value {} too big", 3);
        assertEquals("value 3 too big (Parameter 'n')", o.getMessage());
        assertInstanceOf(InvalidArgumentException.class, o);
    }
}

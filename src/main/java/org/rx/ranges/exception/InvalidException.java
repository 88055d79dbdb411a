package org.rx.ranges.exception;

import lombok.Getter;
import org.slf4j.helpers.MessageFormatter;
import org.springframework.core.NestedRuntimeException;

/**
 * Root of the library's unchecked exceptions, messages use slf4j {@code {}} patterns.
 */
public class InvalidException extends NestedRuntimeException {
    private static final long serialVersionUID = 3210867312470151395L;

    public static InvalidException wrap(Throwable cause) {
        if (cause == null) {
            return null;
        }
        if (cause instanceof InvalidException) {
            return (InvalidException) cause;
        }
        return new InvalidException(cause);
    }

    @Getter
    final ExceptionLevel level;

    protected InvalidException(Throwable e) {
        this(ExceptionLevel.SYSTEM, null, e);
    }

    public InvalidException(String messagePattern, Object... args) {
        this(ExceptionLevel.SYSTEM, messagePattern, args);
    }

    public InvalidException(ExceptionLevel level, String messagePattern, Object... args) {
        super(messagePattern != null ? MessageFormatter.arrayFormat(messagePattern, args).getMessage() : null,
                MessageFormatter.getThrowableCandidate(args));
        this.level = level;
    }
}

package org.rx.ranges.exception;

import lombok.Getter;

@Getter
public class ArgumentOutOfRangeException extends InvalidArgumentException {
    private static final long serialVersionUID = 4401385907012739834L;

    private final transient Object actualValue;

    public ArgumentOutOfRangeException(String argumentName, Object actualValue, String messagePattern, Object... args) {
        super(argumentName, messagePattern, args);
        this.actualValue = actualValue;
    }
}

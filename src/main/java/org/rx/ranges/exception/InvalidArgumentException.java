package org.rx.ranges.exception;

import lombok.Getter;

/**
 * Raised when a named argument violates a precondition.
 */
@Getter
public class InvalidArgumentException extends InvalidException {
    private static final long serialVersionUID = -7153912208846232601L;

    private final String argumentName;

    public InvalidArgumentException(String argumentName, String messagePattern, Object... args) {
        super(ExceptionLevel.USER_OPERATION, messagePattern, args);
        this.argumentName = argumentName;
    }

    @Override
    public String getMessage() {
        String message = super.getMessage();
        if (argumentName == null) {
            return message;
        }
        return String.format("%s (Parameter '%s')", message, argumentName);
    }
}

package org.rx.ranges.exception;

public enum ExceptionLevel {
    SYSTEM,
    USER_OPERATION
}

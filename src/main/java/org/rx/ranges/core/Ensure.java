package org.rx.ranges.core;

/**
 * Selects when a precondition check of {@link EnsureExtensions} is evaluated.
 */
public enum Ensure {
    /**
     * Checks run in every build and every environment.
     */
    ALWAYS,
    /**
     * Checks run only when {@link RangesConfig#isDebugChecksEnabled()}.
     */
    ON_DEBUG;

    public boolean isEnabled() {
        return this == ALWAYS || RangesConfig.INSTANCE.isDebugChecksEnabled();
    }
}

package org.rx.ranges.core;

public interface Constants {
    String RANGES_CONFIG_FILE = "ranges.yml";
    String CONFIG_KEY_SPLITS = ".";

    String DEFAULT_MAXIMUM_ARGUMENT_NAME = "maximum";
    String DEFAULT_ARGUMENT_NAME = "argument";

    String NON_UNCHECKED = "unchecked";
}

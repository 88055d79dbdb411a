package org.rx.ranges.core;

import lombok.Getter;
import lombok.NonNull;
import lombok.Setter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.BooleanUtils;

@Slf4j
@Getter
@Setter
@ToString
public final class RangesConfig {
    public interface ConfigNames {
        String ENSURE_DEBUG_CHECKS = "app.ensure.debugChecks";
    }

    static final boolean ASSERTIONS_ENABLED = RangesConfig.class.desiredAssertionStatus();
    public static final RangesConfig INSTANCE = load(YamlConfiguration.RANGES_CONF);

    public static RangesConfig load(@NonNull YamlConfiguration conf) {
        RangesConfig config = new RangesConfig();
        config.debugChecks = conf.readAs(ConfigNames.ENSURE_DEBUG_CHECKS, Boolean.class);
        String prop = System.getProperty(ConfigNames.ENSURE_DEBUG_CHECKS);
        if (prop != null) {
            config.debugChecks = BooleanUtils.toBooleanObject(prop);
        }
        log.debug("Load {}", config);
        return config;
    }

    /**
     * null falls back to the jvm assertion status
     */
    Boolean debugChecks;

    public boolean isDebugChecksEnabled() {
        return debugChecks != null ? debugChecks : ASSERTIONS_ENABLED;
    }
}

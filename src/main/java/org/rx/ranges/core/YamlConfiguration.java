package org.rx.ranges.core;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;
import org.rx.ranges.exception.InvalidException;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * Merged view of one or more yaml resources on the classpath.
 * Resources loaded later override the keys of earlier ones; for the same file name the
 * classpath order is reversed, so the application's copy overrides the one shipped in this jar.
 */
@SuppressWarnings(Constants.NON_UNCHECKED)
@Slf4j
public class YamlConfiguration {
    public static final YamlConfiguration RANGES_CONF = new YamlConfiguration(Constants.RANGES_CONFIG_FILE);

    public static Map<String, Object> loadYaml(String... fileNames) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = YamlConfiguration.class.getClassLoader();
        }
        Map<String, Object> result = new LinkedHashMap<>();
        Yaml yaml = new Yaml();
        try {
            for (String fileName : fileNames) {
                List<URL> urls = Collections.list(loader.getResources(fileName));
                Collections.reverse(urls);
                for (URL url : urls) {
                    log.debug("Load yaml {}", url);
                    try (InputStream stream = url.openStream()) {
                        fill(yaml, stream, url, result);
                    }
                }
            }
        } catch (IOException e) {
            throw InvalidException.wrap(e);
        }
        return result;
    }

    public static Map<String, Object> loadYaml(List<InputStream> streams) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (CollectionUtils.isEmpty(streams)) {
            return result;
        }
        Yaml yaml = new Yaml();
        for (int i = 0; i < streams.size(); i++) {
            fill(yaml, streams.get(i), "stream#" + i, result);
        }
        return result;
    }

    private static void fill(Yaml yaml, InputStream stream, Object source, Map<String, Object> result) {
        for (Object data : yaml.loadAll(stream)) {
            if (data == null) {
                continue;
            }
            if (!(data instanceof Map)) {
                throw new InvalidException("Yaml {} must be a mapping but was {}", source, data.getClass().getName());
            }
            fill((Map<String, Object>) data, result);
        }
    }

    private static void fill(Map<String, Object> child, Map<String, Object> parent) {
        for (Map.Entry<String, Object> entry : child.entrySet()) {
            if (!(entry.getValue() instanceof Map)) {
                parent.put(entry.getKey(), entry.getValue());
                continue;
            }
            Map<String, Object> next = (Map<String, Object>) entry.getValue();
            Object nextAll = parent.get(entry.getKey());
            if (!(nextAll instanceof Map)) {
                nextAll = new LinkedHashMap<>();
                parent.put(entry.getKey(), nextAll);
            }
            fill(next, (Map<String, Object>) nextAll);
        }
    }

    @Getter
    final Map<String, Object> yaml;

    public YamlConfiguration(@NonNull String... fileNames) {
        yaml = Collections.unmodifiableMap(loadYaml(fileNames));
    }

    public YamlConfiguration(@NonNull Map<String, Object> yaml) {
        Map<String, Object> copy = new LinkedHashMap<>();
        fill(yaml, copy);
        this.yaml = Collections.unmodifiableMap(copy);
    }

    public <T> T readAs(@NonNull String key, @NonNull Class<T> type) {
        Object val = yaml.get(key);
        if (val == null) {
            Map<String, Object> tmp = yaml;
            String[] paths = StringUtils.split(key, Constants.CONFIG_KEY_SPLITS);
            for (int i = 0; i < paths.length; i++) {
                Object next = tmp.get(paths[i]);
                if (i == paths.length - 1) {
                    val = next;
                    break;
                }
                if (!(next instanceof Map)) {
                    return null;
                }
                tmp = (Map<String, Object>) next;
            }
        }
        if (val == null) {
            return null;
        }
        if (!type.isInstance(val)) {
            throw new InvalidException("Config key {} expect type {} but was {}", key, type.getName(), val.getClass().getName());
        }
        return type.cast(val);
    }
}

package io.carelink.a2a.server.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URL;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Config provider backed by the {@value #DEFAULTS_RESOURCE} files found on the classpath.
 * <p>
 * Every module may ship such a file; all of them are merged. A default can be overridden by a
 * JVM system property of the same name, and both by an environment variable whose name is the
 * key upper-cased with dots and dashes replaced by underscores
 * ({@code a2a.tasks.ttl-seconds} becomes {@code A2A_TASKS_TTL_SECONDS}). Values passed to
 * {@link #DefaultValuesConfigProvider(Map)} take precedence over all of these.
 */
public class DefaultValuesConfigProvider implements A2AConfigProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultValuesConfigProvider.class);

    public static final String DEFAULTS_RESOURCE = "META-INF/a2a-defaults.properties";

    private final Map<String, String> defaults;
    private final Map<String, String> overrides;

    public DefaultValuesConfigProvider() {
        this(Map.of());
    }

    public DefaultValuesConfigProvider(Map<String, String> overrides) {
        this.defaults = loadDefaults();
        this.overrides = Map.copyOf(overrides);
    }

    @Override
    public String getValue(String name) {
        return getOptionalValue(name)
                .orElseThrow(() -> new IllegalArgumentException("No configuration value found for '" + name + "'"));
    }

    @Override
    public Optional<String> getOptionalValue(String name) {
        String value = overrides.get(name);
        if (value == null) {
            value = System.getenv(toEnvName(name));
        }
        if (value == null) {
            value = System.getProperty(name);
        }
        if (value == null) {
            value = defaults.get(name);
        }
        return Optional.ofNullable(value);
    }

    static String toEnvName(String name) {
        return name.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    private static Map<String, String> loadDefaults() {
        Map<String, String> values = new HashMap<>();
        ClassLoader classLoader = classLoader();
        try {
            Enumeration<URL> resources = classLoader.getResources(DEFAULTS_RESOURCE);
            while (resources.hasMoreElements()) {
                URL url = resources.nextElement();
                Properties properties = new Properties();
                try (InputStream in = url.openStream()) {
                    properties.load(in);
                }
                for (String key : properties.stringPropertyNames()) {
                    String previous = values.put(key, properties.getProperty(key));
                    if (previous != null && !previous.equals(properties.getProperty(key))) {
                        LOGGER.warn("Default for {} defined more than once, using the value from {}", key, url);
                    }
                }
                LOGGER.debug("Loaded {} defaults from {}", properties.size(), url);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULTS_RESOURCE, e);
        }
        return values;
    }

    private static ClassLoader classLoader() {
        @Nullable ClassLoader tccl = Thread.currentThread().getContextClassLoader();
        return tccl != null ? tccl : DefaultValuesConfigProvider.class.getClassLoader();
    }
}

package io.carelink.a2a.server.config;

import java.time.Duration;
import java.util.Optional;

/**
 * Source of the runtime settings of an agent, such as executor pool sizes or the task
 * eviction policy. Keys are dotted lower case names like {@code a2a.tasks.ttl-seconds}.
 */
public interface A2AConfigProvider {

    /**
     * Returns the value of a setting.
     *
     * @param name the key
     * @return the value
     * @throws IllegalArgumentException if the setting has no value
     */
    String getValue(String name);

    Optional<String> getOptionalValue(String name);

    default int getIntValue(String name) {
        String value = getValue(name);
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Setting '" + name + "' is not an integer: " + value, e);
        }
    }

    default long getLongValue(String name) {
        String value = getValue(name);
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Setting '" + name + "' is not a number: " + value, e);
        }
    }

    /**
     * Reads a setting holding a whole number of seconds.
     *
     * @param name the key
     * @return the duration
     */
    default Duration getSecondsValue(String name) {
        return Duration.ofSeconds(getLongValue(name));
    }
}

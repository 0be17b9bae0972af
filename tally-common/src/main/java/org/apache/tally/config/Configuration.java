/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.tally.config;

import org.apache.tally.annotation.PublicEvolving;
import org.apache.tally.exception.InvalidConfigException;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static org.apache.tally.utils.Preconditions.checkNotNull;

/**
 * Lightweight configuration object which stores key/value pairs. Values may be set as strings
 * (e.g. parsed from a properties file) or as typed values, and are converted to the type of the
 * {@link ConfigOption} on read.
 *
 * @since 0.1
 */
@PublicEvolving
public class Configuration {

    /** Stores the concrete key/value pairs of this configuration object. */
    protected final HashMap<String, Object> confData;

    /** Creates a new empty configuration. */
    public Configuration() {
        this.confData = new HashMap<>();
    }

    /**
     * Creates a new configuration with the copy of the given configuration.
     *
     * @param other The configuration to copy the entries from.
     */
    public Configuration(Configuration other) {
        synchronized (other.confData) {
            this.confData = new HashMap<>(other.confData);
        }
    }

    /** Creates a new configuration that is initialized with the options of the given map. */
    public static Configuration fromMap(Map<String, String> map) {
        final Configuration configuration = new Configuration();
        map.forEach(configuration::setString);
        return configuration;
    }

    /**
     * Returns the value associated with the given config option as a type declared by the option,
     * or its default value if none is set.
     *
     * @throws InvalidConfigException if the stored value cannot be converted
     */
    public <T> T get(ConfigOption<T> option) {
        return getOptional(option).orElseGet(option::defaultValue);
    }

    /** Returns the value set for the option, without falling back to its default value. */
    public <T> Optional<T> getOptional(ConfigOption<T> option) {
        Object raw;
        synchronized (confData) {
            raw = confData.get(option.key());
        }
        if (raw == null) {
            return Optional.empty();
        }
        return Optional.of(convertValue(option, raw));
    }

    /** Checks whether there is an entry for the given config option. */
    public boolean contains(ConfigOption<?> option) {
        synchronized (confData) {
            return confData.containsKey(option.key());
        }
    }

    /** Sets a typed value for the given option. */
    public <T> Configuration set(ConfigOption<T> option, T value) {
        checkNotNull(value, "Config value must not be null.");
        synchronized (confData) {
            confData.put(option.key(), value);
        }
        return this;
    }

    /** Adds the given key/value pair to the configuration object. */
    public void setString(String key, String value) {
        checkNotNull(key, "Config key must not be null.");
        checkNotNull(value, "Config value must not be null.");
        synchronized (confData) {
            confData.put(key, value);
        }
    }

    /** Returns a copy of all entries, with values rendered as strings. */
    public Map<String, String> toMap() {
        synchronized (confData) {
            Map<String, String> result = new HashMap<>(confData.size());
            confData.forEach((key, value) -> result.put(key, String.valueOf(value)));
            return result;
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Configuration)) {
            return false;
        }
        return toMap().equals(((Configuration) obj).toMap());
    }

    @Override
    public int hashCode() {
        return toMap().hashCode();
    }

    @Override
    public String toString() {
        return toMap().toString();
    }

    // --------------------------------------------------------------------------------------------

    @SuppressWarnings("unchecked")
    private static <T> T convertValue(ConfigOption<T> option, Object raw) {
        Class<?> clazz = option.getClazz();
        if (clazz.isInstance(raw)) {
            return (T) raw;
        }
        String value = raw.toString().trim();
        try {
            if (clazz == Boolean.class) {
                return (T) convertToBoolean(value);
            } else if (clazz == Integer.class) {
                return (T) Integer.valueOf(value);
            } else if (clazz == Long.class) {
                return (T) Long.valueOf(value);
            } else if (clazz == Double.class) {
                return (T) Double.valueOf(value);
            } else if (clazz == String.class) {
                return (T) value;
            }
        } catch (NumberFormatException e) {
            throw new InvalidConfigException(
                    String.format(
                            "Could not parse value '%s' for key '%s' as %s.",
                            value, option.key(), clazz.getSimpleName()),
                    e);
        }
        throw new InvalidConfigException(
                String.format("Unsupported type %s for key '%s'.", clazz, option.key()));
    }

    private static Boolean convertToBoolean(String value) {
        switch (value.toLowerCase(Locale.ROOT)) {
            case "true":
                return true;
            case "false":
                return false;
            default:
                throw new InvalidConfigException(
                        String.format(
                                "Unrecognized option for boolean: %s. "
                                        + "Expected either true or false(case insensitive)",
                                value));
        }
    }
}

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

import static org.apache.tally.utils.Preconditions.checkNotNull;

/**
 * {@code ConfigBuilder} are used to build a {@link ConfigOption}. The option is typically built in
 * one of the following pattern:
 *
 * <pre>{@code
 * // simple integer-valued option with a default value
 * ConfigOption<Integer> ddof = key("aggregate.std.ddof").intType().defaultValue(1);
 *
 * // option of double type with no default value
 * ConfigOption<Double> q = key("aggregate.quantile.q").doubleType().noDefaultValue();
 * }</pre>
 *
 * @since 0.1
 */
@PublicEvolving
public class ConfigBuilder {

    /**
     * Starts building a new {@link ConfigOption}.
     *
     * @param key The key for the config option.
     * @return The builder for the config option with the given key.
     */
    public static ConfigBuilder key(String key) {
        checkNotNull(key);
        return new ConfigBuilder(key);
    }

    // ------------------------------------------------------------------------

    /** The key for the config option. */
    private final String key;

    private ConfigBuilder(String key) {
        this.key = key;
    }

    /** Defines that the value of the option should be of {@link Boolean} type. */
    public TypedConfigOptionBuilder<Boolean> booleanType() {
        return new TypedConfigOptionBuilder<>(key, Boolean.class);
    }

    /** Defines that the value of the option should be of {@link Integer} type. */
    public TypedConfigOptionBuilder<Integer> intType() {
        return new TypedConfigOptionBuilder<>(key, Integer.class);
    }

    /** Defines that the value of the option should be of {@link Long} type. */
    public TypedConfigOptionBuilder<Long> longType() {
        return new TypedConfigOptionBuilder<>(key, Long.class);
    }

    /** Defines that the value of the option should be of {@link Double} type. */
    public TypedConfigOptionBuilder<Double> doubleType() {
        return new TypedConfigOptionBuilder<>(key, Double.class);
    }

    /** Defines that the value of the option should be of {@link String} type. */
    public TypedConfigOptionBuilder<String> stringType() {
        return new TypedConfigOptionBuilder<>(key, String.class);
    }

    /**
     * Builder for {@link ConfigOption} with a defined atomic type.
     *
     * @param <T> atomic type of the option
     */
    public static class TypedConfigOptionBuilder<T> {
        private final String key;
        private final Class<T> clazz;

        TypedConfigOptionBuilder(String key, Class<T> clazz) {
            this.key = key;
            this.clazz = clazz;
        }

        /**
         * Creates a ConfigOption with the given default value.
         *
         * @param value The default value for the config option
         * @return The config option with the default value.
         */
        public ConfigOption<T> defaultValue(T value) {
            return new ConfigOption<>(key, clazz, "", value);
        }

        /**
         * Creates a ConfigOption without a default value.
         *
         * @return The config option without a default value.
         */
        public ConfigOption<T> noDefaultValue() {
            return new ConfigOption<>(key, clazz, "", null);
        }
    }
}

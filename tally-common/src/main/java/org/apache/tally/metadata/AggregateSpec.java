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

package org.apache.tally.metadata;

import org.apache.tally.annotation.PublicEvolving;

import javax.annotation.Nullable;

import java.io.Serializable;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An aggregation kind with optional parameters.
 *
 * <p>Use {@link AggregateSpecs} utility class to create instances:
 *
 * <pre>{@code
 * AggregateSpec sum = AggregateSpecs.SUM();
 * AggregateSpec median = AggregateSpecs.QUANTILE(0.5);
 * AggregateSpec populationStd = AggregateSpecs.STD(0);
 * }</pre>
 *
 * @since 0.1
 */
@PublicEvolving
public final class AggregateSpec implements Serializable {

    private static final long serialVersionUID = 1L;

    private final AggregateKind kind;
    private final Map<String, String> parameters;

    AggregateSpec(AggregateKind kind, @Nullable Map<String, String> parameters) {
        this.kind = Objects.requireNonNull(kind, "Aggregation kind must not be null");
        this.parameters =
                parameters == null || parameters.isEmpty()
                        ? Collections.emptyMap()
                        : Collections.unmodifiableMap(new HashMap<>(parameters));
    }

    public AggregateKind getKind() {
        return kind;
    }

    /**
     * Returns the parameters.
     *
     * @return an immutable map of parameters
     */
    public Map<String, String> getParameters() {
        return parameters;
    }

    /**
     * Gets a specific parameter value.
     *
     * @param key the parameter key
     * @return the parameter value, or null if not found
     */
    @Nullable
    public String getParameter(String key) {
        return parameters.get(key);
    }

    public Optional<Boolean> getBooleanParameter(String key) {
        return Optional.ofNullable(parameters.get(key)).map(v -> Boolean.parseBoolean(v.trim()));
    }

    public Optional<Integer> getIntParameter(String key) {
        return Optional.ofNullable(parameters.get(key)).map(v -> Integer.parseInt(v.trim()));
    }

    public Optional<Double> getDoubleParameter(String key) {
        return Optional.ofNullable(parameters.get(key)).map(v -> Double.parseDouble(v.trim()));
    }

    /** Returns a copy of this spec with the given parameter added or replaced. */
    public AggregateSpec withParameter(String key, String value) {
        Map<String, String> copy = new HashMap<>(parameters);
        copy.put(key, value);
        return new AggregateSpec(kind, copy);
    }

    /**
     * Validates all parameters of this spec.
     *
     * @throws org.apache.tally.exception.InvalidConfigException if any parameter is invalid
     */
    public void validate() {
        for (Map.Entry<String, String> entry : parameters.entrySet()) {
            kind.validateParameter(entry.getKey(), entry.getValue());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AggregateSpec that = (AggregateSpec) o;
        return kind == that.kind && parameters.equals(that.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, parameters);
    }

    @Override
    public String toString() {
        if (parameters.isEmpty()) {
            return kind.toString();
        }
        return kind.toString() + parameters;
    }
}

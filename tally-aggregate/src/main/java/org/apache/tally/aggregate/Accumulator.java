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

package org.apache.tally.aggregate;

import org.apache.tally.annotation.PublicEvolving;

import java.util.Objects;

import static org.apache.tally.utils.Preconditions.checkNotNull;
import static org.apache.tally.utils.Preconditions.checkState;

/**
 * The intermediate state of an aggregation over a group. An accumulator is in exactly one of three
 * states:
 *
 * <ul>
 *   <li>{@link State#EMPTY}: nothing has contributed yet. This is the identity element of {@link
 *       AggregateFunction#combine}.
 *   <li>{@link State#POISONED}: a null value was observed by an aggregation that does not ignore
 *       nulls, so the result is null. This state absorbs every other accumulator.
 *   <li>{@link State#VALUE}: a partial result of type {@code A}.
 * </ul>
 *
 * <p>Accumulators are immutable. The value held by a {@code VALUE} accumulator is owned by it and
 * must not be modified once the accumulator is handed to {@code combine} or {@code
 * finalizeResult}.
 *
 * @param <A> type of the partial result
 * @since 0.1
 */
@PublicEvolving
public final class Accumulator<A> {

    /** The state of an {@link Accumulator}. */
    public enum State {
        EMPTY,
        POISONED,
        VALUE
    }

    private static final Accumulator<?> EMPTY = new Accumulator<>(State.EMPTY, null);
    private static final Accumulator<?> POISONED = new Accumulator<>(State.POISONED, null);

    private final State state;
    private final A value;

    private Accumulator(State state, A value) {
        this.state = state;
        this.value = value;
    }

    @SuppressWarnings("unchecked")
    public static <A> Accumulator<A> empty() {
        return (Accumulator<A>) EMPTY;
    }

    @SuppressWarnings("unchecked")
    public static <A> Accumulator<A> poisoned() {
        return (Accumulator<A>) POISONED;
    }

    public static <A> Accumulator<A> of(A value) {
        return new Accumulator<>(State.VALUE, checkNotNull(value, "Value must not be null."));
    }

    public State getState() {
        return state;
    }

    public boolean isEmpty() {
        return state == State.EMPTY;
    }

    public boolean isPoisoned() {
        return state == State.POISONED;
    }

    public boolean hasValue() {
        return state == State.VALUE;
    }

    /**
     * Returns the partial result.
     *
     * @throws IllegalStateException if the accumulator holds no value
     */
    public A getValue() {
        checkState(hasValue(), "Accumulator in state %s holds no value.", state);
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Accumulator<?> that = (Accumulator<?>) o;
        return state == that.state && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, value);
    }

    @Override
    public String toString() {
        return hasValue() ? "Accumulator{" + value + '}' : "Accumulator{" + state + '}';
    }
}

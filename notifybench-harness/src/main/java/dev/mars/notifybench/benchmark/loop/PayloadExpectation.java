package dev.mars.notifybench.benchmark.loop;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import java.util.function.IntToLongFunction;

/**
 * Rule for the payload of the i-th notification a listener receives.
 */
public final class PayloadExpectation {

    private final IntToLongFunction expected;
    private final String label;

    private PayloadExpectation(IntToLongFunction expected, String label) {
        this.expected = expected;
        this.label = label;
    }

    /**
     * The i-th notification carries {@code i}.
     */
    public static PayloadExpectation sequence() {
        return new PayloadExpectation(index -> index, "sequence");
    }

    /**
     * Payloads cycle through {@code 1..seriesLength}, as produced by repeated
     * {@code generate_series(1, seriesLength)} inserts.
     */
    public static PayloadExpectation repeatingSeries(int seriesLength) {
        if (seriesLength < 1) {
            throw new IllegalArgumentException("Series length must be at least 1: " + seriesLength);
        }
        return new PayloadExpectation(index -> (index % seriesLength) + 1, "series 1.." + seriesLength);
    }

    /**
     * Any integer payload is accepted.
     */
    public static PayloadExpectation anyInteger() {
        return new PayloadExpectation(null, "any integer");
    }

    public boolean matches(int index, long payload) {
        return expected == null || expected.applyAsLong(index) == payload;
    }

    public String describe(int index) {
        return expected == null ? label : Long.toString(expected.applyAsLong(index));
    }

    @Override
    public String toString() {
        return label;
    }
}

/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.proxgraph.exceptions;

/**
 * Thrown when a vector's length differs from the dimension the index was created with.
 * Never worth retrying.
 */
public class DimensionMismatchException extends ProxGraphException {
    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("Dimension mismatch: expected " + expected + ", got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }

    /**
     * @throws DimensionMismatchException if {@code actual != expected}
     */
    public static void check(int expected, int actual) {
        if (expected != actual) {
            throw new DimensionMismatchException(expected, actual);
        }
    }
}

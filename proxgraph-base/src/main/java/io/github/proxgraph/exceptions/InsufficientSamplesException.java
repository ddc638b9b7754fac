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
 * Thrown by quantizer training when the sample is too small for clustering to be stable.
 * The caller must supply more data; training never silently degrades.
 */
public class InsufficientSamplesException extends ProxGraphException {
    private final int required;
    private final int actual;

    public InsufficientSamplesException(int required, int actual) {
        super(String.format("Quantizer training needs at least %d samples, got %d", required, actual));
        this.required = required;
        this.actual = actual;
    }

    public int getRequired() {
        return required;
    }

    public int getActual() {
        return actual;
    }
}

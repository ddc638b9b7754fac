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
 * Thrown when the index structure is found to be broken (missing entry point, dangling
 * neighbor reference).  Fatal: the index switches to read-only mode and must be rebuilt.
 */
public class InternalInconsistencyException extends ProxGraphException {
    public InternalInconsistencyException(String message) {
        super(message);
    }

    public InternalInconsistencyException(String message, Throwable cause) {
        super(message, cause);
    }
}

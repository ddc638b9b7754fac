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
 * Thrown when inserting an id that is already live without requesting overwrite.
 */
public class DuplicateIdException extends ProxGraphException {
    private final long id;

    public DuplicateIdException(long id) {
        super("Vector " + id + " already exists; delete it first or insert with overwrite");
        this.id = id;
    }

    public long getId() {
        return id;
    }
}

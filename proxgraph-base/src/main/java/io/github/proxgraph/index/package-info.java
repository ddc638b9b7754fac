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

/**
 * The public face of the library.  {@link io.github.proxgraph.index.VectorIndex} ties the graph, the vector
 * store and the active codebook together and serializes writers; {@link io.github.proxgraph.index.QueryEngine}
 * answers queries against it without taking the writer lock.
 * <p>
 * Vectors are addressed by caller-chosen long ids.  {@link io.github.proxgraph.index.OrdinalMap} maps them to
 * the graph's int ordinals, which are never reused.
 */
package io.github.proxgraph.index;

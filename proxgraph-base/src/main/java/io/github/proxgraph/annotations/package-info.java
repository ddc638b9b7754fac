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
 * Annotation types documenting API stability and visibility.
 * <ul>
 *   <li>{@link io.github.proxgraph.annotations.Experimental} - APIs that may change or be removed
 *       without prior notice.</li>
 *   <li>{@link io.github.proxgraph.annotations.VisibleForTesting} - elements made visible solely so
 *       that tests can reach them.</li>
 * </ul>
 */
package io.github.proxgraph.annotations;

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
 * Vector compression.
 * <p>
 * Two schemes are available, both producing one byte per sub-code:
 * <ul>
 *   <li>{@link io.github.proxgraph.quantization.ScalarQuantization}: each dimension mapped onto 256 levels
 *       between its trained min and max.</li>
 *   <li>{@link io.github.proxgraph.quantization.ProductQuantization}: M subspaces, each snapped to one of
 *       {@code 2^b} k-means centroids, optionally after a {@link io.github.proxgraph.quantization.PcaRotation}.</li>
 * </ul>
 * Queries stay at full precision.  {@link io.github.proxgraph.quantization.CompressedVectors#precomputedScoreFunctionFor}
 * builds a lookup table once per query and then scores each stored code with one table read per sub-code.
 * <p>
 * Training is a pure function of its sample, so a new codebook can be trained while the current
 * {@link io.github.proxgraph.quantization.CodebookGeneration} keeps serving searches.
 */
package io.github.proxgraph.quantization;

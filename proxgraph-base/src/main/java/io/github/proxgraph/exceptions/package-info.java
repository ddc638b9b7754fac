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
 * Exception types thrown by ProxGraph.
 * <p>
 * All of them extend {@link io.github.proxgraph.exceptions.ProxGraphException}, which is unchecked.
 * <ul>
 *   <li>{@link io.github.proxgraph.exceptions.DimensionMismatchException} - input vector has the wrong
 *       length; rejected, no retry.</li>
 *   <li>{@link io.github.proxgraph.exceptions.VectorNotFoundException} - lookup miss.</li>
 *   <li>{@link io.github.proxgraph.exceptions.DuplicateIdException} - insert collision without the
 *       overwrite flag.</li>
 *   <li>{@link io.github.proxgraph.exceptions.InsufficientSamplesException} - quantizer training sample
 *       too small.</li>
 *   <li>{@link io.github.proxgraph.exceptions.InternalInconsistencyException} - broken entry point or
 *       dangling neighbor reference.  The index becomes read-only and
 *       {@link io.github.proxgraph.exceptions.IndexReadOnlyException} is thrown by later writes.</li>
 * </ul>
 * Blob store I/O failures are reported as {@link java.io.IOException} by the store and as
 * {@link java.io.UncheckedIOException} once the vector store has exhausted its retries.
 */
package io.github.proxgraph.exceptions;

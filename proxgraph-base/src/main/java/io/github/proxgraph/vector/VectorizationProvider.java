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

package io.github.proxgraph.vector;

import io.github.proxgraph.vector.types.VectorTypeSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point to the vector kernels and vector types in use by this process.
 * <p>
 * Only the portable on-heap provider ships; a faster implementation can be selected by naming
 * a subclass in the {@code proxgraph.vectorization_provider} system property.
 */
public abstract class VectorizationProvider {
    private static final Logger LOG = LoggerFactory.getLogger(VectorizationProvider.class);

    /**
     * Returns the default instance of the provider matching vectorization possibilities of actual
     * runtime.
     */
    public static VectorizationProvider getInstance() {
        return Objects.INSTANCE;
    }

    protected VectorizationProvider() {
    }

    /**
     * Returns a singleton (stateless) {@link VectorUtilSupport} to support SIMD usage in {@link
     * VectorUtil}.
     */
    public abstract VectorUtilSupport getVectorUtilSupport();

    public abstract VectorTypeSupport getVectorTypeSupport();

    static VectorizationProvider lookup() {
        String className = System.getProperty("proxgraph.vectorization_provider");
        if (className == null || className.isEmpty()) {
            return new DefaultVectorizationProvider();
        }
        try {
            Class<?> clazz = Class.forName(className);
            VectorizationProvider provider = (VectorizationProvider) clazz.getDeclaredConstructor().newInstance();
            LOG.info("Using vectorization provider {}", className);
            return provider;
        } catch (ReflectiveOperationException | ClassCastException e) {
            LOG.warn("Unable to load vectorization provider {}, falling back to the default", className, e);
            return new DefaultVectorizationProvider();
        }
    }

    /** This static holder class prevents classloading deadlock. */
    private static final class Objects {
        static final VectorizationProvider INSTANCE = lookup();
    }

    /**
     * Scalar implementation over on-heap arrays.
     */
    public static final class DefaultVectorizationProvider extends VectorizationProvider {
        private final VectorUtilSupport vectorUtilSupport = new DefaultVectorUtilSupport();
        private final VectorTypeSupport vectorTypeSupport = new ArrayVectorProvider();

        @Override
        public VectorUtilSupport getVectorUtilSupport() {
            return vectorUtilSupport;
        }

        @Override
        public VectorTypeSupport getVectorTypeSupport() {
            return vectorTypeSupport;
        }
    }
}

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

import io.github.proxgraph.vector.types.VectorFloat;

import java.util.Locale;

/**
 * Vector similarity function; used in search to return top K most similar vectors to a target
 * vector.
 * <p>
 * {@link #compare} always returns a score where higher means more similar, so that graph construction
 * and search can order candidates the same way for every metric.  {@link #toReportedScore} converts
 * that score back into the number callers see in search results.
 */
public enum VectorSimilarityFunction {
  /** Euclidean distance.  Reported as the (non-squared) L2 distance; lower is closer. */
  EUCLIDEAN {
    @Override
    public float compare(VectorFloat<?> v1, VectorFloat<?> v2) {
      return -VectorUtil.squareL2Distance(v1, v2);
    }

    @Override
    public float toReportedScore(float score) {
      return (float) Math.sqrt(Math.max(0f, -score));
    }

    @Override
    public boolean isReportedAscending() {
      return true;
    }
  },

  /**
   * Dot product.  Reported as the raw inner product; higher is closer.
   */
  DOT_PRODUCT {
    @Override
    public float compare(VectorFloat<?> v1, VectorFloat<?> v2) {
      return VectorUtil.dotProduct(v1, v2);
    }

    @Override
    public float toReportedScore(float score) {
      return score;
    }

    @Override
    public boolean isReportedAscending() {
      return false;
    }
  },

  /**
   * Cosine similarity.  Reported as the cosine distance {@code 1 - cos}; lower is closer.
   * A zero vector has cosine 0 with everything.
   */
  COSINE {
    @Override
    public float compare(VectorFloat<?> v1, VectorFloat<?> v2) {
      return VectorUtil.cosine(v1, v2);
    }

    @Override
    public float toReportedScore(float score) {
      return 1f - score;
    }

    @Override
    public boolean isReportedAscending() {
      return true;
    }
  };

  /**
   * Calculates a similarity score between the two vectors with a specified function. Higher
   * similarity scores correspond to closer vectors.
   *
   * @param v1 a vector
   * @param v2 another vector, of the same dimension
   * @return the value of the similarity function applied to the two vectors
   */
  public abstract float compare(VectorFloat<?> v1, VectorFloat<?> v2);

  /**
   * @return the user-facing value for a score produced by {@link #compare}
   */
  public abstract float toReportedScore(float score);

  /**
   * @return true if smaller reported values are closer (distances), false if larger are closer
   */
  public abstract boolean isReportedAscending();

  /**
   * Accepts the enum name as well as the short forms {@code l2}, {@code dot} and {@code cos}.
   */
  public static VectorSimilarityFunction parse(String name) {
    switch (name.toLowerCase(Locale.ROOT)) {
      case "l2":
      case "euclidean":
        return EUCLIDEAN;
      case "dot":
      case "dot_product":
        return DOT_PRODUCT;
      case "cos":
      case "cosine":
        return COSINE;
      default:
        throw new IllegalArgumentException("Unknown similarity function: " + name);
    }
  }
}

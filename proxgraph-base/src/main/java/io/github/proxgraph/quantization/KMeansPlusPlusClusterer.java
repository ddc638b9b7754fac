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

package io.github.proxgraph.quantization;

import io.github.proxgraph.vector.VectorUtil;
import io.github.proxgraph.vector.VectorizationProvider;
import io.github.proxgraph.vector.types.VectorFloat;
import io.github.proxgraph.vector.types.VectorTypeSupport;

import java.util.Arrays;
import java.util.Random;

import static io.github.proxgraph.vector.VectorUtil.squareL2Distance;

/**
 * Lloyd's k-means over float vectors with k-means++ seeding.  All randomness comes from the
 * {@link Random} passed in, so a fixed seed gives a fixed codebook.
 * <p>
 * Centroids are stored flattened: centroid {@code i} occupies {@code [i * dimension, (i + 1) * dimension)}.
 */
public class KMeansPlusPlusClusterer {
    private static final VectorTypeSupport vectorTypeSupport = VectorizationProvider.getInstance().getVectorTypeSupport();

    private final int k;
    private final int dimension;
    private final VectorFloat<?>[] points;
    private final int[] assignments;
    private final VectorFloat<?> centroids;
    private final Random random;

    public KMeansPlusPlusClusterer(VectorFloat<?>[] points, int k, Random random) {
        if (k <= 0) {
            throw new IllegalArgumentException("Number of clusters must be positive.");
        }
        if (points.length == 0) {
            throw new IllegalArgumentException("Cannot cluster an empty set of points");
        }
        this.points = points;
        this.k = k;
        this.dimension = points[0].length();
        this.random = random;
        this.assignments = new int[points.length];
        Arrays.fill(assignments, -1);
        this.centroids = chooseInitialCentroids();
    }

    /**
     * Runs assignment/update rounds until no point changes cluster or {@code maxIterations} is reached.
     *
     * @return the flattened centroids
     */
    public VectorFloat<?> cluster(int maxIterations) {
        for (int i = 0; i < maxIterations; i++) {
            int changed = assignPoints();
            updateCentroids();
            if (changed == 0) {
                break;
            }
        }
        return centroids;
    }

    /**
     * @return index of the centroid closest to the given slice of {@code v}
     */
    public static int nearestCentroid(VectorFloat<?> v, int offset, VectorFloat<?> centroids, int k, int dimension) {
        float minDistance = Float.MAX_VALUE;
        int nearest = 0;
        for (int i = 0; i < k; i++) {
            float distance = squareL2Distance(v, offset, centroids, i * dimension, dimension);
            if (distance < minDistance) {
                minDistance = distance;
                nearest = i;
            }
        }
        return nearest;
    }

    /**
     * @return mean squared distance from each point to its assigned centroid
     */
    public double meanSquaredError() {
        double total = 0;
        for (VectorFloat<?> point : points) {
            int c = nearestCentroid(point, 0, centroids, k, dimension);
            total += squareL2Distance(point, 0, centroids, c * dimension, dimension);
        }
        return total / points.length;
    }

    private int assignPoints() {
        int changed = 0;
        for (int i = 0; i < points.length; i++) {
            int c = nearestCentroid(points[i], 0, centroids, k, dimension);
            if (c != assignments[i]) {
                assignments[i] = c;
                changed++;
            }
        }
        return changed;
    }

    private void updateCentroids() {
        float[] sums = new float[k * dimension];
        int[] counts = new int[k];
        for (int i = 0; i < points.length; i++) {
            int c = assignments[i];
            counts[c]++;
            for (int d = 0; d < dimension; d++) {
                sums[c * dimension + d] += points[i].get(d);
            }
        }
        for (int c = 0; c < k; c++) {
            if (counts[c] == 0) {
                // empty cluster: restart it on a random point
                centroids.copyFrom(points[random.nextInt(points.length)], 0, c * dimension, dimension);
                continue;
            }
            for (int d = 0; d < dimension; d++) {
                centroids.set(c * dimension + d, sums[c * dimension + d] / counts[c]);
            }
        }
    }

    /**
     * K-Means++: each further centroid is drawn with probability proportional to its squared distance
     * from the closest centroid chosen so far.
     */
    private VectorFloat<?> chooseInitialCentroids() {
        VectorFloat<?> result = vectorTypeSupport.createFloatVector(k * dimension);

        float[] distances = new float[points.length];
        Arrays.fill(distances, Float.MAX_VALUE);

        VectorFloat<?> first = points[random.nextInt(points.length)];
        result.copyFrom(first, 0, 0, dimension);
        updateDistances(distances, first);

        for (int i = 1; i < k; i++) {
            double total = 0;
            for (float d : distances) {
                total += d;
            }
            int selected = -1;
            if (total > 0) {
                double r = random.nextDouble() * total;
                for (int j = 0; j < points.length; j++) {
                    r -= distances[j];
                    if (r <= 0) {
                        selected = j;
                        break;
                    }
                }
            }
            if (selected == -1) {
                // fewer distinct points than clusters, or rounding left r positive
                selected = random.nextInt(points.length);
            }
            VectorFloat<?> next = points[selected];
            result.copyFrom(next, 0, i * dimension, dimension);
            updateDistances(distances, next);
        }
        return result;
    }

    private void updateDistances(float[] distances, VectorFloat<?> centroid) {
        for (int j = 0; j < points.length; j++) {
            distances[j] = Math.min(distances[j], VectorUtil.squareL2Distance(points[j], centroid));
        }
    }
}

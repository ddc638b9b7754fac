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

import io.github.proxgraph.ProxGraphTestCase;
import io.github.proxgraph.vector.VectorUtil;
import io.github.proxgraph.vector.types.VectorFloat;
import org.junit.Test;

import java.util.Random;

import static io.github.proxgraph.TestUtil.vector;
import static io.github.proxgraph.TestUtil.vts;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class TestKMeansPlusPlusClusterer extends ProxGraphTestCase {
    private static final float[][] CENTERS = {{0, 0}, {10, 10}, {-10, 10}};

    private VectorFloat<?>[] blobs(int perBlob) {
        var points = new VectorFloat<?>[CENTERS.length * perBlob];
        for (int i = 0; i < points.length; i++) {
            var center = CENTERS[i % CENTERS.length];
            points[i] = vector(center[0] + (float) getRandom().nextGaussian() * 0.5f,
                               center[1] + (float) getRandom().nextGaussian() * 0.5f);
        }
        return points;
    }

    @Test
    public void testFindsSeparatedClusters() {
        var clusterer = new KMeansPlusPlusClusterer(blobs(100), 3, new Random(randomLong()));
        var centroids = clusterer.cluster(QuantizerConfig.DEFAULT_ITERATIONS);
        for (var center : CENTERS) {
            int nearest = KMeansPlusPlusClusterer.nearestCentroid(vector(center), 0, centroids, 3, 2);
            var centroid = vts.createFloatVector(2);
            centroid.copyFrom(centroids, nearest * 2, 0, 2);
            assertTrue(VectorUtil.squareL2Distance(centroid, vector(center)) < 0.25f);
        }
        assertTrue(clusterer.meanSquaredError() < 1.0);
    }

    @Test
    public void testSameSeedSameCentroids() {
        var points = blobs(50);
        long seed = randomLong();
        var a = new KMeansPlusPlusClusterer(points, 4, new Random(seed)).cluster(10);
        var b = new KMeansPlusPlusClusterer(points, 4, new Random(seed)).cluster(10);
        assertEquals(a, b);
    }

    @Test
    public void testMoreClustersThanDistinctPoints() {
        var points = new VectorFloat<?>[] {vector(1, 1), vector(1, 1), vector(2, 2)};
        var clusterer = new KMeansPlusPlusClusterer(points, 8, new Random(randomLong()));
        var centroids = clusterer.cluster(5);
        assertEquals(16, centroids.length());
        assertEquals(0.0, clusterer.meanSquaredError(), 1e-9);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyInput() {
        new KMeansPlusPlusClusterer(new VectorFloat<?>[0], 2, new Random());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveK() {
        new KMeansPlusPlusClusterer(blobs(2), 0, new Random());
    }
}

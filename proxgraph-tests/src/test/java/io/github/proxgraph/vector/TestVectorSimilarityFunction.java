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

import io.github.proxgraph.ProxGraphTestCase;
import org.junit.Test;

import static io.github.proxgraph.TestUtil.vector;
import static io.github.proxgraph.vector.VectorSimilarityFunction.COSINE;
import static io.github.proxgraph.vector.VectorSimilarityFunction.DOT_PRODUCT;
import static io.github.proxgraph.vector.VectorSimilarityFunction.EUCLIDEAN;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TestVectorSimilarityFunction extends ProxGraphTestCase {
    @Test
    public void testEuclidean() {
        var a = vector(0, 0, 0, 0);
        var b = vector(1, 0, 0, 0);
        var c = vector(2, 0, 0, 0);
        assertTrue(EUCLIDEAN.compare(a, b) > EUCLIDEAN.compare(a, c));
        assertEquals(1f, EUCLIDEAN.toReportedScore(EUCLIDEAN.compare(a, b)), 0f);
        assertEquals(2f, EUCLIDEAN.toReportedScore(EUCLIDEAN.compare(a, c)), 0f);
        assertEquals(0f, EUCLIDEAN.toReportedScore(EUCLIDEAN.compare(c, c)), 0f);
        assertTrue(EUCLIDEAN.isReportedAscending());
    }

    @Test
    public void testDotProduct() {
        var a = vector(1, 2);
        var b = vector(3, -1);
        assertEquals(1f, DOT_PRODUCT.compare(a, b), 0f);
        assertEquals(1f, DOT_PRODUCT.toReportedScore(1f), 0f);
        assertFalse(DOT_PRODUCT.isReportedAscending());
    }

    @Test
    public void testCosine() {
        var a = vector(1, 0);
        assertEquals(0f, COSINE.toReportedScore(COSINE.compare(a, vector(5, 0))), 1e-6f);
        assertEquals(1f, COSINE.toReportedScore(COSINE.compare(a, vector(0, 3))), 1e-6f);
        assertEquals(2f, COSINE.toReportedScore(COSINE.compare(a, vector(-2, 0))), 1e-6f);
        // a zero vector is orthogonal to everything
        assertEquals(0f, COSINE.compare(a, vector(0, 0)), 0f);
    }

    @Test
    public void testParse() {
        assertEquals(EUCLIDEAN, VectorSimilarityFunction.parse("L2"));
        assertEquals(EUCLIDEAN, VectorSimilarityFunction.parse("euclidean"));
        assertEquals(DOT_PRODUCT, VectorSimilarityFunction.parse("dot"));
        assertEquals(COSINE, VectorSimilarityFunction.parse("COSINE"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testParseUnknown() {
        VectorSimilarityFunction.parse("manhattan");
    }
}

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
import static io.github.proxgraph.TestUtil.vts;
import static org.junit.Assert.assertEquals;

public class TestVectorUtil extends ProxGraphTestCase {
    @Test
    public void testBasicOperations() {
        var a = vector(1, 2, 3);
        var b = vector(4, 5, 6);
        assertEquals(32f, VectorUtil.dotProduct(a, b), 0f);
        assertEquals(27f, VectorUtil.squareL2Distance(a, b), 0f);
        assertEquals(6f, VectorUtil.sum(a), 0f);
        assertEquals(3f, VectorUtil.max(a), 0f);
        assertEquals(1f, VectorUtil.min(a), 0f);
        assertEquals(vector(3, 3, 3), VectorUtil.sub(b, a));
    }

    @Test
    public void testSubvectorOperations() {
        var a = vector(9, 1, 2, 9);
        var b = vector(1, 2);
        assertEquals(5f, VectorUtil.dotProduct(a, 1, b, 0, 2), 0f);
        assertEquals(0f, VectorUtil.squareL2Distance(a, 1, b, 0, 2), 0f);
    }

    @Test
    public void testNormalize() {
        var v = vector(3, 4);
        VectorUtil.l2normalize(v);
        assertEquals(0.6f, v.get(0), 1e-6f);
        assertEquals(0.8f, v.get(1), 1e-6f);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNormalizeZero() {
        VectorUtil.l2normalize(vector(0, 0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDimensionMismatch() {
        VectorUtil.dotProduct(vector(1, 2), vector(1, 2, 3));
    }

    @Test
    public void testAssembleAndSum() {
        // two sub-codes over a table two entries wide
        var table = vector(1, 2, 10, 20);
        var codes = vts.createByteSequence(2);
        codes.set(0, (byte) 1);
        codes.set(1, (byte) 0);
        assertEquals(12f, VectorUtil.assembleAndSum(table, 2, codes), 0f);
    }
}

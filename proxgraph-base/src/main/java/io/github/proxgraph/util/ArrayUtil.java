/*
 * All changes to the original code are Copyright DataStax, Inc.
 *
 * Please see the included license file for details.
 */

/*
 * Original license:
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.proxgraph.util;

import java.util.Arrays;

/** Methods for manipulating arrays. */
public final class ArrayUtil {
    /** Maximum length for an array; we set this to "a bit" below Integer.MAX_VALUE. */
    public static final int MAX_ARRAY_LENGTH = Integer.MAX_VALUE - 16;

    private ArrayUtil() {}

    /**
     * Returns an array size &gt;= minTargetSize, generally over-allocating exponentially to
     * achieve amortized linear-time cost as the array grows.
     *
     * @param minTargetSize Minimum required value to be returned.
     * @param bytesPerElement Bytes used by each element of the array.
     */
    public static int oversize(int minTargetSize, int bytesPerElement) {
        if (minTargetSize < 0) {
            throw new IllegalArgumentException("invalid array size " + minTargetSize);
        }
        if (minTargetSize == 0) {
            return 0;
        }
        if (minTargetSize > MAX_ARRAY_LENGTH) {
            throw new IllegalArgumentException("requested array size " + minTargetSize
                    + " exceeds maximum array in java (" + MAX_ARRAY_LENGTH + ")");
        }

        // asymptotic exponential growth by 1/8th, favoring small arrays
        int extra = minTargetSize >> 3;
        if (extra < 3) {
            extra = 3;
        }
        int newSize = minTargetSize + extra;
        if (newSize + 7 < 0 || newSize + 7 > MAX_ARRAY_LENGTH) {
            return MAX_ARRAY_LENGTH;
        }

        // round up to a multiple of 8 bytes
        switch (bytesPerElement) {
            case 4:
                return (newSize + 1) & 0x7ffffffe;
            case 2:
                return (newSize + 3) & 0x7ffffffc;
            case 1:
                return (newSize + 7) & 0x7ffffff8;
            default:
                return newSize;
        }
    }

    /** Returns a larger array, generally over-allocating exponentially */
    public static int[] grow(int[] array) {
        return Arrays.copyOf(array, oversize(array.length + 1, Integer.BYTES));
    }

    /** Returns a new array whose size is exactly the specified {@code newLength} */
    public static float[] growExact(float[] array, int newLength) {
        return Arrays.copyOf(array, newLength);
    }

    /** Returns an array whose size is at least {@code minSize}, generally over-allocating exponentially */
    public static long[] grow(long[] array, int minSize) {
        assert minSize >= 0 : "size must be positive (got " + minSize + "): likely integer overflow?";
        if (array.length < minSize) {
            return Arrays.copyOf(array, oversize(minSize, Long.BYTES));
        }
        return array;
    }
}

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

package io.github.proxgraph.util;

import java.util.Arrays;

/**
 * A bitset of fixed length, backed by a long[].  Not threadsafe; used as scratch space
 * (e.g. the positions selected by a diversity pruner).
 */
public final class FixedBitSet implements Bits {
    /** Returned by {@link #nextSetBit(int)} when there are no more set bits. */
    public static final int NO_MORE_BITS = Integer.MAX_VALUE;

    private final long[] bits;
    private final int numBits;

    public FixedBitSet(int numBits) {
        this.numBits = numBits;
        this.bits = new long[bits2words(numBits)];
    }

    /** Returns the number of 64 bit words it would take to hold numBits */
    public static int bits2words(int numBits) {
        return ((numBits - 1) >> 6) + 1;
    }

    public int length() {
        return numBits;
    }

    @Override
    public boolean get(int index) {
        assert index >= 0 && index < numBits : "index=" + index + ", numBits=" + numBits;
        int i = index >> 6;
        long bitmask = 1L << index;
        return (bits[i] & bitmask) != 0;
    }

    public void set(int index) {
        assert index >= 0 && index < numBits : "index=" + index + ", numBits=" + numBits;
        int wordNum = index >> 6;
        long bitmask = 1L << index;
        bits[wordNum] |= bitmask;
    }

    public void clear(int index) {
        assert index >= 0 && index < numBits : "index=" + index + ", numBits=" + numBits;
        int wordNum = index >> 6;
        long bitmask = 1L << index;
        bits[wordNum] &= ~bitmask;
    }

    public void clear() {
        Arrays.fill(bits, 0L);
    }

    public int cardinality() {
        int count = 0;
        for (long word : bits) {
            count += Long.bitCount(word);
        }
        return count;
    }

    /**
     * @return the index of the first set bit at or after {@code index}, or {@link #NO_MORE_BITS}
     */
    public int nextSetBit(int index) {
        if (index >= numBits) {
            return NO_MORE_BITS;
        }
        int i = index >> 6;
        long word = bits[i] >> index; // skip all the bits to the right of index

        if (word != 0) {
            return index + Long.numberOfTrailingZeros(word);
        }

        while (++i < bits.length) {
            word = bits[i];
            if (word != 0) {
                int next = (i << 6) + Long.numberOfTrailingZeros(word);
                return next < numBits ? next : NO_MORE_BITS;
            }
        }

        return NO_MORE_BITS;
    }

    @Override
    public String toString() {
        return "FixedBitSet(length=" + numBits + ", cardinality=" + cardinality() + ")";
    }
}

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

import java.util.concurrent.atomic.AtomicLongArray;

/**
 * A bitset that readers may query without locking while a single writer at a time sets,
 * clears, and grows it.  Growing copies the words into a larger array and publishes it
 * through a volatile reference, so a reader sees either the old or the new array, never
 * a partially-copied one.
 * <p>
 * Writers must be externally serialized.
 */
public final class GrowableAtomicBitSet implements Bits {
    private volatile AtomicLongArray words;

    public GrowableAtomicBitSet(int initialBits) {
        this.words = new AtomicLongArray(FixedBitSet.bits2words(Math.max(initialBits, 64)));
    }

    @Override
    public boolean get(int index) {
        var w = words;
        int i = index >> 6;
        if (i >= w.length()) {
            return false;
        }
        return (w.get(i) & (1L << index)) != 0;
    }

    public void set(int index) {
        ensureCapacity(index);
        int i = index >> 6;
        long bitmask = 1L << index;
        words.getAndUpdate(i, word -> word | bitmask);
    }

    public void clear(int index) {
        var w = words;
        int i = index >> 6;
        if (i >= w.length()) {
            return;
        }
        long bitmask = 1L << index;
        w.getAndUpdate(i, word -> word & ~bitmask);
    }

    public int cardinality() {
        var w = words;
        int count = 0;
        for (int i = 0; i < w.length(); i++) {
            count += Long.bitCount(w.get(i));
        }
        return count;
    }

    private void ensureCapacity(int index) {
        var w = words;
        int needed = (index >> 6) + 1;
        if (needed <= w.length()) {
            return;
        }
        var grown = new AtomicLongArray(ArrayUtil.oversize(needed, Long.BYTES));
        for (int i = 0; i < w.length(); i++) {
            grown.set(i, w.get(i));
        }
        words = grown;
    }
}

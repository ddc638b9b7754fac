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

/**
 * Interface for Bitset-like structures.  Used by graph searches to decide which ordinals
 * are acceptable results.
 */
public interface Bits {
    /** A Bits instance where all bits are set. */
    Bits ALL = new MatchAllBits();

    /** A Bits instance where no bits are set. */
    Bits NONE = new MatchNoBits();

    /**
     * Returns the value of the bit with the specified <code>index</code>.
     *
     * @param index index, should be non-negative. The result of passing
     *     negative or out of bounds values is undefined by this interface, <b>just don't do it!</b>
     * @return <code>true</code> if the bit is set, <code>false</code> otherwise.
     */
    boolean get(int index);

    /**
     * Returns a Bits instance that is the inverse of the given Bits.
     * @param bits the Bits to invert
     * @return a Bits instance representing the inverse
     */
    static Bits inverseOf(Bits bits) {
        if (bits instanceof MatchAllBits) {
            return NONE;
        }
        if (bits instanceof MatchNoBits) {
            return ALL;
        }
        return index -> !bits.get(index);
    }

    /**
     * Returns a Bits instance representing the intersection of two Bits instances.
     * @param a the first Bits instance
     * @param b the second Bits instance
     * @return a Bits instance representing the intersection of {@code a} and {@code b}
     */
    static Bits intersectionOf(Bits a, Bits b) {
        if (a instanceof MatchAllBits) {
            return b;
        }
        if (b instanceof MatchAllBits) {
            return a;
        }
        if (a instanceof MatchNoBits) {
            return a;
        }
        if (b instanceof MatchNoBits) {
            return b;
        }
        return index -> a.get(index) && b.get(index);
    }

    /** Bits impl of the specified length with all bits set. */
    class MatchAllBits implements Bits {
        @Override
        public boolean get(int index) {
            return true;
        }
    }

    /** Bits impl of the specified length with no bits set. */
    class MatchNoBits implements Bits {
        @Override
        public boolean get(int index) {
            return false;
        }
    }
}

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

import io.github.proxgraph.vector.types.ByteSequence;

import java.util.Arrays;

/**
 * ByteSequence backed by a region of an on-heap byte array.  Slices share the array.
 */
public class ArrayByteSequence implements ByteSequence<byte[]>
{
    private final byte[] data;
    private final int offset;
    private final int length;

    ArrayByteSequence(int length) {
        this(new byte[length], 0, length);
    }

    ArrayByteSequence(byte[] data) {
        this(data, 0, data.length);
    }

    private ArrayByteSequence(byte[] data, int offset, int length) {
        this.data = data;
        this.offset = offset;
        this.length = length;
    }

    @Override
    public byte[] get() {
        return data;
    }

    @Override
    public int offset() {
        return offset;
    }

    @Override
    public byte get(int n) {
        return data[offset + n];
    }

    @Override
    public void set(int n, byte value) {
        data[offset + n] = value;
    }

    @Override
    public void zero() {
        Arrays.fill(data, offset, offset + length, (byte) 0);
    }

    @Override
    public int length() {
        return length;
    }

    @Override
    public ByteSequence<byte[]> copy() {
        return new ArrayByteSequence(Arrays.copyOfRange(data, offset, offset + length));
    }

    @Override
    public ByteSequence<byte[]> slice(int sliceOffset, int sliceLength) {
        if (sliceOffset < 0 || sliceLength < 0 || sliceOffset + sliceLength > length) {
            throw new IllegalArgumentException(String.format("Invalid slice [%d, %d) of sequence of length %d",
                                                             sliceOffset, sliceOffset + sliceLength, length));
        }
        return new ArrayByteSequence(data, offset + sliceOffset, sliceLength);
    }

    @Override
    public void copyFrom(ByteSequence<?> src, int srcOffset, int destOffset, int copyLength) {
        ArrayByteSequence csrc = (ArrayByteSequence) src;
        System.arraycopy(csrc.data, csrc.offset + srcOffset, data, offset + destOffset, copyLength);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < Math.min(length, 25); i++) {
            sb.append(Byte.toUnsignedInt(get(i)));
            if (i < length - 1) {
                sb.append(", ");
            }
        }
        if (length > 25) {
            sb.append("...");
        }
        return sb.append("]").toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArrayByteSequence)) return false;
        ArrayByteSequence that = (ArrayByteSequence) o;
        return Arrays.equals(data, offset, offset + length, that.data, that.offset, that.offset + that.length);
    }

    @Override
    public int hashCode() {
        return getHashCode();
    }
}

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
import io.github.proxgraph.vector.types.VectorFloat;
import io.github.proxgraph.vector.types.VectorTypeSupport;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;

/**
 * VectorTypeSupport using on-heap arrays
 */
public class ArrayVectorProvider implements VectorTypeSupport
{
    @Override
    public VectorFloat<?> createFloatVector(Object data)
    {
        if (data instanceof float[]) {
            return new ArrayVectorFloat((float[]) data);
        }
        throw new UnsupportedOperationException("Unsupported data type: " + data.getClass().getName());
    }

    @Override
    public VectorFloat<?> createFloatVector(int length)
    {
        return new ArrayVectorFloat(length);
    }

    @Override
    public VectorFloat<?> readFloatVector(DataInput in, int size) throws IOException
    {
        float[] vector = new float[size];
        for (int i = 0; i < size; i++) {
            vector[i] = in.readFloat();
        }
        return new ArrayVectorFloat(vector);
    }

    @Override
    public void writeFloatVector(DataOutput out, VectorFloat<?> vector) throws IOException
    {
        for (int i = 0; i < vector.length(); i++) {
            out.writeFloat(vector.get(i));
        }
    }

    @Override
    public ByteSequence<?> createByteSequence(Object data)
    {
        if (data instanceof byte[]) {
            return new ArrayByteSequence((byte[]) data);
        }
        throw new UnsupportedOperationException("Unsupported data type: " + data.getClass().getName());
    }

    @Override
    public ByteSequence<?> createByteSequence(int length)
    {
        return new ArrayByteSequence(length);
    }

    @Override
    public ByteSequence<?> readByteSequence(DataInput in, int size) throws IOException
    {
        byte[] bytes = new byte[size];
        in.readFully(bytes);
        return new ArrayByteSequence(bytes);
    }

    @Override
    public void writeByteSequence(DataOutput out, ByteSequence<?> sequence) throws IOException
    {
        for (int i = 0; i < sequence.length(); i++) {
            out.writeByte(sequence.get(i));
        }
    }
}
